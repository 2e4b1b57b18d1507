package com.fleet.anomaly.controller;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fleet.anomaly.exception.AnalysisException;
import com.fleet.anomaly.exception.InsufficientDataException;
import com.fleet.anomaly.exception.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class AnalysisExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisExceptionHandler.class);

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, String>> handleAnalysisFailure(AnalysisException e) {
        // Not enough devices is a property of the data, not of the request shape
        HttpStatus status = e instanceof InsufficientDataException
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        log.warn("Analysis rejected ({}): {}", e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getMessage(), "type", e.getClass().getSimpleName()));
    }

    /**
     * A body Jackson cannot bind (non-integer process count, broken JSON) is malformed input.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        String message = "Unreadable request body";
        if (e.getCause() instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            message += " at " + pathOf(mapping);
        }
        log.warn("Analysis rejected (MalformedInputException): {} - {}", message, e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("error", message, "type", MalformedInputException.class.getSimpleName()));
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) path.append('.');
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.toString();
    }
}
