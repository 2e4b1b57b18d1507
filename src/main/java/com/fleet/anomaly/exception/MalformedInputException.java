package com.fleet.anomaly.exception;

/**
 * A scan record is missing a required field, carries an invalid process count,
 * or the input batch is empty or unreadable.
 */
public class MalformedInputException extends AnalysisException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
