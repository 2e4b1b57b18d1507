package com.fleet.anomaly.exception;

/**
 * Fewer than two devices have a complete feature vector, so there is nothing to rank.
 */
public class InsufficientDataException extends AnalysisException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
