package com.fleet.anomaly.exception;

/**
 * Base type for failures of an analysis run. A run that throws never yields a partial result.
 */
public abstract class AnalysisException extends RuntimeException {

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
