package com.z254.insight.prism.error;

/**
 * Base type for failures surfaced by the PRISM pipeline.
 */
public class PrismException extends RuntimeException {

    public PrismException(String message) {
        super(message);
    }

    public PrismException(String message, Throwable cause) {
        super(message, cause);
    }
}
