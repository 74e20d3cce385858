package com.z254.insight.prism.error;

/**
 * Connectivity, authentication or read failure of an issue source.
 * The pipeline never retries; the exception reaches the caller unchanged.
 */
public class IssueSourceException extends PrismException {

    public IssueSourceException(String message) {
        super(message);
    }

    public IssueSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
