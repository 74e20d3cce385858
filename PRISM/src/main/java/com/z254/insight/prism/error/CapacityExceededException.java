package com.z254.insight.prism.error;

/**
 * The input batch is larger than the configured {@code max-records} ceiling.
 */
public class CapacityExceededException extends PrismException {

    private final long observed;
    private final long allowed;

    public CapacityExceededException(long observed, long allowed) {
        super("Input contains " + observed + " records, more than the allowed maximum of " + allowed);
        this.observed = observed;
        this.allowed = allowed;
    }

    public long getObserved() {
        return observed;
    }

    public long getAllowed() {
        return allowed;
    }
}
