package com.jobflow.broker;

/**
 * Number of completed and outstanding children of a flow parent.
 */
public final class DependencyCounts {

    private final int processed;
    private final int unprocessed;

    public DependencyCounts(int processed, int unprocessed) {
        this.processed = processed;
        this.unprocessed = unprocessed;
    }

    public int getProcessed() {
        return processed;
    }

    public int getUnprocessed() {
        return unprocessed;
    }

    @Override
    public String toString() {
        return "DependencyCounts{processed=" + processed + ", unprocessed=" + unprocessed + "}";
    }
}
