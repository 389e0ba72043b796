package com.jobflow.core;

import com.jobflow.broker.JobOptions;

/**
 * One entry of {@link JobDefinition#batchTrigger(java.util.List)}.
 */
public final class BatchItem {

    private final Object payload;
    private final JobOptions options;

    public BatchItem(Object payload, JobOptions options) {
        this.payload = payload;
        this.options = options;
    }

    public static BatchItem of(Object payload) {
        return new BatchItem(payload, null);
    }

    public static BatchItem of(Object payload, JobOptions options) {
        return new BatchItem(payload, options);
    }

    public Object getPayload() {
        return payload;
    }

    public JobOptions getOptions() {
        return options;
    }
}
