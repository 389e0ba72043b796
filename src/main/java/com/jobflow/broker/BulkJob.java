package com.jobflow.broker;

import java.util.Objects;

/**
 * One entry of a bulk enqueue.
 */
public final class BulkJob {

    private final String name;
    private final String data;
    private final JobOptions options;

    public BulkJob(String name, String data, JobOptions options) {
        this.name = Objects.requireNonNull(name, "name");
        this.data = data;
        this.options = options != null ? options : JobOptions.empty();
    }

    public String getName() {
        return name;
    }

    public String getData() {
        return data;
    }

    public JobOptions getOptions() {
        return options;
    }
}
