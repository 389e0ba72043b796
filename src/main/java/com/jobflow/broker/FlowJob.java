package com.jobflow.broker;

import java.util.List;
import java.util.Objects;

/**
 * Wire form of a flow node: everything the broker needs to store one job plus its children.
 */
public final class FlowJob {

    private final String name;
    private final String queueName;
    private final String data;
    private final JobOptions options;
    private final List<FlowJob> children;

    public FlowJob(String name, String queueName, String data, JobOptions options, List<FlowJob> children) {
        this.name = Objects.requireNonNull(name, "name");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.data = data;
        this.options = options != null ? options : JobOptions.empty();
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getData() {
        return data;
    }

    public JobOptions getOptions() {
        return options;
    }

    public List<FlowJob> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "FlowJob{name='" + name + "', queue='" + queueName + "', children=" + children.size() + "}";
    }
}
