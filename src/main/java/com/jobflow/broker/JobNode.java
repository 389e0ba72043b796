package com.jobflow.broker;

import java.util.List;

/**
 * A stored flow: the job of one node and the nodes of its children.
 */
public final class JobNode {

    private final BrokerJob job;
    private final List<JobNode> children;

    public JobNode(BrokerJob job, List<JobNode> children) {
        this.job = job;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public BrokerJob getJob() {
        return job;
    }

    public List<JobNode> getChildren() {
        return children;
    }
}
