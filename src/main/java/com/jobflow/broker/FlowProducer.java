package com.jobflow.broker;

/**
 * Submits parent/child job trees. All nodes of one tree are stored in a single transaction, so a
 * parent never becomes visible without its children.
 */
public interface FlowProducer extends AutoCloseable {

    /**
     * Store the tree. Leaves become claimable immediately; every node with children waits in
     * {@link JobState#WAITING_CHILDREN} until all of them completed.
     *
     * @param flow root of the tree
     * @return the stored tree, mirroring the shape of {@code flow}
     */
    JobNode add(FlowJob flow);

    @Override
    void close();
}
