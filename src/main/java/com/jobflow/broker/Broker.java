package com.jobflow.broker;

/**
 * Entry point to the durable broker shared by every process of the system.
 *
 * <p>Callers and workers never talk to each other directly: they enqueue into and consume from
 * queues obtained here. Handles returned by {@link #openQueue(String)} and
 * {@link #openFlowProducer()} are cheap, thread-safe and closed independently of the broker.</p>
 */
public interface Broker extends AutoCloseable {

    /**
     * Open a handle to the named queue. Queues exist implicitly; no creation step is needed.
     */
    BrokerQueue openQueue(String name);

    /**
     * Open a producer able to submit a whole job tree atomically.
     */
    FlowProducer openFlowProducer();

    /**
     * Round-trip to the broker, used as a startup health check.
     *
     * @throws BrokerException if the broker is unreachable
     */
    void ping();

    @Override
    void close();
}
