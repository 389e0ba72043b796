package com.jobflow.core;

import com.jobflow.broker.Broker;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.FlowProducer;

import java.util.ArrayList;
import java.util.List;

/**
 * Broker wrapper that records which queues and flow producers were opened.
 */
public class CountingBroker implements Broker {

    private final Broker delegate;
    private final List<String> openedQueues = new ArrayList<>();
    private int flowProducers = 0;

    public CountingBroker(Broker delegate) {
        this.delegate = delegate;
    }

    @Override
    public synchronized BrokerQueue openQueue(String name) {
        openedQueues.add(name);
        return delegate.openQueue(name);
    }

    @Override
    public synchronized FlowProducer openFlowProducer() {
        flowProducers++;
        return delegate.openFlowProducer();
    }

    @Override
    public void ping() {
        delegate.ping();
    }

    @Override
    public void close() {
        delegate.close();
    }

    public synchronized List<String> getOpenedQueues() {
        return new ArrayList<>(openedQueues);
    }

    public synchronized int getFlowProducers() {
        return flowProducers;
    }
}
