package com.jobflow.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.jobflow.broker.JobOptions;

/**
 * One node of a job flow: a job definition, its payload, per-node options and its children.
 *
 * <p>Children run before their parent. Siblings run in any order; a child that needs the output
 * of another must be nested one level below it.</p>
 *
 * <pre>{@code
 * FlowNode flow = FlowNode.of(buildReport, Map.of("teamId", "t1"))
 *         .child(FlowNode.of(fetchTransactions, Map.of("teamId", "t1")))
 *         .child(FlowNode.of(fetchInvoices, Map.of("teamId", "t1")));
 * buildReport.triggerFlow(flow);
 * }</pre>
 */
public final class FlowNode {

    private final JobDefinition<?> definition;
    private final Object payload;
    private final JobOptions options;
    private final List<FlowNode> children;

    private FlowNode(JobDefinition<?> definition, Object payload, JobOptions options, List<FlowNode> children) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.payload = payload;
        this.options = options != null ? options : JobOptions.empty();
        this.children = List.copyOf(children);
    }

    public static FlowNode of(JobDefinition<?> definition, Object payload) {
        return new FlowNode(definition, payload, null, List.of());
    }

    /**
     * Copy of this node with {@code options} overriding the definition's own options.
     */
    public FlowNode options(JobOptions options) {
        return new FlowNode(definition, payload, options, children);
    }

    /**
     * Copy of this node with {@code child} appended to its children.
     */
    public FlowNode child(FlowNode child) {
        List<FlowNode> next = new ArrayList<>(children);
        next.add(Objects.requireNonNull(child, "child"));
        return new FlowNode(definition, payload, options, next);
    }

    public FlowNode children(List<FlowNode> children) {
        List<FlowNode> next = new ArrayList<>(this.children);
        next.addAll(children);
        return new FlowNode(definition, payload, options, next);
    }

    public JobDefinition<?> getDefinition() {
        return definition;
    }

    public Object getPayload() {
        return payload;
    }

    public JobOptions getOptions() {
        return options;
    }

    public List<FlowNode> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "FlowNode{job='" + definition.getId() + "', children=" + children.size() + "}";
    }
}
