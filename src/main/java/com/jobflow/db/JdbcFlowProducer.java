package com.jobflow.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerException;
import com.jobflow.broker.FlowJob;
import com.jobflow.broker.FlowProducer;
import com.jobflow.broker.JobNode;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.JobState;
import com.jobflow.db.JobRepository.JobRow;

/**
 * {@link FlowProducer} writing a whole tree in one transaction.
 *
 * <p>Nodes are inserted parent first. A node with children starts in WAITING_CHILDREN and gets one
 * {@code job_dependencies} row per child; a leaf starts WAITING (or DELAYED). The parent is released
 * by the queue of its last child when that child completes.</p>
 *
 * <p>A root whose custom job id already exists in its queue is not added again: the existing job
 * is returned and no child is inserted. A child whose custom id already exists is rejected, since
 * an existing job cannot start waiting on a new parent.</p>
 *
 * <p>The job handles of a returned {@link JobNode} stay usable after the producer is closed.</p>
 */
class JdbcFlowProducer implements FlowProducer {
    private static final Logger logger = Logger.getLogger(JdbcFlowProducer.class.getName());

    private final JdbcBroker broker;
    private final Map<String, JdbcQueue> queues = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    JdbcFlowProducer(JdbcBroker broker) {
        this.broker = broker;
    }

    @Override
    public JobNode add(FlowJob flow) {
        if (closed) {
            throw new BrokerException("Flow producer is closed");
        }

        try {
            JobNode root = broker.database().inTransaction(conn -> insertNode(conn, flow, null, broker.now()),
                    JdbcQueue.CONFLICT_ATTEMPTS);
            logger.fine("Added flow " + flow.getQueueName() + ":" + root.getJob().getId() + " (" + flow.getName() + ")");
            return root;
        } catch (SQLException e) {
            throw new BrokerException("Failed to add flow " + flow.getName() + " to queue " + flow.getQueueName(), e);
        }
    }

    private JobNode insertNode(Connection conn, FlowJob node, JobRow parent, long now) throws SQLException {
        JobOptions options = JobOptions.DEFAULTS.mergedWith(node.getOptions());
        if (options.getRepeat() != null) {
            throw new IllegalArgumentException("Flow nodes cannot repeat: " + node.getName());
        }

        long delay = options.getDelay() != null ? options.getDelay() : 0L;
        JobState state;
        if (!node.getChildren().isEmpty()) {
            state = JobState.WAITING_CHILDREN;
        } else {
            state = delay > 0 ? JobState.DELAYED : JobState.WAITING;
        }
        if (options.getJobId() != null) {
            JobRow existing = broker.jobs().find(conn, node.getQueueName(), options.getJobId());
            if (existing != null && parent != null) {
                throw new IllegalArgumentException("Job " + node.getQueueName() + ":" + options.getJobId()
                        + " already exists and cannot become a child of " + parent.getQueueName() + ":"
                        + parent.getId());
            }
            if (existing != null) {
                logger.fine("Flow root " + node.getQueueName() + ":" + options.getJobId() + " already exists");
                return new JobNode(new JdbcJob(existing, queue(node.getQueueName())), List.of());
            }
        }
        String id = options.getJobId() != null ? options.getJobId() : UUID.randomUUID().toString();

        JobRow row = JdbcQueue.newRow(node.getQueueName(), id, node.getName(), node.getData(), options, state,
                now, now + delay);
        if (parent != null) {
            row.setParentQueue(parent.getQueueName());
            row.setParentId(parent.getId());
        }
        broker.jobs().insert(conn, row);

        List<JobNode> children = new ArrayList<>(node.getChildren().size());
        for (FlowJob child : node.getChildren()) {
            JobNode stored = insertNode(conn, child, row, now);
            broker.jobs().insertDependency(conn, row.getQueueName(), row.getId(),
                    child.getQueueName(), stored.getJob().getId());
            children.add(stored);
        }

        JobRow stored = broker.jobs().find(conn, node.getQueueName(), id);
        return new JobNode(new JdbcJob(stored, queue(node.getQueueName())), children);
    }

    private JdbcQueue queue(String name) {
        return queues.computeIfAbsent(name, n -> new JdbcQueue(n, broker));
    }

    /**
     * Stop accepting flows. The queues behind returned job handles hold no resources of their own
     * and are left open, so those handles keep working.
     */
    @Override
    public void close() {
        closed = true;
    }
}
