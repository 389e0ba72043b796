package com.jobflow.db;

import java.sql.SQLException;
import java.time.Clock;
import java.util.logging.Logger;

import com.jobflow.broker.Broker;
import com.jobflow.broker.BrokerException;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.FlowProducer;

/**
 * {@link Broker} stored in an H2 database.
 *
 * <p>Every process pointing at the same database shares the same queues. Claims, completions and
 * scheduler upserts are single statements or single transactions, so any number of producer and
 * worker processes can use it concurrently.</p>
 *
 * <pre>{@code
 * Database database = new Database("jdbc:h2:./jobflow;AUTO_SERVER=TRUE", "sa", "");
 * JdbcBroker broker = new JdbcBroker(database);
 * broker.initialize();
 * }</pre>
 */
public class JdbcBroker implements Broker {
    private static final Logger logger = Logger.getLogger(JdbcBroker.class.getName());

    public static final String SCHEMA_RESOURCE = "jobflow-broker-schema.sql";

    private final Database database;
    private final JobRepository jobs;
    private final SchedulerRepository schedulers;
    private final Clock clock;

    public JdbcBroker(Database database) {
        this(database, Clock.systemUTC());
    }

    /**
     * @param clock source of "now" for process times, locks and retention
     */
    public JdbcBroker(Database database, Clock clock) {
        this.database = database;
        this.jobs = new JobRepository(database);
        this.schedulers = new SchedulerRepository(database);
        this.clock = clock;
    }

    /**
     * Create the broker tables if they do not exist yet.
     *
     * @throws BrokerException if the schema cannot be applied
     */
    public void initialize() {
        try {
            database.initialize(SCHEMA_RESOURCE);
        } catch (SQLException e) {
            throw new BrokerException("Failed to initialize broker schema", e);
        }
        logger.info("Broker initialized on " + database.getUrl());
    }

    @Override
    public BrokerQueue openQueue(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        return new JdbcQueue(name, this);
    }

    @Override
    public FlowProducer openFlowProducer() {
        return new JdbcFlowProducer(this);
    }

    @Override
    public void ping() {
        try {
            database.ping();
        } catch (SQLException e) {
            throw new BrokerException("Broker unreachable at " + database.getUrl(), e);
        }
    }

    @Override
    public void close() {
        database.close();
    }

    Database database() {
        return database;
    }

    JobRepository jobs() {
        return jobs;
    }

    SchedulerRepository schedulers() {
        return schedulers;
    }

    long now() {
        return clock.millis();
    }
}
