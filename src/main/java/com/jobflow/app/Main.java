package com.jobflow.app;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.config.BrokerSettings;
import com.jobflow.config.WorkerSettings;
import com.jobflow.core.JobRegistry;
import com.jobflow.db.Database;
import com.jobflow.db.JdbcBroker;
import com.jobflow.db.JdbcDataContext;
import com.jobflow.engine.WorkerRuntime;
import com.jobflow.scheduling.SchedulerRegistry;

/**
 * Entry point of a worker process.
 *
 * <p>Startup sequence:</p>
 * <ol>
 *   <li>Read settings from the environment and configure logging</li>
 *   <li>Open and initialize the broker database</li>
 *   <li>Open the data context handed to job handlers</li>
 *   <li>Discover {@link JobModule}s and let them register jobs and schedulers</li>
 *   <li>Start the {@link WorkerRuntime}</li>
 *   <li>Start the {@link HealthServer} (unless disabled)</li>
 *   <li>Add a shutdown hook for graceful shutdown</li>
 * </ol>
 *
 * <p>Exit codes: 0 after a graceful shutdown (SIGTERM / SIGINT), 1 when startup fails or an
 * exception escapes any thread.</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private final WorkerRuntime runtime;
    private final HealthServer healthServer;

    private Main(WorkerRuntime runtime, HealthServer healthServer) {
        this.runtime = runtime;
        this.healthServer = healthServer;
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, e) -> {
            logger.log(Level.SEVERE, "Uncaught exception in thread " + thread.getName() + ", halting", e);
            Runtime.getRuntime().halt(1);
        });

        Main main;
        try {
            WorkerSettings workerSettings = WorkerSettings.fromEnvironment();
            LoggingSetup.configure(workerSettings.isDebug());
            logger.info("=== Jobflow worker starting ===");

            BrokerSettings brokerSettings = BrokerSettings.fromEnvironment();
            logger.info("Using " + brokerSettings + ", " + workerSettings);

            main = boot(brokerSettings, workerSettings, JobModule.load(Main.class.getClassLoader()));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            main.shutdown();
            // A signal-initiated exit would otherwise report 128 + signal number
            Runtime.getRuntime().halt(0);
        }, "jobflow-shutdown"));

        logger.info("=== Jobflow worker is running ===");
    }

    /**
     * Wire and start a worker process.
     *
     * @throws RuntimeException if any startup step fails; resources acquired so far are released
     */
    static Main boot(BrokerSettings brokerSettings, WorkerSettings workerSettings, List<JobModule> modules) {
        Database brokerDatabase = brokerSettings.openBrokerDatabase();
        JdbcDataContext dataContext;
        JdbcBroker broker;
        try {
            broker = new JdbcBroker(brokerDatabase);
            broker.initialize();
            dataContext = new JdbcDataContext(brokerSettings.openDataDatabase());
        } catch (RuntimeException e) {
            brokerDatabase.close();
            throw e;
        }

        JobRegistry registry = new JobRegistry(broker);
        SchedulerRegistry schedulers = new SchedulerRegistry(registry);
        WorkerRuntime runtime = WorkerRuntime.builder(broker, registry, dataContext)
                .schedulerRegistry(schedulers)
                .concurrency(workerSettings.getQueueConcurrency())
                .build();

        try {
            for (JobModule module : modules) {
                module.register(registry, schedulers);
                logger.info("Loaded job module " + module.getClass().getName());
            }
            logger.info(registry.getDefinitions().size() + " job(s) registered on queues " + runtime.getQueueNames());
        } catch (RuntimeException e) {
            runtime.shutdown();
            throw e;
        }

        runtime.start();
        if (runtime.getWorkers().isEmpty()) {
            logger.warning("No queues to consume; register jobs through a JobModule");
        }

        HealthServer healthServer = null;
        if (workerSettings.isHealthServerEnabled()) {
            healthServer = new HealthServer(runtime, workerSettings.getHealthPort());
            try {
                healthServer.start();
            } catch (IOException e) {
                runtime.shutdown();
                throw new UncheckedIOException("Failed to start health server on port "
                        + workerSettings.getHealthPort(), e);
            }
        }
        return new Main(runtime, healthServer);
    }

    /**
     * Stop the health server and the runtime. Errors are logged and swallowed.
     */
    void shutdown() {
        if (healthServer != null) {
            try {
                healthServer.stop();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error stopping health server", e);
            }
        }
        runtime.shutdown();
        logger.info("=== Jobflow worker stopped ===");
    }

    WorkerRuntime getRuntime() {
        return runtime;
    }

    HealthServer getHealthServer() {
        return healthServer;
    }
}
