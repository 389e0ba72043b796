package com.jobflow.engine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.ProgressListener;

/**
 * Consumer of one broker queue with bounded concurrency.
 *
 * <p>The QueueWorker polls its queue for due jobs, claims them atomically through the broker and
 * hands them to a fixed-size thread pool. Each claimed job is locked for
 * {@link WorkerOptions#getLockDuration()}; the locks of in-flight jobs are renewed periodically so
 * long-running handlers keep them.</p>
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Claim jobs only while a concurrency slot is free (semaphore of {@code concurrency} permits)</li>
 *   <li>Submit claimed jobs to the worker thread pool as {@link Worker}s</li>
 *   <li>Renew the locks of in-flight jobs</li>
 *   <li>Recover stalled jobs (expired locks) on start and periodically</li>
 *   <li>Forward job progress to listeners</li>
 *   <li>Gracefully shut down with in-flight job completion</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b></p>
 * <ul>
 *   <li>The poll loop runs in its own dedicated thread (non-daemon)</li>
 *   <li>Lock renewal and stalled recovery run on a single maintenance thread</li>
 *   <li>Atomic flags (AtomicBoolean) for thread-safe state management</li>
 *   <li>Broker-level claiming prevents duplicate execution across processes</li>
 * </ul>
 *
 * <p><b>Shutdown:</b> {@link #close()} stops claiming, waits up to
 * {@link WorkerOptions#getShutdownTimeout()} for in-flight jobs, then interrupts them. An
 * interrupted job goes back to waiting without losing an attempt; a job whose handler ignores the
 * interrupt keeps its lock until it expires and is recovered as stalled by the next worker.</p>
 *
 * @see Worker
 * @see WorkerRuntime
 */
public class QueueWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());

    private static final long ERROR_BACKOFF_MILLIS = 2000;

    private final BrokerQueue queue;
    private final JobProcessor processor;
    private final WorkerOptions options;
    private final List<WorkerListener> listeners;
    private final String token;

    private final ExecutorService executorService;
    private final ScheduledExecutorService maintenance;
    private final Semaphore slots;
    private final Map<String, BrokerJob> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger processed = new AtomicInteger();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final ProgressListener progressForwarder = this::fireProgress;
    private Thread pollThread;

    public QueueWorker(BrokerQueue queue, JobProcessor processor, WorkerOptions options, List<WorkerListener> listeners) {
        this.queue = queue;
        this.processor = processor;
        this.options = options;
        this.listeners = List.copyOf(listeners);
        this.token = UUID.randomUUID().toString();
        this.slots = new Semaphore(options.getConcurrency());
        this.executorService = Executors.newFixedThreadPool(options.getConcurrency(),
                namedThreads("jobflow-" + queue.getName() + "-worker"));
        this.maintenance = Executors.newSingleThreadScheduledExecutor(
                namedThreads("jobflow-" + queue.getName() + "-maintenance"));

        logger.info("QueueWorker initialized for queue " + queue.getName() + " with " + options);
    }

    /**
     * Start the poll loop in its own thread. Returns immediately.
     */
    public void start() {
        if (closed.get() || !running.compareAndSet(false, true)) {
            logger.warning("QueueWorker for queue " + queue.getName() + " is already running or closed");
            return;
        }

        queue.addProgressListener(progressForwarder);
        recoverStalledJobs();

        long renewMillis = options.getLockRenewInterval().toMillis();
        maintenance.scheduleWithFixedDelay(this::renewLocks, renewMillis, renewMillis, TimeUnit.MILLISECONDS);
        long stalledMillis = options.getStalledInterval().toMillis();
        maintenance.scheduleWithFixedDelay(this::recoverStalledJobs, stalledMillis, stalledMillis, TimeUnit.MILLISECONDS);

        pollThread = new Thread(this::pollLoop, "jobflow-" + queue.getName() + "-poll");
        pollThread.setDaemon(false);
        pollThread.start();

        fireReady();
    }

    private void pollLoop() {
        long pollMillis = options.getPollInterval().toMillis();

        while (running.get()) {
            try {
                if (!slots.tryAcquire(pollMillis, TimeUnit.MILLISECONDS)) {
                    continue;
                }

                Optional<BrokerJob> claimed;
                try {
                    claimed = running.get() ? queue.moveToActive(token, options.getLockDuration()) : Optional.empty();
                } catch (RuntimeException e) {
                    slots.release();
                    throw e;
                }

                if (claimed.isEmpty()) {
                    // Idle: nothing due, wait before polling again
                    slots.release();
                    pause(pollMillis);
                    continue;
                }

                BrokerJob job = claimed.get();
                inFlight.put(job.getId(), job);
                try {
                    executorService.submit(new Worker(job, this));
                    logger.fine("Job " + job.getId() + " submitted to worker pool of queue " + queue.getName());
                } catch (RejectedExecutionException e) {
                    // Pool already shut down; the lock expires and the job is recovered as stalled
                    release(job);
                    logger.warning("Worker pool of queue " + queue.getName() + " rejected job " + job.getId());
                }

            } catch (InterruptedException e) {
                logger.info("Poll loop of queue " + queue.getName() + " interrupted, shutting down");
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                // Broker unreachable or similar: back off and retry
                fireError(e);
                try {
                    pause(ERROR_BACKOFF_MILLIS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        logger.info("Poll loop of queue " + queue.getName() + " exited");
    }

    // Returns early when close() is called
    private void pause(long millis) throws InterruptedException {
        stopSignal.await(millis, TimeUnit.MILLISECONDS);
    }

    private void renewLocks() {
        if (inFlight.isEmpty()) {
            return;
        }
        try {
            int renewed = queue.extendLocks(token, options.getLockDuration());
            logger.finest("Renewed " + renewed + " lock(s) on queue " + queue.getName());
        } catch (RuntimeException e) {
            fireError(e);
        }
    }

    private void recoverStalledJobs() {
        try {
            int recovered = queue.recoverStalledJobs(options.getMaxStalledCount());
            if (recovered > 0) {
                logger.info("Recovered " + recovered + " stalled job(s) on queue " + queue.getName());
            }
        } catch (RuntimeException e) {
            fireError(e);
        }
    }

    /**
     * Stop claiming and wait for in-flight jobs. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean wasRunning = running.getAndSet(false);
        if (wasRunning) {
            fireClosing();
        }
        logger.info("Initiating graceful shutdown of queue " + queue.getName() + " (" + inFlight.size()
                + " job(s) in flight)");

        stopSignal.countDown();
        if (pollThread != null) {
            try {
                pollThread.join(options.getPollInterval().toMillis() + options.getShutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(options.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Forcing shutdown of " + inFlight.size() + " job(s) on queue " + queue.getName());
                executorService.shutdownNow();

                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe("Worker pool of queue " + queue.getName() + " did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        maintenance.shutdownNow();
        queue.removeProgressListener(progressForwarder);
        logger.info("QueueWorker for queue " + queue.getName() + " closed after " + processed.get() + " job(s)");
    }

    /**
     * Snapshot of the worker state, for health reporting.
     */
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();

        status.put("queue", queue.getName());
        status.put("running", running.get());
        status.put("concurrency", options.getConcurrency());
        status.put("activeJobs", inFlight.size());
        status.put("processedJobs", processed.get());
        status.put("executorShutdown", executorService.isShutdown());
        status.put("executorTerminated", executorService.isTerminated());

        return status;
    }

    /**
     * True once {@link #close()} was called.
     */
    public boolean isClosing() {
        return closed.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getQueueName() {
        return queue.getName();
    }

    public int getActiveJobCount() {
        return inFlight.size();
    }

    // ==================== WORKER SUPPORT ====================

    BrokerQueue getQueue() {
        return queue;
    }

    JobProcessor getProcessor() {
        return processor;
    }

    WorkerOptions getOptions() {
        return options;
    }

    String getToken() {
        return token;
    }

    void release(BrokerJob job) {
        if (inFlight.remove(job.getId()) != null) {
            processed.incrementAndGet();
        }
        slots.release();
    }

    // ==================== LISTENERS ====================

    private void fireReady() {
        notifyListeners(listener -> listener.onReady(queue.getName()));
    }

    void fireActive(BrokerJob job) {
        notifyListeners(listener -> listener.onActive(job));
    }

    private void fireProgress(BrokerJob job, int progress) {
        notifyListeners(listener -> listener.onProgress(job, progress));
    }

    void fireCompleted(BrokerJob job, Object result, long durationMillis) {
        notifyListeners(listener -> listener.onCompleted(job, result, durationMillis));
    }

    void fireFailed(BrokerJob job, Throwable error, boolean willRetry) {
        notifyListeners(listener -> listener.onFailed(job, error, willRetry));
    }

    void fireError(Throwable error) {
        if (listeners.isEmpty()) {
            logger.log(Level.SEVERE, "Worker error on queue " + queue.getName(), error);
        }
        notifyListeners(listener -> listener.onError(queue.getName(), error));
    }

    private void fireClosing() {
        notifyListeners(listener -> listener.onClosing(queue.getName()));
    }

    private void notifyListeners(Consumer<WorkerListener> event) {
        for (WorkerListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Worker listener failed on queue " + queue.getName(), e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
