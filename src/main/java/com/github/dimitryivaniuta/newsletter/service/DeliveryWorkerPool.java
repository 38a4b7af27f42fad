package com.github.dimitryivaniuta.newsletter.service;

import com.github.dimitryivaniuta.newsletter.config.AppProperties;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Pool of independent delivery workers.
 *
 * <p>There is no dispatcher: every worker polls the queue table on its own, so the queue is the only
 * coordination point and any number of pools (in this or other processes) can drain it side by side.
 * Each worker loops over {@link DeliveryTaskExecutor#tryExecuteTask}:
 * <ul>
 *   <li>task handled: poll again immediately;</li>
 *   <li>queue empty: sleep {@code pollInterval};</li>
 *   <li>iteration failed (e.g. database unreachable): log, sleep {@code errorBackoff}, start over.
 *       Nothing was half-written because the whole cycle is one transaction.</li>
 * </ul>
 *
 * <p>Started with the application context when {@code app.delivery.worker.enabled=true}.</p>
 */
@Component
public class DeliveryWorkerPool implements SmartLifecycle {

    /** MDC key for the worker id. */
    public static final String MDC_WORKER_ID = "workerId";

    private static final Logger log = LoggerFactory.getLogger(DeliveryWorkerPool.class);

    private final DeliveryTaskExecutor taskExecutor;
    private final AppProperties properties;

    private final Object monitor = new Object();
    private ExecutorService workers;
    private CountDownLatch stopSignal;

    /**
     * Creates the pool.
     *
     * @param taskExecutor transactional task executor
     * @param properties app properties
     */
    public DeliveryWorkerPool(DeliveryTaskExecutor taskExecutor, AppProperties properties) {
        this.taskExecutor = taskExecutor;
        this.properties = properties;
    }

    /**
     * Runs {@code poolSize} workers and blocks until {@link #shutdown()} is called.
     *
     * <p>Interrupting the calling thread shuts the pool down as well.</p>
     *
     * <p>For embedding the pool in a process of its own: with {@code app.delivery.worker.enabled=true} the pool
     * is already started with the application context and this method fails with
     * {@link IllegalStateException}.</p>
     *
     * @param poolSize number of workers
     * @param pollInterval idle sleep when the queue is empty
     * @param maxRetries delivery attempts per task before it is dropped
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws IllegalStateException if the pool is already running
     */
    public void runWorker(int poolSize, Duration pollInterval, int maxRetries) throws InterruptedException {
        CountDownLatch signal = start(poolSize, pollInterval, maxRetries);
        try {
            signal.await();
        } finally {
            stopPool(signal);
        }
    }

    /**
     * Starts {@code poolSize} workers and returns immediately.
     *
     * @param poolSize number of workers
     * @param pollInterval idle sleep when the queue is empty
     * @param maxRetries delivery attempts per task before it is dropped
     * @return latch released when the pool is asked to stop
     */
    public CountDownLatch start(int poolSize, Duration pollInterval, int maxRetries) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must not be negative");
        }

        synchronized (monitor) {
            if (workers != null) {
                throw new IllegalStateException("Delivery worker pool is already running");
            }
            stopSignal = new CountDownLatch(1);
            workers = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("newsletter-delivery-"));
            for (int i = 1; i <= poolSize; i++) {
                workers.execute(new Worker("delivery-worker-" + i, pollInterval, maxRetries, stopSignal));
            }
            log.info("Started {} newsletter delivery workers. pollInterval={} maxRetries={}", poolSize, pollInterval, maxRetries);
            return stopSignal;
        }
    }

    /**
     * Asks every worker to stop after its current task and waits up to {@code shutdownTimeout} for them.
     * Does nothing if the pool is not running.
     */
    public void shutdown() {
        stopPool(null);
    }

    private void stopPool(CountDownLatch expectedSignal) {
        ExecutorService running;
        synchronized (monitor) {
            if (workers == null || (expectedSignal != null && expectedSignal != stopSignal)) {
                return;
            }
            running = workers;
            stopSignal.countDown();
            workers = null;
            stopSignal = null;
        }

        running.shutdown();
        Duration timeout = properties.getDelivery().getWorker().getShutdownTimeout();
        try {
            if (!running.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Delivery workers did not finish within {}; interrupting", timeout);
                running.shutdownNow();
            }
        } catch (InterruptedException ex) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Newsletter delivery workers stopped");
    }

    @Override
    public void start() {
        AppProperties.Worker worker = properties.getDelivery().getWorker();
        if (!worker.isEnabled()) {
            log.info("Newsletter delivery workers disabled (app.delivery.worker.enabled=false)");
            return;
        }
        start(worker.getPoolSize(), worker.getPollInterval(), worker.getMaxRetries());
    }

    @Override
    public void stop() {
        shutdown();
    }

    @Override
    public boolean isRunning() {
        synchronized (monitor) {
            return workers != null;
        }
    }

    private final class Worker implements Runnable {

        private final String workerId;
        private final Duration pollInterval;
        private final int maxRetries;
        private final CountDownLatch stopSignal;

        private Worker(String workerId, Duration pollInterval, int maxRetries, CountDownLatch stopSignal) {
            this.workerId = workerId;
            this.pollInterval = pollInterval;
            this.maxRetries = maxRetries;
            this.stopSignal = stopSignal;
        }

        @Override
        public void run() {
            MDC.put(MDC_WORKER_ID, workerId);
            try {
                boolean stopped = false;
                while (!stopped) {
                    stopped = runOnce();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (Error err) {
                log.error("Delivery worker {} died; pool continues with fewer workers", workerId, err);
                throw err;
            } finally {
                MDC.remove(MDC_WORKER_ID);
            }
        }

        /**
         * @return true once the pool asked this worker to stop
         */
        private boolean runOnce() throws InterruptedException {
            if (stopSignal.getCount() == 0) {
                return true;
            }
            try {
                ExecutionOutcome outcome = taskExecutor.tryExecuteTask(workerId, maxRetries);
                if (outcome == ExecutionOutcome.EMPTY_QUEUE) {
                    return pause(pollInterval);
                }
                return false;
            } catch (DataAccessException ex) {
                log.warn("Delivery queue storage unavailable; retrying in {}. error={}", errorBackoff(), ex.getMessage());
                return pause(errorBackoff());
            } catch (RuntimeException ex) {
                log.error("Delivery worker iteration failed; retrying in {}", errorBackoff(), ex);
                return pause(errorBackoff());
            }
        }

        private boolean pause(Duration duration) throws InterruptedException {
            return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        }

        private Duration errorBackoff() {
            return properties.getDelivery().getWorker().getErrorBackoff();
        }
    }
}
