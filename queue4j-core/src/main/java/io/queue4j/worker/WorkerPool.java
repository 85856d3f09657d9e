package io.queue4j.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Owns a fixed number of {@link Worker} loops.
 *
 * <p>Stopping is cooperative: {@link #stop()} raises the shared {@link ShutdownSignal} and waits
 * for every worker to finish its current job and exit. Running commands are never interrupted.
 */
public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<Worker> workers;
    private final ShutdownSignal signal;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ExecutorService executor;

    /**
     * @param count         number of workers, at least one
     * @param workerFactory creates the worker for a 1-based index
     * @param signal        shutdown signal shared with every worker the factory creates
     */
    public WorkerPool(int count, IntFunction<Worker> workerFactory, ShutdownSignal signal) {
        if (count <= 0) {
            throw new IllegalArgumentException("worker count must be a positive number");
        }
        Objects.requireNonNull(workerFactory, "workerFactory must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");

        List<Worker> created = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            created.add(Objects.requireNonNull(workerFactory.apply(i), "workerFactory returned null"));
        }
        this.workers = Collections.unmodifiableList(created);

        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(count, r -> {
            Thread t = new Thread(r);
            t.setName("queue4j.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<Worker> getWorkers() {
        return workers;
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Starts all workers. A stale stop request left over from a previous run is cleared first.
     * Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        signal.clear();
        for (Worker w : workers) {
            executor.submit(w);
        }
        executor.shutdown();
        log.info("queue4j worker pool started count={}", workers.size());
    }

    /**
     * Requests shutdown and waits for all workers to exit.
     */
    public void stop() {
        log.info("queue4j worker pool stopping; in-flight jobs will finish first");
        signal.request();
        awaitTermination();
    }

    /**
     * Starts the pool and blocks until a stop has been requested and every worker has exited.
     */
    public void runUntilStopped() {
        start();
        awaitTermination();
    }

    /**
     * Blocks until every worker has exited. Never forces termination.
     *
     * @return {@code true} if all workers exited, {@code false} if the wait was interrupted
     */
    public boolean awaitTermination() {
        if (!started.get()) {
            return true;
        }
        try {
            while (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.info("queue4j waiting for workers to finish current jobs");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        log.info("queue4j worker pool stopped");
        return true;
    }
}
