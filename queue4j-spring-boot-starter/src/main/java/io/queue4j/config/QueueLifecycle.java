package io.queue4j.config;

import io.queue4j.JobQueue;
import org.springframework.context.SmartLifecycle;

/**
 * Runs a background worker pool for the lifetime of the Spring container.
 *
 * <p>Only registered when {@code queue4j.auto-start=true}; otherwise workers run through the
 * {@code worker start} command or {@link JobQueue#start(int)}. Starting the pool clears a stop
 * file left over from an earlier {@code worker stop}. While the container runs, creating that
 * file (the {@code queue4j.stop-file} path) makes the workers drain and exit without closing the
 * context; {@link #isRunning()} still reports {@code true} until the container stops the bean.
 *
 * <p>Container shutdown blocks in {@link #stop()} until every in-flight job has been recorded.
 * It runs in the highest phase: started after and stopped before other lifecycle beans.
 */
public class QueueLifecycle implements SmartLifecycle {
    private final JobQueue queue;
    private final int workerCount;
    private volatile boolean running = false;

    public QueueLifecycle(JobQueue queue, int workerCount) {
        this.queue = queue;
        this.workerCount = workerCount;
    }

    @Override
    public void start() {
        queue.startWorkers(workerCount);
        running = true;
    }

    @Override
    public void stop() {
        queue.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
