package io.queue4j.worker;

import io.queue4j.core.BackoffPolicy;
import io.queue4j.core.ConfigStore;
import io.queue4j.core.InvalidConfigException;
import io.queue4j.core.InvalidJobStateException;
import io.queue4j.core.JobMetrics;
import io.queue4j.core.JobNotFoundException;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobStateMachine;
import io.queue4j.core.JobStore;
import io.queue4j.core.Transition;
import io.queue4j.exec.CommandExecutor;
import io.queue4j.exec.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Polling worker loop.
 *
 * <p>Each iteration checks the shutdown signal, claims one job, runs its command to completion and
 * records the outcome exactly once before looking at the signal again. A job is never abandoned
 * half-way: if the outcome cannot be written it stays in processing for manual inspection.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String workerId;
    private final JobStore store;
    private final ConfigStore config;
    private final JobMetrics metrics;
    private final CommandExecutor executor;
    private final ShutdownSignal signal;
    private final WorkerSettings settings;
    private final Clock clock;
    private final JobRunLog runLog;

    public Worker(String workerId,
                  JobStore store,
                  ConfigStore config,
                  JobMetrics metrics,
                  CommandExecutor executor,
                  ShutdownSignal signal,
                  WorkerSettings settings,
                  Clock clock) {
        this(workerId, store, config, metrics, executor, signal, settings, clock, JobRunLog.disabled());
    }

    public Worker(String workerId,
                  JobStore store,
                  ConfigStore config,
                  JobMetrics metrics,
                  CommandExecutor executor,
                  ShutdownSignal signal,
                  WorkerSettings settings,
                  Clock clock,
                  JobRunLog runLog) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        this.workerId = workerId;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.runLog = Objects.requireNonNull(runLog, "runLog must not be null");
    }

    public String getWorkerId() {
        return workerId;
    }

    @Override
    public void run() {
        log.info("queue4j worker started workerId={} pollInterval={}", workerId, settings.pollInterval());
        int claimFailures = 0;

        while (!signal.isRequested()) {
            boolean worked;
            try {
                worked = processNext();
                claimFailures = 0;
            } catch (RuntimeException e) {
                claimFailures++;
                Duration sleep = settings.storeBackoff(claimFailures);
                log.error("queue4j claim failed workerId={} failures={} retryIn={} msg={}",
                        workerId, claimFailures, sleep, e.getMessage(), e);
                if (!pause(sleep)) {
                    break;
                }
                continue;
            }

            if (!worked && !pause(settings.pollInterval())) {
                break;
            }
        }
        log.info("queue4j worker exiting workerId={}", workerId);
    }

    /**
     * Claims and processes at most one job.
     *
     * @return {@code true} if a job was claimed, {@code false} if none was eligible
     * @throws RuntimeException if the claim itself failed; nothing was claimed in that case
     */
    public boolean processNext() {
        Optional<JobRecord> claimed = store.claimNext(clock.instant(), workerId);
        if (claimed.isEmpty()) {
            log.debug("queue4j no eligible job workerId={}", workerId);
            return false;
        }
        process(claimed.get());
        return true;
    }

    void process(JobRecord job) {
        Duration timeout = job.timeoutSeconds() != null
                ? Duration.ofSeconds(job.timeoutSeconds())
                : settings.defaultTimeout();

        log.info("queue4j job started id={} attempt={} maxRetries={} workerId={} cmd={}",
                job.id(), job.attempts(), job.maxRetries(), workerId, job.command());

        Path logFile = runLogFile(job);
        Instant startedAt = clock.instant();
        ExecutionResult result;
        try {
            result = executor.execute(job.command(), timeout);
        } catch (RuntimeException e) {
            result = ExecutionResult.failure(e.toString());
        }
        Instant finishedAt = clock.instant();
        if (logFile != null) {
            runLog.append(logFile, job, workerId, startedAt, result);
        }

        Transition transition;
        try {
            ExecutionResult outcome = result;
            transition = retrying(job, "resolve outcome", () -> {
                double base = outcome.succeeded()
                        ? settings.defaultBackoffBase()
                        : BackoffPolicy.currentBase(config, settings.defaultBackoffBase());
                return JobStateMachine.next(job, outcome, base, finishedAt);
            });
            retrying(job, "write outcome", () -> {
                JobStateMachine.apply(store, job.id(), transition, finishedAt);
                return transition;
            });
        } catch (InvalidConfigException e) {
            log.error("queue4j job outcome not computed, left in processing id={} workerId={} msg={}",
                    job.id(), workerId, e.getMessage());
            return;
        } catch (JobNotFoundException | InvalidJobStateException e) {
            log.warn("queue4j job outcome rejected id={} workerId={} msg={}", job.id(), workerId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("queue4j job outcome could not be stored, left in processing id={} workerId={} msg={}",
                    job.id(), workerId, e.getMessage(), e);
            return;
        }

        recordOutcome(job, transition);
    }

    /**
     * Resolves the job's run log file, persisting the default path on its first run.
     *
     * @return the file, or {@code null} when run logs are disabled
     */
    private Path runLogFile(JobRecord job) {
        if (!runLog.isEnabled()) {
            return null;
        }
        if (job.logPath() != null) {
            return Path.of(job.logPath());
        }
        Path file = runLog.pathFor(job.id());
        try {
            store.assignLogPath(job.id(), file.toString());
        } catch (RuntimeException e) {
            log.warn("queue4j log path not stored id={} file={} msg={}", job.id(), file, e.getMessage());
        }
        return file;
    }

    private void recordOutcome(JobRecord job, Transition transition) {
        switch (transition.target()) {
            case COMPLETED -> {
                log.info("queue4j job completed id={} attempts={} workerId={}", job.id(), job.attempts(), workerId);
                increment(JobMetrics.JOBS_PROCESSED);
            }
            case FAILED -> {
                log.info("queue4j job failed, retry scheduled id={} attempts={} nextRunAt={} msg={}",
                        job.id(), job.attempts(), transition.nextRunAt(), transition.lastError());
                increment(JobMetrics.JOBS_FAILED);
                increment(JobMetrics.JOBS_RETRIED);
            }
            case DEAD -> {
                log.warn("queue4j job moved to DLQ id={} attempts={} maxRetries={} msg={}",
                        job.id(), job.attempts(), job.maxRetries(), transition.lastError());
                increment(JobMetrics.JOBS_FAILED);
                increment(JobMetrics.JOBS_DEAD);
            }
            default -> throw new IllegalStateException("Unexpected outcome " + transition.target());
        }
    }

    private void increment(String counter) {
        try {
            metrics.increment(counter);
        } catch (RuntimeException e) {
            log.warn("queue4j metrics update failed counter={} msg={}", counter, e.getMessage());
        }
    }

    /**
     * Runs a store-bound step, retrying transient failures with capped exponential backoff.
     * Queue errors are not transient and are rethrown immediately. An interrupt does not cut the
     * retries short: the job must end in a recorded state, so the flag is restored afterwards.
     */
    private <T> T retrying(JobRecord job, String action, Supplier<T> step) {
        boolean interrupted = false;
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return step.get();
                } catch (InvalidConfigException | JobNotFoundException | InvalidJobStateException e) {
                    throw e;
                } catch (RuntimeException e) {
                    if (attempt >= settings.writeAttempts()) {
                        throw e;
                    }
                    Duration sleep = settings.storeBackoff(attempt);
                    log.warn("queue4j {} failed id={} attempt={} retryIn={} msg={}",
                            action, job.id(), attempt, sleep, e.getMessage());
                    try {
                        Thread.sleep(sleep.toMillis());
                    } catch (InterruptedException ie) {
                        interrupted = true;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
