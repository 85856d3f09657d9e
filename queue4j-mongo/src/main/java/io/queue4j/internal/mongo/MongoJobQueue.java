package io.queue4j.internal.mongo;

import io.queue4j.JobQueue;
import io.queue4j.config.QueueProperties;
import io.queue4j.core.BackoffPolicy;
import io.queue4j.core.ConfigStore;
import io.queue4j.core.InvalidConfigException;
import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobState;
import io.queue4j.core.QueueStatus;
import io.queue4j.exec.CommandExecutor;
import io.queue4j.worker.JobRunLog;
import io.queue4j.worker.ShutdownSignal;
import io.queue4j.worker.Worker;
import io.queue4j.worker.WorkerPool;
import io.queue4j.worker.WorkerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mongo-backed job queue.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Durable jobs that survive restarts</li>
 *   <li>Exponential retry backoff and a dead letter queue</li>
 *   <li>Multi-worker execution via atomic claim</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * queue.enqueue(JobDescriptor.of("nightly-report", "./report.sh", 3));
 * queue.start(2);   // blocks until queue.stop() or a stop file appears
 * }</pre>
 */
public class MongoJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoJobQueue.class);

    private final QueueProperties props;
    private final MongoJobStore jobStore;
    private final MongoConfigStore configStore;
    private final MongoJobMetrics metrics;
    private final CommandExecutor executor;
    private final ShutdownSignal signal;
    private final Clock clock;

    private final AtomicReference<WorkerPool> pool = new AtomicReference<>();

    public MongoJobQueue(QueueProperties props,
                         MongoJobStore jobStore,
                         MongoConfigStore configStore,
                         MongoJobMetrics metrics,
                         CommandExecutor executor,
                         ShutdownSignal signal) {
        this(props, jobStore, configStore, metrics, executor, signal, Clock.systemUTC());
    }

    public MongoJobQueue(QueueProperties props,
                         MongoJobStore jobStore,
                         MongoConfigStore configStore,
                         MongoJobMetrics metrics,
                         CommandExecutor executor,
                         ShutdownSignal signal,
                         Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobRecord enqueue(JobDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        JobRecord job = jobStore.enqueue(descriptor.withDefaults(props.getDefaultMaxRetries()), clock.instant());
        log.info("queue4j job enqueued id={} maxRetries={} cmd={}", job.id(), job.maxRetries(), job.command());
        return job;
    }

    @Override
    public WorkerPool startWorkers(int workerCount) {
        WorkerSettings settings = workerSettings();
        String baseId = resolveWorkerId(props.getWorkerId());
        JobRunLog runLog = runLog();

        WorkerPool created = new WorkerPool(
                workerCount,
                i -> new Worker(baseId + "-" + i, jobStore, configStore, metrics, executor, signal, settings, clock, runLog),
                signal
        );
        if (!pool.compareAndSet(null, created)) {
            throw new IllegalStateException("Workers are already running");
        }

        log.info("queue4j starting workers count={} workerId={} pollInterval={} defaultTimeout={} logsDir={}",
                workerCount, baseId, settings.pollInterval(), settings.defaultTimeout(), props.getLogsDir());
        created.start();
        return created;
    }

    @Override
    public void start(int workerCount) {
        WorkerPool running = startWorkers(workerCount);
        try {
            running.awaitTermination();
        } finally {
            pool.compareAndSet(running, null);
            signal.clear();
        }
    }

    @Override
    public void stop() {
        signal.request();
        WorkerPool running = pool.get();
        if (running != null && running.awaitTermination() && pool.compareAndSet(running, null)) {
            signal.clear();
        }
    }

    @Override
    public QueueStatus status() {
        return new QueueStatus(jobStore.countByState(), metrics.snapshot(), signal.isRequested());
    }

    @Override
    public Optional<JobRecord> get(String id) {
        return jobStore.get(id);
    }

    @Override
    public List<JobRecord> list(JobState state) {
        return jobStore.list(state);
    }

    @Override
    public List<JobRecord> deadLetters() {
        return jobStore.list(JobState.DEAD);
    }

    @Override
    public JobRecord retryDead(String id) {
        JobRecord job = jobStore.retryDead(id, clock.instant());
        log.info("queue4j job moved from DLQ to pending id={}", id);
        return job;
    }

    @Override
    public Optional<String> getConfig(String key) {
        return configStore.get(key);
    }

    @Override
    public void setConfig(String key, String value) {
        if (ConfigStore.BACKOFF_BASE.equals(key)) {
            if (value == null || value.isBlank()) {
                throw new InvalidConfigException(key, "must not be blank");
            }
            BackoffPolicy.parseBase(value, props.getDefaultBackoffBase());
        }
        configStore.set(key, value);
        log.info("queue4j config set key={} value={}", key, value);
    }

    private WorkerSettings workerSettings() {
        return new WorkerSettings(
                props.getPollInterval(),
                props.getDefaultTimeout(),
                props.getDefaultBackoffBase(),
                props.getWriteAttempts(),
                props.getStoreRetryDelay()
        );
    }

    private JobRunLog runLog() {
        String dir = props.getLogsDir();
        if (dir == null || dir.isBlank()) {
            return JobRunLog.disabled();
        }
        return new JobRunLog(Path.of(dir));
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "queue4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("queue4j hostname lookup failed msg={}", e.getMessage());
        }

        String generated = host + "-" + ProcessHandle.current().pid() + "-" + java.util.UUID.randomUUID().toString().substring(0, 8);
        if (generated.length() > 120) {
            return generated.substring(0, 120);
        }
        return generated;
    }
}
