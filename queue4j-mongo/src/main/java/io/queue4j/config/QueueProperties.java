package io.queue4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job queue and its workers.
 *
 * <p>{@code backoff_base} is deliberately not here: it lives in the config store so running
 * workers pick up changes without a restart. {@link #defaultBackoffBase} is only the fallback
 * used while that key has never been set.
 */
@ConfigurationProperties(prefix = "queue4j")
public class QueueProperties {
    private int workerCount = 1;
    private Duration pollInterval = Duration.ofMillis(500);
    private int defaultMaxRetries = 3;
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private double defaultBackoffBase = 2.0;
    private int writeAttempts = 5;
    private Duration storeRetryDelay = Duration.ofSeconds(1);
    private String stopFile = "queue4j.worker.stop";
    private String logsDir = "logs";
    private String workerId;
    private boolean ensureIndexesOnStartup = false;
    private boolean autoStart = false;
    private final Cli cli = new Cli();

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public double getDefaultBackoffBase() {
        return defaultBackoffBase;
    }

    public void setDefaultBackoffBase(double defaultBackoffBase) {
        this.defaultBackoffBase = defaultBackoffBase;
    }

    public int getWriteAttempts() {
        return writeAttempts;
    }

    public void setWriteAttempts(int writeAttempts) {
        this.writeAttempts = writeAttempts;
    }

    public Duration getStoreRetryDelay() {
        return storeRetryDelay;
    }

    public void setStoreRetryDelay(Duration storeRetryDelay) {
        this.storeRetryDelay = storeRetryDelay;
    }

    public String getStopFile() {
        return stopFile;
    }

    public void setStopFile(String stopFile) {
        this.stopFile = stopFile;
    }

    /**
     * Directory for per-job run logs; blank disables them.
     */
    public String getLogsDir() {
        return logsDir;
    }

    public void setLogsDir(String logsDir) {
        this.logsDir = logsDir;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Cli getCli() {
        return cli;
    }

    public static class Cli {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
