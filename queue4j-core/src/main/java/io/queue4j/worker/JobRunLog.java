package io.queue4j.worker;

import io.queue4j.core.JobRecord;
import io.queue4j.exec.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-job output files. Every run of a job is appended to {@code <logsDir>/<jobId>.log}:
 * <pre>
 * --- RUN 2026-01-01T00:00:00Z attempt=1 worker=host-42-1 ---
 * OUTPUT:
 * ...
 * ERROR: Exit 1
 * </pre>
 * Writing is best effort. A log that cannot be written never changes the job's outcome.
 */
public class JobRunLog {
    private static final Logger log = LoggerFactory.getLogger(JobRunLog.class);

    private static final JobRunLog DISABLED = new JobRunLog();

    private final Path logsDir;

    public JobRunLog(Path logsDir) {
        this.logsDir = Objects.requireNonNull(logsDir, "logsDir must not be null");
    }

    private JobRunLog() {
        this.logsDir = null;
    }

    /**
     * Run log that writes nothing.
     */
    public static JobRunLog disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return logsDir != null;
    }

    /**
     * Default log file for a job. Characters unsafe in file names are replaced with {@code _}.
     */
    public Path pathFor(String jobId) {
        if (!isEnabled()) {
            throw new IllegalStateException("run log is disabled");
        }
        return logsDir.resolve(jobId.replaceAll("[^A-Za-z0-9._-]", "_") + ".log");
    }

    /**
     * Appends one run to {@code file}, creating it and its directory when missing.
     */
    public void append(Path file, JobRecord job, String workerId, Instant startedAt, ExecutionResult result) {
        StringBuilder entry = new StringBuilder()
                .append("--- RUN ").append(startedAt)
                .append(" attempt=").append(job.attempts())
                .append(" worker=").append(workerId)
                .append(" ---\n");
        if (result.output() != null && !result.output().isEmpty()) {
            entry.append("OUTPUT:\n").append(result.output()).append('\n');
        }
        if (!result.succeeded()) {
            entry.append("ERROR: ").append(result.error()).append('\n');
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("queue4j run log not written id={} file={} msg={}", job.id(), file, e.getMessage());
        }
    }
}
