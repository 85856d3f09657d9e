package io.queue4j.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.queue4j.JobQueue;
import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobState;
import io.queue4j.core.QueueException;
import io.queue4j.core.QueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command-line front end for the queue, enabled with {@code queue4j.cli.enabled=true}.
 *
 * <pre>
 * enqueue '{"id":"job1","command":"echo hi","max_retries":3}'
 * worker start [--count=N]
 * worker stop
 * status
 * list [--state=pending|processing|completed|failed|dead]
 * dlq list
 * dlq retry &lt;jobId&gt;
 * config get &lt;key&gt;
 * config set &lt;key&gt; &lt;value&gt;
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the queue rejects the request, 2 on a usage error.
 */
public class QueueCommandLine implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(QueueCommandLine.class);

    public static final int OK = 0;
    public static final int REJECTED = 1;
    public static final int USAGE = 2;

    private final JobQueue queue;
    private final ObjectMapper objectMapper;
    private final int defaultWorkerCount;
    private final PrintStream out;
    private final PrintStream err;

    private volatile int exitCode = OK;

    public QueueCommandLine(JobQueue queue, ObjectMapper objectMapper, int defaultWorkerCount) {
        this(queue, objectMapper, defaultWorkerCount, System.out, System.err);
    }

    public QueueCommandLine(JobQueue queue, ObjectMapper objectMapper, int defaultWorkerCount, PrintStream out, PrintStream err) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaultWorkerCount = defaultWorkerCount;
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            usage();
            return USAGE;
        }

        try {
            return switch (words.get(0)) {
                case "enqueue" -> enqueue(words);
                case "worker" -> worker(words, args);
                case "status" -> status();
                case "list" -> list(args);
                case "dlq" -> dlq(words);
                case "config" -> config(words);
                default -> {
                    err.println("unknown command: " + words.get(0));
                    usage();
                    yield USAGE;
                }
            };
        } catch (QueueException e) {
            err.println(e.getMessage());
            return REJECTED;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return USAGE;
        }
    }

    private int enqueue(List<String> words) {
        if (words.size() < 2) {
            err.println("enqueue requires a job JSON argument");
            return USAGE;
        }
        JobRecord job = queue.enqueue(JobDescriptor.fromJson(words.get(1)));
        out.println("Enqueued job " + job.id());
        return OK;
    }

    private int worker(List<String> words, ApplicationArguments args) {
        String sub = words.size() > 1 ? words.get(1) : "";
        switch (sub) {
            case "start" -> {
                int count = intOption(args, "count", defaultWorkerCount);
                if (count <= 0) {
                    err.println("--count must be a positive number");
                    return USAGE;
                }
                Thread hook = new Thread(queue::stop, "queue4j.shutdown-hook");
                Runtime.getRuntime().addShutdownHook(hook);
                out.println("Starting workers (count=" + count + "). Run 'worker stop' or press Ctrl-C to stop.");
                queue.start(count);
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("queue4j JVM already shutting down msg={}", e.getMessage());
                }
                out.println("Workers stopped.");
                return OK;
            }
            case "stop" -> {
                queue.stop();
                out.println("Stop requested. Workers will exit after finishing current jobs.");
                return OK;
            }
            default -> {
                err.println("worker requires start|stop");
                return USAGE;
            }
        }
    }

    private int status() {
        QueueStatus status = queue.status();
        out.println("Job states:");
        for (JobState s : JobState.values()) {
            out.println("  " + s.label() + ": " + status.count(s));
        }
        out.println("Metrics:");
        status.metrics().forEach((k, v) -> out.println("  " + k + ": " + v));
        out.println("Stop requested: " + status.stopRequested());
        return OK;
    }

    private int list(ApplicationArguments args) {
        JobState state = null;
        List<String> values = args.getOptionValues("state");
        if (values != null && !values.isEmpty()) {
            state = JobState.fromLabel(values.get(0));
        }
        printJobs(queue.list(state));
        return OK;
    }

    private int dlq(List<String> words) {
        String sub = words.size() > 1 ? words.get(1) : "";
        switch (sub) {
            case "list" -> {
                printJobs(queue.deadLetters());
                return OK;
            }
            case "retry" -> {
                if (words.size() < 3) {
                    err.println("dlq retry requires a job id");
                    return USAGE;
                }
                JobRecord job = queue.retryDead(words.get(2));
                out.println("Job " + job.id() + " moved to pending");
                return OK;
            }
            default -> {
                err.println("dlq requires list|retry");
                return USAGE;
            }
        }
    }

    private int config(List<String> words) {
        String sub = words.size() > 1 ? words.get(1) : "";
        switch (sub) {
            case "get" -> {
                if (words.size() < 3) {
                    err.println("config get <key>");
                    return USAGE;
                }
                out.println(queue.getConfig(words.get(2)).orElse("(not set)"));
                return OK;
            }
            case "set" -> {
                if (words.size() < 4) {
                    err.println("config set <key> <value>");
                    return USAGE;
                }
                queue.setConfig(words.get(2), words.get(3));
                out.println("Set " + words.get(2) + " = " + words.get(3));
                return OK;
            }
            default -> {
                err.println("config requires get|set");
                return USAGE;
            }
        }
    }

    private void printJobs(List<JobRecord> jobs) {
        for (JobRecord job : jobs) {
            out.println(toJson(job));
        }
    }

    String toJson(JobRecord job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.id());
        view.put("command", job.command());
        view.put("state", job.state().label());
        view.put("attempts", job.attempts());
        view.put("max_retries", job.maxRetries());
        view.put("timeout_seconds", job.timeoutSeconds());
        view.put("created_at", str(job.createdAt()));
        view.put("updated_at", str(job.updatedAt()));
        view.put("next_run_at", str(job.nextRunAt()));
        view.put("last_error", job.lastError());
        view.put("claimed_by", job.claimedBy());
        view.put("log_path", job.logPath());
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render job " + job.id(), e);
        }
    }

    private static String str(Object value) {
        return value == null ? null : value.toString();
    }

    private static int intOption(ApplicationArguments args, String name, int fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + values.get(0));
        }
    }

    private void usage() {
        out.println("queuectl commands:");
        out.println("  enqueue '{\"id\":\"job1\",\"command\":\"echo hi\",\"max_retries\":3}'");
        out.println("  worker start [--count=N]");
        out.println("  worker stop");
        out.println("  status");
        out.println("  list [--state=pending|processing|completed|failed|dead]");
        out.println("  dlq list");
        out.println("  dlq retry <jobId>");
        out.println("  config get <key>");
        out.println("  config set <key> <value>");
    }
}
