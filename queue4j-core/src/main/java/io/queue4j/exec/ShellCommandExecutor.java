package io.queue4j.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Executes commands through the system shell ({@code bash -c}, or {@code cmd.exe /c} on Windows).
 *
 * <p>stderr is merged into stdout and decoded as UTF-8. At most {@link #MAX_OUTPUT_BYTES} of
 * output are kept; the rest is drained and dropped so the child never blocks on a full pipe.
 *
 * <p>Interrupting the calling thread does not cut a command short: the wait continues until the
 * process exits (or times out) and the interrupt flag is restored before returning.
 */
public class ShellCommandExecutor implements CommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    static final int MAX_OUTPUT_BYTES = 64 * 1024;

    private final List<String> shell;

    public ShellCommandExecutor() {
        this(defaultShell());
    }

    /**
     * @param shell shell prefix; the command is appended as the last argument
     */
    public ShellCommandExecutor(List<String> shell) {
        Objects.requireNonNull(shell, "shell must not be null");
        if (shell.isEmpty()) {
            throw new IllegalArgumentException("shell must not be empty");
        }
        this.shell = List.copyOf(shell);
    }

    @Override
    public ExecutionResult execute(String command, Duration timeout) {
        Objects.requireNonNull(command, "command must not be null");

        ProcessBuilder pb = new ProcessBuilder();
        pb.command(commandLine(command));
        pb.redirectErrorStream(true);

        Process proc;
        try {
            proc = pb.start();
        } catch (IOException e) {
            log.warn("queue4j command failed to start cmd={} msg={}", command, e.getMessage());
            return ExecutionResult.failure("Failed to start: " + e.getMessage());
        }

        OutputCollector collector = new OutputCollector(proc.getInputStream());
        Thread reader = new Thread(collector);
        reader.setName("queue4j.output-" + proc.pid());
        reader.setDaemon(true);
        reader.start();

        boolean interrupted = false;
        try {
            Instant deadline = timeout == null ? null : Instant.now().plus(timeout);
            Boolean finished = null;
            while (finished == null) {
                try {
                    finished = awaitExit(proc, deadline);
                } catch (InterruptedException e) {
                    // the command keeps running to completion; only remember the interrupt
                    interrupted = true;
                }
            }

            if (!finished) {
                proc.descendants().forEach(ProcessHandle::destroyForcibly);
                proc.destroyForcibly();
                interrupted |= joinQuietly(proc, reader, Duration.ofSeconds(5));
                return new ExecutionResult(false, null, collector.text(), "Timeout after " + timeout.toSeconds() + "s");
            }

            interrupted |= joinQuietly(proc, reader, null);
            return ExecutionResult.exited(proc.exitValue(), collector.text());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return {@code false} once the deadline has passed with the process still alive
     */
    private static boolean awaitExit(Process proc, Instant deadline) throws InterruptedException {
        if (deadline == null) {
            proc.waitFor();
            return true;
        }
        long remaining = Duration.between(Instant.now(), deadline).toMillis();
        return proc.waitFor(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits for the process to exit and the output reader to drain, ignoring interrupts.
     *
     * @param limit bound for the process wait, {@code null} for none
     * @return whether an interrupt was swallowed
     */
    private static boolean joinQuietly(Process proc, Thread reader, Duration limit) {
        boolean interrupted = false;
        while (true) {
            try {
                if (limit == null) {
                    proc.waitFor();
                } else {
                    proc.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS);
                }
                reader.join(limit == null ? 0 : 1_000);
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    private List<String> commandLine(String command) {
        List<String> line = new ArrayList<>(shell.size() + 1);
        line.addAll(shell);
        line.add(command);
        return line;
    }

    private static List<String> defaultShell() {
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win")) {
            return List.of("cmd.exe", "/c");
        }
        return List.of("bash", "-c");
    }

    private static final class OutputCollector implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        private OutputCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        int room = MAX_OUTPUT_BYTES - buffer.size();
                        if (room > 0) {
                            buffer.write(chunk, 0, Math.min(room, n));
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("queue4j output stream closed msg={}", e.getMessage());
            }
        }

        private String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8).strip();
            }
        }
    }
}
