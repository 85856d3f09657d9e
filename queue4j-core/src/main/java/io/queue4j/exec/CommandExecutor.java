package io.queue4j.exec;

import java.time.Duration;

/**
 * Runs a job command and reports whether it succeeded. Blocks until the command finishes.
 */
public interface CommandExecutor {

    /**
     * @param command shell command line
     * @param timeout maximum run time, or {@code null} to wait indefinitely
     * @return the result; launch errors and timeouts are reported as failures, not thrown
     */
    ExecutionResult execute(String command, Duration timeout);
}
