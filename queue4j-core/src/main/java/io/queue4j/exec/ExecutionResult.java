package io.queue4j.exec;

/**
 * Result of running a job command.
 *
 * @param succeeded whether the command exited with status 0
 * @param exitCode  process exit status, or {@code null} when the process never finished
 *                  (launch error, timeout)
 * @param output    captured combined stdout/stderr, possibly truncated
 * @param error     short failure description, {@code null} on success
 */
public record ExecutionResult(
        boolean succeeded,
        Integer exitCode,
        String output,
        String error
) {
    /**
     * Characters of output quoted in {@link #error()}. The end of the output is kept.
     */
    static final int ERROR_TAIL_LENGTH = 400;

    public static ExecutionResult success(String output) {
        return new ExecutionResult(true, 0, output, null);
    }

    public static ExecutionResult exited(int exitCode, String output) {
        if (exitCode == 0) {
            return success(output);
        }
        String tail = output == null ? "" : output.strip();
        if (tail.length() > ERROR_TAIL_LENGTH) {
            tail = "..." + tail.substring(tail.length() - ERROR_TAIL_LENGTH);
        }
        String error = tail.isEmpty() ? "Exit " + exitCode : "Exit " + exitCode + ": " + tail;
        return new ExecutionResult(false, exitCode, output, error);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, null, null, error);
    }
}
