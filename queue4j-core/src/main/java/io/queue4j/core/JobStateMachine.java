package io.queue4j.core;

import io.queue4j.exec.ExecutionResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Transition rules for a claimed job.
 *
 * <pre>
 * pending --claim--> processing --success--> completed
 *                               --failure--> failed (re-claimable after nextRunAt)
 *                               --failure, retries exhausted--> dead
 * dead --DLQ retry--> pending (attempts reset)
 * </pre>
 *
 * <p>Only success versus failure matters; a non-zero exit, a launch error and a timeout
 * are handled the same way.
 */
public final class JobStateMachine {

    static final int MAX_ERROR_LENGTH = 500;

    private JobStateMachine() {
    }

    /**
     * Computes the outcome for a job from the snapshot taken at claim time.
     *
     * @param claimed     job as returned by the claim; its attempt count already includes this run
     * @param result      execution result
     * @param backoffBase exponential base, only consulted on failure
     * @param now         time the execution finished
     */
    public static Transition next(JobRecord claimed, ExecutionResult result, double backoffBase, Instant now) {
        Objects.requireNonNull(claimed, "claimed must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (result.succeeded()) {
            return Transition.complete();
        }

        String error = truncate(result.error());
        BackoffDecision decision = BackoffPolicy.decide(claimed.attempts(), claimed.maxRetries(), backoffBase);
        if (decision.exhausted()) {
            return Transition.dead(error);
        }
        return Transition.retry(now.plus(decision.delay()), error);
    }

    /**
     * Writes a transition through the store. Each branch is a single conditional update that
     * only succeeds while the job is still processing.
     */
    public static void apply(JobStore store, String id, Transition transition, Instant now) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(transition, "transition must not be null");

        switch (transition.target()) {
            case COMPLETED -> store.markCompleted(id, now);
            case FAILED -> store.markRetry(id, transition.nextRunAt(), transition.lastError(), now);
            case DEAD -> store.markDead(id, transition.lastError(), now);
            default -> throw new IllegalArgumentException("Not an outcome state: " + transition.target());
        }
    }

    static String truncate(String error) {
        if (error == null) {
            return "error";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
