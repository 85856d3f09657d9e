package io.queue4j.worker;

import io.queue4j.core.InMemoryConfigStore;
import io.queue4j.core.InMemoryJobStore;
import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobMetrics;
import io.queue4j.core.JobState;
import io.queue4j.exec.CommandExecutor;
import io.queue4j.exec.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final InMemoryConfigStore config = new InMemoryConfigStore();
    private final FlagShutdownSignal signal = new FlagShutdownSignal();

    @Test
    void everyJobShouldRunExactlyOnceAcrossWorkers() throws Exception {
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 10; i++) {
            String cmd = (i % 2 == 0 ? "ok " : "fail ") + i;
            store.enqueue(JobDescriptor.of("job-" + i, cmd, 0), base.plusMillis(i));
        }
        Map<String, Integer> executions = new ConcurrentHashMap<>();
        CommandExecutor executor = (cmd, timeout) -> {
            executions.merge(cmd, 1, Integer::sum);
            return cmd.startsWith("ok") ? ExecutionResult.success("") : ExecutionResult.exited(1, "");
        };

        WorkerPool pool = pool(2, executor);
        pool.start();
        awaitFinished(10);
        pool.stop();

        assertThat(executions).hasSize(10);
        assertThat(executions.values()).containsOnly(1);
        assertThat(store.list(JobState.COMPLETED)).hasSize(5);
        assertThat(store.list(JobState.DEAD)).hasSize(5);
        assertThat(store.list(JobState.PROCESSING)).isEmpty();
        assertThat(pool.getWorkers()).extracting(Worker::getWorkerId).containsExactly("w-1", "w-2");
    }

    @Test
    void stopShouldWaitForInFlightJob() throws Exception {
        store.enqueue(JobDescriptor.of("slow", "sleep", 0), Instant.now());
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CommandExecutor executor = (cmd, timeout) -> {
            running.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ExecutionResult.success("");
        };

        WorkerPool pool = pool(1, executor);
        pool.start();
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        Thread stopper = new Thread(pool::stop);
        stopper.start();
        stopper.join(200);
        assertThat(stopper.isAlive()).isTrue();
        assertThat(store.get("slow").orElseThrow().state()).isEqualTo(JobState.PROCESSING);

        release.countDown();
        stopper.join(5_000);

        assertThat(stopper.isAlive()).isFalse();
        assertThat(store.get("slow").orElseThrow().state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    void startShouldClearStaleStopRequest() throws Exception {
        signal.request();
        store.enqueue(JobDescriptor.of("j", "ok", 0), Instant.now());

        WorkerPool pool = pool(1, (cmd, timeout) -> ExecutionResult.success(""));
        pool.start();
        awaitFinished(1);
        pool.stop();

        assertThat(pool.isStarted()).isTrue();
        assertThat(store.get("j").orElseThrow().state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    void nonPositiveCountShouldBeRejected() {
        assertThatThrownBy(() -> pool(0, (cmd, timeout) -> ExecutionResult.success("")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private WorkerPool pool(int count, CommandExecutor executor) {
        WorkerSettings settings = new WorkerSettings(Duration.ofMillis(10), Duration.ofSeconds(30), 2.0, 3, Duration.ZERO);
        return new WorkerPool(count, i -> new Worker("w-" + i, store, config, JobMetrics.noop(), executor, signal,
                settings, Clock.systemUTC()), signal);
    }

    private void awaitFinished(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            long done = store.list(JobState.COMPLETED).size() + store.list(JobState.DEAD).size();
            if (done >= expected) {
                return;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("jobs did not finish in time");
    }
}
