package io.queue4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.queue4j.core.DuplicateJobIdException;
import io.queue4j.core.InvalidJobStateException;
import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobMetrics;
import io.queue4j.core.JobNotFoundException;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "queue4j_test");
        dropAll();
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void enqueueShouldStorePendingJob() {
        JobRecord job = jobStore.enqueue(new JobDescriptor("job1", "sleep 2", 3, 10), T0);

        assertEquals(JobState.PENDING, job.state());
        assertEquals(0, job.attempts());

        JobRecord stored = jobStore.get("job1").orElseThrow();
        assertEquals("sleep 2", stored.command());
        assertEquals(3, stored.maxRetries());
        assertEquals(10, stored.timeoutSeconds());
        assertEquals(T0, stored.createdAt());
        assertNull(stored.nextRunAt());
    }

    @Test
    void duplicateIdShouldBeRejectedAndOriginalKept() {
        jobStore.enqueue(JobDescriptor.of("dup", "echo one", 3), T0);

        DuplicateJobIdException e = assertThrows(DuplicateJobIdException.class,
                () -> jobStore.enqueue(JobDescriptor.of("dup", "echo two", 1), T0.plusSeconds(1)));

        assertEquals("dup", e.getJobId());
        assertEquals("echo one", jobStore.get("dup").orElseThrow().command());
    }

    @Test
    void claimShouldTakeOldestPendingAndPreventDoubleClaim() {
        jobStore.enqueue(JobDescriptor.of("newer", "true", 0), T0.plusSeconds(5));
        jobStore.enqueue(JobDescriptor.of("older", "true", 0), T0);

        JobRecord first = jobStore.claimNext(T0.plusSeconds(10), "worker-A").orElseThrow();
        assertEquals("older", first.id());
        assertEquals(JobState.PROCESSING, first.state());
        assertEquals(1, first.attempts());
        assertEquals("worker-A", first.claimedBy());

        JobRecord second = jobStore.claimNext(T0.plusSeconds(10), "worker-B").orElseThrow();
        assertEquals("newer", second.id());

        assertTrue(jobStore.claimNext(T0.plusSeconds(10), "worker-C").isEmpty());
    }

    @Test
    void failedJobShouldOnlyBeClaimableOnceDue() {
        jobStore.enqueue(JobDescriptor.of("retry-me", "exit 1", 3), T0);
        jobStore.claimNext(T0, "w");
        jobStore.markRetry("retry-me", T0.plusSeconds(2), "Exit 1", T0);

        assertTrue(jobStore.claimNext(T0.plusSeconds(1), "w").isEmpty());

        JobRecord again = jobStore.claimNext(T0.plusSeconds(2), "w").orElseThrow();
        assertEquals(2, again.attempts());
        assertEquals("Exit 1", again.lastError());
    }

    @Test
    void concurrentClaimsShouldNeverShareAJob() throws Exception {
        for (int i = 0; i < 40; i++) {
            jobStore.enqueue(JobDescriptor.of("job-" + i, "true", 0), T0.plusMillis(i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                String workerId = "worker-" + w;
                Callable<List<String>> claimer = () -> {
                    List<String> mine = new ArrayList<>();
                    Optional<JobRecord> next;
                    while ((next = jobStore.claimNext(T0.plusSeconds(1), workerId)).isPresent()) {
                        mine.add(next.get().id());
                    }
                    return mine;
                };
                futures.add(pool.submit(claimer));
            }

            List<String> all = new ArrayList<>();
            for (Future<List<String>> f : futures) {
                all.addAll(f.get());
            }
            Set<String> unique = new HashSet<>(all);
            assertEquals(40, all.size());
            assertEquals(40, unique.size());
        } finally {
            pool.shutdownNow();
        }

        for (JobRecord job : jobStore.list(null)) {
            assertEquals(JobState.PROCESSING, job.state());
            assertEquals(1, job.attempts());
        }
    }

    @Test
    void outcomeShouldOnlyApplyToProcessingJob() {
        jobStore.enqueue(JobDescriptor.of("p", "true", 0), T0);

        InvalidJobStateException e = assertThrows(InvalidJobStateException.class,
                () -> jobStore.markCompleted("p", T0));
        assertEquals(JobState.PENDING, e.getActual());
        assertEquals(JobState.PENDING, jobStore.get("p").orElseThrow().state());

        assertThrows(JobNotFoundException.class, () -> jobStore.markDead("missing", "x", T0));
    }

    @Test
    void completedJobShouldClearErrorAndSchedule() {
        jobStore.enqueue(JobDescriptor.of("c", "flaky", 3), T0);
        jobStore.claimNext(T0, "w");
        jobStore.markRetry("c", T0.plusSeconds(2), "Exit 1", T0);
        jobStore.claimNext(T0.plusSeconds(2), "w");

        jobStore.markCompleted("c", T0.plusSeconds(3));

        JobRecord done = jobStore.get("c").orElseThrow();
        assertEquals(JobState.COMPLETED, done.state());
        assertEquals(2, done.attempts());
        assertNull(done.lastError());
        assertNull(done.nextRunAt());
        assertTrue(jobStore.claimNext(T0.plusSeconds(60), "w").isEmpty());
    }

    @Test
    void retryDeadShouldResetAttemptsAndRejectOtherStates() {
        jobStore.enqueue(JobDescriptor.of("d", "exit 1", 0), T0);
        jobStore.claimNext(T0, "w");
        jobStore.markDead("d", "Exit 1", T0.plusSeconds(1));

        assertEquals(1, jobStore.list(JobState.DEAD).size());

        JobRecord revived = jobStore.retryDead("d", T0.plusSeconds(2));
        assertEquals(JobState.PENDING, revived.state());
        assertEquals(0, revived.attempts());
        assertNull(revived.lastError());
        assertNull(revived.claimedBy());

        InvalidJobStateException e = assertThrows(InvalidJobStateException.class,
                () -> jobStore.retryDead("d", T0.plusSeconds(3)));
        assertEquals(JobState.DEAD, e.getExpected());
        assertThrows(JobNotFoundException.class, () -> jobStore.retryDead("missing", T0));

        assertEquals("d", jobStore.claimNext(T0.plusSeconds(3), "w").orElseThrow().id());
    }

    @Test
    void logPathShouldBeAssignedAndKeptAcrossDlqRetry() {
        jobStore.enqueue(JobDescriptor.of("logged", "exit 1", 0), T0);
        jobStore.claimNext(T0, "w");
        jobStore.assignLogPath("logged", "logs/logged.log");
        jobStore.markDead("logged", "Exit 1", T0.plusSeconds(1));

        JobRecord revived = jobStore.retryDead("logged", T0.plusSeconds(2));

        assertEquals("logs/logged.log", revived.logPath());
        assertEquals("logs/logged.log", jobStore.claimNext(T0.plusSeconds(3), "w").orElseThrow().logPath());
        assertThrows(JobNotFoundException.class, () -> jobStore.assignLogPath("missing", "logs/missing.log"));
    }

    @Test
    void jobsShouldSurviveStoreRestart() {
        jobStore.enqueue(JobDescriptor.of("durable", "sleep 5", 2), T0);
        jobStore.claimNext(T0, "w");
        jobStore.markRetry("durable", T0.plusSeconds(2), "Exit 1", T0.plusMillis(1500));

        MongoTemplate reconnected = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "queue4j_test");
        MongoJobStore restarted = new MongoJobStore(reconnected);

        JobRecord job = restarted.get("durable").orElseThrow();
        assertEquals(JobState.FAILED, job.state());
        assertEquals(1, job.attempts());
        assertEquals(T0.plusSeconds(2), job.nextRunAt());
        assertEquals("Exit 1", job.lastError());
    }

    @Test
    void timestampsShouldBeStoredAtMillisecondPrecision() {
        Instant precise = T0.plusNanos(123_456_789);
        jobStore.enqueue(JobDescriptor.of("ms", "true", 0), precise);

        assertEquals(precise.truncatedTo(ChronoUnit.MILLIS), jobStore.get("ms").orElseThrow().createdAt());
    }

    @Test
    void countByStateShouldReportEveryState() {
        jobStore.enqueue(JobDescriptor.of("a", "true", 0), T0);
        jobStore.enqueue(JobDescriptor.of("b", "true", 0), T0.plusSeconds(1));
        jobStore.enqueue(JobDescriptor.of("c", "true", 0), T0.plusSeconds(2));
        jobStore.claimNext(T0.plusSeconds(5), "w");
        jobStore.markCompleted("a", T0.plusSeconds(6));
        jobStore.claimNext(T0.plusSeconds(5), "w");

        Map<JobState, Long> counts = jobStore.countByState();

        assertEquals(JobState.values().length, counts.size());
        assertEquals(1L, counts.get(JobState.PENDING));
        assertEquals(1L, counts.get(JobState.PROCESSING));
        assertEquals(1L, counts.get(JobState.COMPLETED));
        assertEquals(0L, counts.get(JobState.FAILED));
        assertEquals(0L, counts.get(JobState.DEAD));
    }

    @Test
    void listShouldFilterByStateInCreationOrder() {
        jobStore.enqueue(JobDescriptor.of("z", "true", 0), T0.plusSeconds(2));
        jobStore.enqueue(JobDescriptor.of("y", "true", 0), T0);
        jobStore.enqueue(JobDescriptor.of("x", "true", 0), T0.plusSeconds(1));

        List<String> ids = jobStore.list(null).stream().map(JobRecord::id).toList();
        assertEquals(List.of("y", "x", "z"), ids);
        assertEquals(3, jobStore.list(JobState.PENDING).size());
        assertTrue(jobStore.list(JobState.DEAD).isEmpty());
    }

    @Test
    void configStoreShouldUpsertValues() {
        MongoConfigStore config = new MongoConfigStore(mongoTemplate);

        assertFalse(config.get("backoff_base").isPresent());
        config.set("backoff_base", "3");
        config.set("backoff_base", "4");

        assertEquals("4", config.get("backoff_base").orElseThrow());
        assertEquals(Map.of("backoff_base", "4"), config.all());
    }

    @Test
    void metricsShouldAccumulate() {
        MongoJobMetrics metrics = new MongoJobMetrics(mongoTemplate);

        metrics.increment(JobMetrics.JOBS_PROCESSED);
        metrics.increment(JobMetrics.JOBS_PROCESSED);
        metrics.increment(JobMetrics.JOBS_DEAD);

        Map<String, Long> snapshot = metrics.snapshot();
        assertEquals(2L, snapshot.get(JobMetrics.JOBS_PROCESSED));
        assertEquals(1L, snapshot.get(JobMetrics.JOBS_DEAD));
        assertEquals(0L, snapshot.get(JobMetrics.JOBS_RETRIED));
    }

    private void dropAll() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(ConfigEntryDocument.class);
        mongoTemplate.dropCollection(MetricDocument.class);
    }
}
