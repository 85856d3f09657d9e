package io.queue4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.queue4j.core.DuplicateJobIdException;
import io.queue4j.core.InvalidJobStateException;
import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobNotFoundException;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobState;
import io.queue4j.core.JobStore;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Every mutation is a single {@code findAndModify} conditioned on the job id and the state the
 * transition starts from. Two workers racing for the same document cannot both match it, so no
 * job is claimed twice and a transition never applies from the wrong state.
 *
 * <p>Timestamps are truncated to milliseconds, the precision of BSON dates.
 */
public class MongoJobStore implements JobStore {

    private static final Sort CREATION_ORDER = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id"));

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public JobRecord enqueue(JobDescriptor descriptor, Instant now) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (descriptor.id() == null || descriptor.maxRetries() == null) {
            throw new IllegalArgumentException("descriptor id and maxRetries must be resolved before enqueue");
        }

        Instant ts = millis(now);
        JobDocument doc = new JobDocument();
        doc.setId(descriptor.id());
        doc.setCommand(descriptor.command());
        doc.setState(JobState.PENDING);
        doc.setAttempts(0);
        doc.setMaxRetries(descriptor.maxRetries());
        doc.setTimeoutSeconds(descriptor.timeoutSeconds());
        doc.setCreatedAt(ts);
        doc.setUpdatedAt(ts);

        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            throw new DuplicateJobIdException(descriptor.id(), e);
        }
        return toRecord(doc);
    }

    /**
     * Atomically claims the oldest eligible job via {@code findAndModify} (read + update in one step).
     */
    @Override
    public Optional<JobRecord> claimNext(Instant now, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant ts = millis(now);
        Query eligible = new Query(
                new Criteria().orOperator(
                        Criteria.where("state").is(JobState.PENDING),
                        Criteria.where("state").is(JobState.FAILED).and("nextRunAt").lte(ts)
                )
        );
        eligible.with(CREATION_ORDER);

        Update claim = new Update()
                .set("state", JobState.PROCESSING)
                .inc("attempts", 1)
                .set("updatedAt", ts)
                .set("claimedBy", workerId);

        JobDocument doc = mongoTemplate.findAndModify(eligible, claim, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        return Optional.ofNullable(doc).map(MongoJobStore::toRecord);
    }

    @Override
    public void markCompleted(String id, Instant now) {
        Update u = new Update()
                .set("state", JobState.COMPLETED)
                .set("updatedAt", millis(now))
                .unset("nextRunAt")
                .unset("lastError");
        transition(id, JobState.PROCESSING, u);
    }

    @Override
    public void markRetry(String id, Instant nextRunAt, String lastError, Instant now) {
        Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
        Update u = new Update()
                .set("state", JobState.FAILED)
                .set("updatedAt", millis(now))
                .set("nextRunAt", millis(nextRunAt))
                .set("lastError", lastError);
        transition(id, JobState.PROCESSING, u);
    }

    @Override
    public void markDead(String id, String lastError, Instant now) {
        Update u = new Update()
                .set("state", JobState.DEAD)
                .set("updatedAt", millis(now))
                .unset("nextRunAt")
                .set("lastError", lastError);
        transition(id, JobState.PROCESSING, u);
    }

    @Override
    public JobRecord retryDead(String id, Instant now) {
        Update u = new Update()
                .set("state", JobState.PENDING)
                .set("attempts", 0)
                .set("updatedAt", millis(now))
                .unset("nextRunAt")
                .unset("lastError")
                .unset("claimedBy");
        return toRecord(transition(id, JobState.DEAD, u));
    }

    @Override
    public void assignLogPath(String id, String logPath) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        UpdateResult result = mongoTemplate.updateFirst(q, new Update().set("logPath", logPath), JobDocument.class);
        if (result.getMatchedCount() == 0) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(MongoJobStore::toRecord);
    }

    @Override
    public List<JobRecord> list(JobState state) {
        Query q = state == null ? new Query() : new Query(Criteria.where("state").is(state));
        q.with(CREATION_ORDER);

        List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class);
        List<JobRecord> out = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            out.add(toRecord(d));
        }
        return out;
    }

    @Override
    public Map<JobState, Long> countByState() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState s : JobState.values()) {
            counts.put(s, 0L);
        }

        Aggregation agg = Aggregation.newAggregation(
                Aggregation.group("state").count().as("count")
        );
        for (Document row : mongoTemplate.aggregate(agg, JobDocument.class, Document.class)) {
            Object state = row.get("_id");
            Object count = row.get("count");
            if (state != null && count instanceof Number n) {
                counts.put(JobState.valueOf(state.toString()), n.longValue());
            }
        }
        return counts;
    }

    /**
     * Applies {@code update} only while the job is in {@code expected}.
     *
     * @return the updated document
     */
    private JobDocument transition(String id, JobState expected, Update update) {
        Objects.requireNonNull(id, "id must not be null");

        Query q = new Query(Criteria.where("_id").is(id).and("state").is(expected));
        JobDocument updated = mongoTemplate.findAndModify(q, update, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        if (updated != null) {
            return updated;
        }

        JobDocument current = mongoTemplate.findById(id, JobDocument.class);
        if (current == null) {
            throw new JobNotFoundException(id);
        }
        throw new InvalidJobStateException(id, current.getState(), expected);
    }

    static JobRecord toRecord(JobDocument doc) {
        return new JobRecord(
                doc.getId(),
                doc.getCommand(),
                doc.getState(),
                doc.getAttempts(),
                doc.getMaxRetries(),
                doc.getTimeoutSeconds(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getNextRunAt(),
                doc.getLastError(),
                doc.getClaimedBy(),
                doc.getLogPath()
        );
    }

    private static Instant millis(Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
