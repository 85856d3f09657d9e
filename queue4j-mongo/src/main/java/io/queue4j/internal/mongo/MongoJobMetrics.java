package io.queue4j.internal.mongo;

import io.queue4j.core.JobMetrics;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Execution counters in the {@code queue_metrics} collection, incremented with {@code $inc}.
 */
public class MongoJobMetrics implements JobMetrics {

    private static final String[] KNOWN = {JOBS_PROCESSED, JOBS_FAILED, JOBS_RETRIED, JOBS_DEAD};

    private final MongoTemplate mongoTemplate;

    public MongoJobMetrics(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void increment(String counter) {
        if (counter == null || counter.isBlank()) {
            throw new IllegalArgumentException("counter must not be blank");
        }
        Query q = new Query(Criteria.where("_id").is(counter));
        mongoTemplate.upsert(q, new Update().inc("value", 1L), MetricDocument.class);
    }

    /**
     * All counters; the built-in ones are reported as zero until first incremented.
     */
    @Override
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String k : KNOWN) {
            out.put(k, 0L);
        }
        for (MetricDocument d : mongoTemplate.findAll(MetricDocument.class)) {
            out.put(d.getName(), d.getValue());
        }
        return out;
    }
}
