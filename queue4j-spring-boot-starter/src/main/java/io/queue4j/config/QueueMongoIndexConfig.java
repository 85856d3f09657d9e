package io.queue4j.config;

import io.queue4j.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the job queue.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code queue4j.ensure-indexes-on-startup=true}.
 * Id uniqueness needs no extra index: the job id is the document {@code _id}.
 *
 * <h3>Indexes (collection: {@code queue_jobs})</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { state: 1, nextRunAt: 1, createdAt: 1 }
 *       <br/>Used by the claim query (eligible state, due retry, oldest first).</li>
 *   <li><b>idx_created</b>: { createdAt: 1 }
 *       <br/>Used by list queries ordered by creation time.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.queue_jobs.createIndex({ state: 1, nextRunAt: 1, createdAt: 1 }, { name: "idx_claim" });
 * db.queue_jobs.createIndex({ createdAt: 1 }, { name: "idx_created" });
 * </pre>
 */
public class QueueMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_CREATED = "idx_created";

    private final MongoTemplate mongoTemplate;

    public QueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(claimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(createdIndex());
    }

    public static Index claimIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }
}
