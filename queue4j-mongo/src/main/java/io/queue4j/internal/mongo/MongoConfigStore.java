package io.queue4j.internal.mongo;

import io.queue4j.core.ConfigStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Key/value settings in the {@code queue_config} collection. Nothing is cached.
 */
public class MongoConfigStore implements ConfigStore {

    private final MongoTemplate mongoTemplate;

    public MongoConfigStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        ConfigEntryDocument doc = mongoTemplate.findById(key, ConfigEntryDocument.class);
        return Optional.ofNullable(doc).map(ConfigEntryDocument::getValue);
    }

    @Override
    public void set(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        Objects.requireNonNull(value, "value must not be null");

        Query q = new Query(Criteria.where("_id").is(key));
        mongoTemplate.upsert(q, new Update().set("value", value), ConfigEntryDocument.class);
    }

    @Override
    public Map<String, String> all() {
        Map<String, String> out = new LinkedHashMap<>();
        for (ConfigEntryDocument d : mongoTemplate.findAll(ConfigEntryDocument.class)) {
            out.put(d.getKey(), d.getValue());
        }
        return out;
    }
}
