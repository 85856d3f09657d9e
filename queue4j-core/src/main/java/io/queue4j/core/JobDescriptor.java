package io.queue4j.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.UUID;

/**
 * Client-side description of a job to enqueue.
 *
 * <p>Accepts the same JSON shape the command line takes:
 * <pre>{@code
 * {"id":"job1","command":"sleep 2","max_retries":3,"timeout_seconds":10}
 * }</pre>
 * Only {@code command} is required. {@code id} defaults to a random UUID and
 * {@code max_retries} to the queue default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDescriptor(
        @JsonProperty("id") String id,
        @JsonProperty("command") String command,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("timeout_seconds") Integer timeoutSeconds
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public JobDescriptor {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("max_retries must not be negative");
        }
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout_seconds must be positive");
        }
    }

    public static JobDescriptor of(String id, String command, int maxRetries) {
        return new JobDescriptor(id, command, maxRetries, null);
    }

    /**
     * Parses a job descriptor from its JSON form.
     *
     * @throws IllegalArgumentException when the JSON is malformed or a field is invalid
     */
    public static JobDescriptor fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("job JSON must not be empty");
        }
        JobDescriptor descriptor;
        try {
            descriptor = MAPPER.readValue(json, JobDescriptor.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw new IllegalArgumentException("Invalid job JSON: " + e.getOriginalMessage(), e);
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("job JSON must be an object");
        }
        return descriptor;
    }

    /**
     * Fills in the generated id and the default retry limit.
     */
    public JobDescriptor withDefaults(int defaultMaxRetries) {
        String resolvedId = id != null ? id : UUID.randomUUID().toString();
        int resolvedRetries = maxRetries != null ? maxRetries : defaultMaxRetries;
        return new JobDescriptor(resolvedId, command, resolvedRetries, timeoutSeconds);
    }
}
