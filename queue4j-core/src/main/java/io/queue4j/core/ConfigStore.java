package io.queue4j.core;

import java.util.Map;
import java.util.Optional;

/**
 * Process-wide key/value settings. Values are always read fresh from storage.
 */
public interface ConfigStore {

    String BACKOFF_BASE = "backoff_base";

    Optional<String> get(String key);

    void set(String key, String value);

    Map<String, String> all();
}
