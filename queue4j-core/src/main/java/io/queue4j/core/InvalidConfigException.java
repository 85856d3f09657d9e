package io.queue4j.core;

public class InvalidConfigException extends QueueException {

    private final String key;

    public InvalidConfigException(String key, String message) {
        super("Invalid config " + key + ": " + message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
