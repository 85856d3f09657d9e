package io.queue4j.worker;

/**
 * Cooperative stop flag shared by all workers of a pool. Workers check it between jobs only.
 */
public interface ShutdownSignal {

    boolean isRequested();

    void request();

    void clear();
}
