package io.queue4j.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process shutdown signal.
 */
public class FlagShutdownSignal implements ShutdownSignal {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    @Override
    public boolean isRequested() {
        return requested.get();
    }

    @Override
    public void request() {
        requested.set(true);
    }

    @Override
    public void clear() {
        requested.set(false);
    }
}
