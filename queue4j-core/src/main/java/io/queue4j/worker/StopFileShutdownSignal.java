package io.queue4j.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Shutdown signal backed by a marker file, so that a separate process can stop a running pool
 * (for example {@code queuectl worker stop}). Also honours in-process requests.
 */
public class StopFileShutdownSignal implements ShutdownSignal {
    private static final Logger log = LoggerFactory.getLogger(StopFileShutdownSignal.class);

    private final Path stopFile;
    private final FlagShutdownSignal local = new FlagShutdownSignal();

    public StopFileShutdownSignal(Path stopFile) {
        this.stopFile = Objects.requireNonNull(stopFile, "stopFile must not be null");
    }

    public Path getStopFile() {
        return stopFile;
    }

    @Override
    public boolean isRequested() {
        return local.isRequested() || Files.exists(stopFile);
    }

    @Override
    public void request() {
        local.request();
        try {
            Path parent = stopFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(stopFile)) {
                Files.createFile(stopFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write stop file " + stopFile, e);
        }
        log.info("queue4j stop requested stopFile={}", stopFile);
    }

    @Override
    public void clear() {
        local.clear();
        try {
            Files.deleteIfExists(stopFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove stop file " + stopFile, e);
        }
    }
}
