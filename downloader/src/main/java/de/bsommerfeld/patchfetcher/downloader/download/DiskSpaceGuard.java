package de.bsommerfeld.patchfetcher.downloader.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks, before a task starts, that its file store can take the task's
 * remaining bytes on top of the bytes reserved by running tasks and a fixed
 * safety margin.
 */
public class DiskSpaceGuard {

    private static final Logger LOG = LoggerFactory.getLogger(DiskSpaceGuard.class);

    /** Usable bytes on the store holding an existing path. */
    @FunctionalInterface
    public interface UsableSpace {
        long of(Path existingPath) throws IOException;
    }

    public static final UsableSpace FILE_STORE = path -> Files.getFileStore(path).getUsableSpace();

    private final long marginBytes;
    private final UsableSpace usableSpace;
    private long reservedBytes;

    public DiskSpaceGuard(long marginBytes, UsableSpace usableSpace) {
        this.marginBytes = marginBytes;
        this.usableSpace = usableSpace;
    }

    /**
     * Reserves {@code bytes} for a download to {@code target}.
     *
     * @return {@code false} if the space is not there; nothing is reserved then
     */
    public synchronized boolean tryReserve(Path target, long bytes) {
        if (bytes <= 0) {
            return true;
        }
        long usable;
        try {
            usable = usableSpace.of(existingAncestor(target));
        } catch (IOException e) {
            // free space unknown, proceed
            LOG.warn("Cannot determine free space for {}: {}", target, e.getMessage());
            reservedBytes += bytes;
            return true;
        }
        long available = usable - reservedBytes - marginBytes;
        if (available < bytes) {
            LOG.debug("Need {} bytes for {}, only {} available", bytes, target.getFileName(), available);
            return false;
        }
        reservedBytes += bytes;
        return true;
    }

    public synchronized void release(long bytes) {
        if (bytes > 0) {
            reservedBytes = Math.max(0, reservedBytes - bytes);
        }
    }

    synchronized long reservedBytes() {
        return reservedBytes;
    }

    private static Path existingAncestor(Path target) {
        Path current = target.toAbsolutePath();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current != null ? current : target.toAbsolutePath().getRoot();
    }
}
