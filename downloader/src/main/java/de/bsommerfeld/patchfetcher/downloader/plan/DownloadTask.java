package de.bsommerfeld.patchfetcher.downloader.plan;

import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One artifact to fetch.
 *
 * <p>
 * A task stores its file at a single {@link #targetPath()}, but may be
 * listed in several manifests: {@link #placements()} holds every record that
 * referenced the same download, the first one being the record that decided
 * the target path.
 *
 * <p>
 * Status changes are compare-and-set; an illegal transition (e.g. leaving a
 * terminal state) throws {@link IllegalStateException}.
 */
public final class DownloadTask {

    private final Path targetPath;
    private final String source;
    private final long expectedSizeBytes;
    private final String sha256;
    private final List<PatchRecord> placements;
    private final AtomicReference<TaskStatus> status = new AtomicReference<>(TaskStatus.PENDING);

    public DownloadTask(Path targetPath, String source, long expectedSizeBytes, String sha256,
            List<PatchRecord> placements) {
        this.targetPath = Objects.requireNonNull(targetPath, "targetPath");
        this.source = Objects.requireNonNull(source, "source");
        this.expectedSizeBytes = expectedSizeBytes;
        this.sha256 = sha256;
        if (placements.isEmpty()) {
            throw new IllegalArgumentException("A task needs at least one placement: " + targetPath);
        }
        this.placements = List.copyOf(placements);
    }

    public Path targetPath() {
        return targetPath;
    }

    public String source() {
        return source;
    }

    public long expectedSizeBytes() {
        return expectedSizeBytes;
    }

    /** Catalog-reported digest, {@code null} if none. */
    public String sha256() {
        return sha256;
    }

    public List<PatchRecord> placements() {
        return placements;
    }

    public PatchRecord primary() {
        return placements.get(0);
    }

    public String fileName() {
        return targetPath.getFileName().toString();
    }

    public TaskStatus status() {
        return status.get();
    }

    /** {@code PENDING -> IN_PROGRESS} */
    public void begin() {
        transition(TaskStatus.PENDING, TaskStatus.IN_PROGRESS);
    }

    /** {@code PENDING -> DONE}, the file was already in place. */
    public void skip() {
        transition(TaskStatus.PENDING, TaskStatus.DONE);
    }

    /** {@code IN_PROGRESS -> DONE} */
    public void complete() {
        transition(TaskStatus.IN_PROGRESS, TaskStatus.DONE);
    }

    /** {@code IN_PROGRESS -> FAILED} */
    public void fail() {
        transition(TaskStatus.IN_PROGRESS, TaskStatus.FAILED);
    }

    private void transition(TaskStatus from, TaskStatus to) {
        if (!status.compareAndSet(from, to)) {
            throw new IllegalStateException("Cannot move " + fileName() + " from " + status.get() + " to " + to);
        }
    }

    @Override
    public String toString() {
        return "DownloadTask[" + targetPath + ", " + expectedSizeBytes + " bytes, " + status.get() + "]";
    }
}
