package de.bsommerfeld.patchfetcher.downloader.download;

import de.bsommerfeld.patchfetcher.downloader.plan.DownloadTask;

import java.nio.file.Path;

/**
 * Result of one task.
 *
 * @param path  final file location for {@code DOWNLOADED} and
 *              {@code ALREADY_PRESENT}, {@code null} otherwise
 * @param error set for {@code FAILED} only
 */
public record DownloadOutcome(DownloadTask task, Kind kind, Path path, DownloadError error) {

    public enum Kind {
        DOWNLOADED,
        ALREADY_PRESENT,
        FAILED,
        /** Never started because the run was stopped. */
        NOT_ATTEMPTED
    }

    public static DownloadOutcome downloaded(DownloadTask task) {
        return new DownloadOutcome(task, Kind.DOWNLOADED, task.targetPath(), null);
    }

    public static DownloadOutcome alreadyPresent(DownloadTask task) {
        return new DownloadOutcome(task, Kind.ALREADY_PRESENT, task.targetPath(), null);
    }

    public static DownloadOutcome failed(DownloadTask task, DownloadError error) {
        return new DownloadOutcome(task, Kind.FAILED, null, error);
    }

    public static DownloadOutcome notAttempted(DownloadTask task) {
        return new DownloadOutcome(task, Kind.NOT_ATTEMPTED, null, null);
    }

    /** The file is in place, whether fetched now or earlier. */
    public boolean isDone() {
        return kind == Kind.DOWNLOADED || kind == Kind.ALREADY_PRESENT;
    }
}
