package de.bsommerfeld.patchfetcher.core.event;

import java.nio.file.Path;

/**
 * Events published by the download workers. Only data that reporters need
 * belongs here; the task objects themselves stay inside the downloader.
 */
public class DownloadEvents {

    public record TaskStartedEvent(String fileName, long expectedBytes) {
    }

    /**
     * @param bytesRead  bytes present in the part file, including resumed bytes
     * @param totalBytes expected final size
     */
    public record ProgressEvent(String fileName, long bytesRead, long totalBytes) {
    }

    /**
     * @param outcome name of the outcome kind (e.g. {@code DOWNLOADED}, {@code FAILED})
     * @param detail  error message for failures, {@code null} otherwise
     */
    public record TaskFinishedEvent(String fileName, Path target, String outcome, String detail) {
    }

    /** Fired once when the stop signal is raised. */
    public record StopRequestedEvent(String reason) {
    }
}
