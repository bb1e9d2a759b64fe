package de.bsommerfeld.patchfetcher.downloader.plan;

/**
 * Lifecycle of a {@link DownloadTask}:
 * {@code PENDING -> IN_PROGRESS -> DONE | FAILED}, or {@code PENDING -> DONE}
 * when the file is already present. {@code DONE} and {@code FAILED} are
 * terminal.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
