package de.bsommerfeld.patchfetcher.downloader.download;

/**
 * Why a task failed. Carried inside a {@link DownloadOutcome}; never thrown.
 */
public record DownloadError(Kind kind, String message) {

    public enum Kind {
        /** Transport errors and unexpected HTTP statuses. */
        TRANSFER,
        /** Size or digest mismatch on the last attempt. */
        INTEGRITY,
        /** Session rejected even after re-authentication. */
        SESSION,
        /** Directory creation, rename or manifest write failed. */
        FILESYSTEM,
        INTERRUPTED
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
