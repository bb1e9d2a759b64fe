package de.bsommerfeld.patchfetcher.downloader.download;

/**
 * A failed transfer attempt, classified by how the download manager reacts.
 */
public class TransferException extends Exception {

    public enum Kind {
        /** Connection errors, timeouts, {@code 408}, {@code 429}, {@code 5xx}. */
        RETRYABLE,
        /** Size or digest mismatch after a complete transfer. Retried. */
        INTEGRITY,
        /** {@code 401} or {@code 403}: the session needs to be renewed. */
        SESSION_EXPIRED,
        /** Any other client error. Not retried. */
        FATAL,
        INTERRUPTED
    }

    private final Kind kind;

    public TransferException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransferException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE || kind == Kind.INTEGRITY;
    }

    /** Classifies an HTTP status that is neither {@code 200} nor {@code 206}. */
    public static TransferException forStatus(int status, String url) {
        String message = "HTTP " + status + " for " + url;
        if (status == 401 || status == 403) {
            return new TransferException(Kind.SESSION_EXPIRED, message);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return new TransferException(Kind.RETRYABLE, message);
        }
        return new TransferException(Kind.FATAL, message);
    }
}
