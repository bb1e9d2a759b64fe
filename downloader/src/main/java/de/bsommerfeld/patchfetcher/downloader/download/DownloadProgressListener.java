package de.bsommerfeld.patchfetcher.downloader.download;

/**
 * Callback for tracking transfer progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    /**
     * Called after every buffer written to the part file.
     *
     * @param bytesRead  bytes in the part file so far, resumed bytes included
     * @param totalBytes expected final size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
