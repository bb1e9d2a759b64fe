package de.bsommerfeld.patchfetcher.downloader.download;

import de.bsommerfeld.patchfetcher.catalog.Session;

import java.nio.file.Path;

/**
 * Moves the bytes of one artifact into a part file.
 */
public interface TransferClient {

    /**
     * Streams {@code url} into {@code partFile}.
     *
     * <p>
     * With {@code offset > 0} the remainder is requested with a {@code Range}
     * header. A {@code 206} answer is appended after the existing bytes; a
     * {@code 200} answer means the server ignored the range, so the part file
     * is truncated and written from the start.
     *
     * @param offset bytes already in {@code partFile}
     * @return size of the part file after the transfer
     * @throws TransferException classified failure; the part file keeps the
     *                           bytes written so far
     */
    long transfer(String url, Session session, Path partFile, long offset, DownloadProgressListener listener)
            throws TransferException;
}
