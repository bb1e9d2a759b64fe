package de.bsommerfeld.patchfetcher.downloader.download;

import de.bsommerfeld.patchfetcher.catalog.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;

/**
 * {@link TransferClient} on top of {@link HttpClient}.
 *
 * <h3>Redirects</h3>
 * Download URLs of the update service redirect to a content delivery host,
 * so the client follows redirects (unlike the login flow, which walks them
 * by hand).
 *
 * <h3>Timeouts</h3>
 * The request timeout only bounds the wait for response headers. A stalled
 * body surfaces as an {@link IOException} from the socket and is retried.
 */
public class HttpTransferClient implements TransferClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransferClient.class);

    /** Large enough for throughput, small enough for responsive progress updates. */
    private static final int BUFFER_SIZE = 64 * 1024;

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpTransferClient(String userAgent, Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build(), userAgent, timeout);
    }

    HttpTransferClient(HttpClient client, String userAgent, Duration timeout) {
        this.client = client;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public long transfer(String url, Session session, Path partFile, long offset, DownloadProgressListener listener)
            throws TransferException {
        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .header("User-Agent", userAgent)
                    .timeout(timeout)
                    .GET();
        } catch (IllegalArgumentException e) {
            throw new TransferException(TransferException.Kind.FATAL, "Invalid download URL: " + url, e);
        }
        String cookies = session.cookieHeader();
        if (!cookies.isEmpty()) {
            request.header("Cookie", cookies);
        }
        if (offset > 0) {
            request.header("Range", "bytes=" + offset + "-");
        }

        try {
            HttpResponse<InputStream> response = client.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream in = response.body()) {
                int status = response.statusCode();
                boolean append;
                if (status == 206) {
                    append = offset > 0;
                } else if (status == 200) {
                    if (offset > 0) {
                        LOG.debug("Server ignored range request for {}, restarting", url);
                    }
                    append = false;
                } else if (status == 416) {
                    // Part file no longer matches the remote file
                    Files.deleteIfExists(partFile);
                    throw new TransferException(TransferException.Kind.RETRYABLE,
                            "HTTP 416 for " + url + ", discarded partial download");
                } else {
                    throw TransferException.forStatus(status, url);
                }

                long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1);
                long start = append ? offset : 0;
                long total = contentLength < 0 ? -1 : start + contentLength;
                return writeWithProgress(in, partFile, append, start, total, listener);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException(TransferException.Kind.INTERRUPTED, "Download interrupted: " + url, e);
        } catch (IOException e) {
            throw new TransferException(TransferException.Kind.RETRYABLE,
                    "Transfer of " + url + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Streams bytes from the response into the part file while reporting
     * progress. Returns the part file size afterwards.
     */
    private static long writeWithProgress(InputStream in, Path partFile, boolean append, long start, long total,
            DownloadProgressListener listener) throws IOException {
        StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
        try (OutputStream out = Files.newOutputStream(partFile, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, mode)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = start;
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, total);
            }
            return transferred;
        }
    }
}
