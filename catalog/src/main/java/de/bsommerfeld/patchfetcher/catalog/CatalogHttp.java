package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.core.config.CatalogConfig;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Request plumbing shared by the session provider and the catalog client:
 * URL resolution, the mandatory user agent, timeouts, and the retry loop.
 *
 * <p>
 * The retry loop treats transport errors, unparseable payloads and
 * {@code 408}/{@code 429}/{@code 5xx} answers as transient. Any other
 * unexpected status aborts immediately with a {@link CatalogException}.
 * {@link CatalogException}s thrown by an attempt (auth failures included) are
 * never retried.
 */
final class CatalogHttp {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogHttp.class);

    @FunctionalInterface
    interface Attempt<T> {
        T run() throws IOException, XMLStreamException, InterruptedException;
    }

    /** Non-success HTTP status. */
    static final class StatusException extends IOException {

        private final int status;

        StatusException(int status, String operation) {
            super("HTTP " + status + " during " + operation);
            this.status = status;
        }

        int status() {
            return status;
        }

        boolean isRetryable() {
            return status == 408 || status == 429 || status >= 500;
        }
    }

    private final HttpClient client;
    private final URI baseUri;
    private final String userAgent;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    CatalogHttp(HttpClient client, CatalogConfig config, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.client = client;
        this.baseUri = URI.create(stripTrailingSlash(config.getBaseUrl()));
        this.userAgent = config.getUserAgent();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    HttpClient client() {
        return client;
    }

    /** Resolves a path (with optional query) against the configured base URL. */
    URI resolve(String pathAndQuery) {
        return URI.create(baseUri + pathAndQuery);
    }

    HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .header("User-Agent", userAgent)
                .timeout(timeout)
                .GET();
    }

    <T> T withRetries(String operation, Attempt<T> attempt) {
        for (int n = 1;; n++) {
            try {
                return attempt.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CatalogUnavailableException(operation + " interrupted", e);
            } catch (IOException | XMLStreamException e) {
                if (e instanceof StatusException status && !status.isRetryable()) {
                    throw new CatalogException(e.getMessage(), e);
                }
                if (!retryPolicy.canRetry(n)) {
                    throw new CatalogUnavailableException(
                            operation + " failed after " + n + " attempt(s): " + e.getMessage(), e);
                }
                Duration wait = retryPolicy.backoffAfter(n);
                LOG.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
                        operation, n, retryPolicy.maxAttempts(), e.getMessage(), wait.toMillis());
                pause(wait, operation);
            }
        }
    }

    static void checkStatus(int status, String operation) throws StatusException {
        if (status < 200 || status >= 300) {
            throw new StatusException(status, operation);
        }
    }

    static boolean isAuthFailure(int status) {
        return status == 401 || status == 403;
    }

    private void pause(Duration wait, String operation) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException(operation + " interrupted", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
