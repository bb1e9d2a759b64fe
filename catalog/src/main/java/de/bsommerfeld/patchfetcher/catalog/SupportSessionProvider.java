package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.core.config.CatalogConfig;
import de.bsommerfeld.patchfetcher.core.config.CredentialsConfig;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs in to the support update service with HTTP Basic credentials.
 *
 * <h3>Login flow</h3>
 * The service only accepts Basic authentication from non-browser user agents
 * and answers the initial request with a chain of redirects through the SSO
 * host, each of which sets cookies. The chain must be walked by hand so that
 * every intermediate {@code Set-Cookie} is captured, which is why the
 * {@link HttpClient} passed in must not follow redirects itself.
 *
 * <pre>
 * GET /Orion/Services/download   (Basic auth)
 *   → 302 Location: https://login.../sso   Set-Cookie: ...
 *   → 302 Location: /Orion/Services/download   Set-Cookie: ...
 *   → 200   session established
 * </pre>
 *
 * <h3>Concurrency</h3>
 * {@link #current()} and {@link #refresh(Session)} are synchronized. Workers
 * that all see the same rejected session queue up on {@code refresh}; the
 * first logs in, the rest get the new session back without another login.
 */
public class SupportSessionProvider implements SessionProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SupportSessionProvider.class);

    static final String LOGIN_PATH = "/Orion/Services/download";

    private static final int MAX_REDIRECTS = 10;

    private final CatalogHttp http;
    private final String authorization;
    private final Duration ttl;
    private final Clock clock;

    private Session session;

    public SupportSessionProvider(HttpClient client, CatalogConfig config, CredentialsConfig credentials,
            RetryPolicy retryPolicy, Sleeper sleeper, Clock clock) {
        this.http = new CatalogHttp(client, config, retryPolicy, sleeper);
        this.authorization = basicAuth(credentials);
        this.ttl = Duration.ofMinutes(config.getSessionTtlMinutes());
        this.clock = clock;
    }

    @Override
    public synchronized Session current() {
        if (session == null || session.isExpired(clock.instant())) {
            session = login();
        }
        return session;
    }

    @Override
    public synchronized Session refresh(Session stale) {
        if (session != null && session != stale && !session.isExpired(clock.instant())) {
            LOG.debug("Session already refreshed by another worker");
            return session;
        }
        session = login();
        return session;
    }

    private Session login() {
        LOG.info("Logging in to {}", http.resolve(LOGIN_PATH).getHost());
        Session fresh = http.withRetries("Login", this::attemptLogin);
        LOG.debug("Login succeeded with {} cookie(s), valid until {}", fresh.cookies().size(), fresh.expiresAt());
        return fresh;
    }

    private Session attemptLogin() throws IOException, InterruptedException {
        Map<String, String> cookies = new LinkedHashMap<>();
        URI uri = http.resolve(LOGIN_PATH);

        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HttpRequest.Builder request = http.request(uri).header("Authorization", authorization);
            if (!cookies.isEmpty()) {
                request.header("Cookie", cookieHeader(cookies));
            }

            HttpResponse<Void> response = http.client().send(request.build(), HttpResponse.BodyHandlers.discarding());
            collectCookies(response, cookies);

            int status = response.statusCode();
            if (status == 200) {
                Instant now = clock.instant();
                return new Session(cookies, now, now.plus(ttl));
            }
            if (CatalogHttp.isAuthFailure(status)) {
                throw new AuthException("Login rejected (HTTP " + status + "): check username and password");
            }
            if (isRedirect(status)) {
                String location = response.headers().firstValue("Location")
                        .orElseThrow(() -> new IOException("Redirect without Location header from " + response.uri()));
                uri = uri.resolve(location);
                LOG.debug("Login redirect {} -> {}", status, uri.getHost() + uri.getPath());
                continue;
            }
            CatalogHttp.checkStatus(status, "Login");
            // Any other 2xx: no session content to wait for
            Instant now = clock.instant();
            return new Session(cookies, now, now.plus(ttl));
        }
        throw new IOException("Login exceeded " + MAX_REDIRECTS + " redirects");
    }

    private static void collectCookies(HttpResponse<?> response, Map<String, String> cookies) {
        for (String header : response.headers().allValues("Set-Cookie")) {
            try {
                for (HttpCookie cookie : HttpCookie.parse(header)) {
                    cookies.put(cookie.getName(), cookie.getValue());
                }
            } catch (IllegalArgumentException e) {
                LOG.debug("Ignoring unparseable Set-Cookie header: {}", e.getMessage());
            }
        }
    }

    private static String cookieHeader(Map<String, String> cookies) {
        StringBuilder sb = new StringBuilder();
        cookies.forEach((name, value) -> {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(name).append('=').append(value);
        });
        return sb.toString();
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static String basicAuth(CredentialsConfig credentials) {
        String user = credentials.getUsername() == null ? "" : credentials.getUsername();
        String password = credentials.getPassword() == null ? "" : credentials.getPassword();
        String token = user + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }
}
