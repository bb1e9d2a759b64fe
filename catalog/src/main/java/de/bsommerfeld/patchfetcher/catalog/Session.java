package de.bsommerfeld.patchfetcher.catalog;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Authenticated session against the catalog service.
 *
 * <p>
 * Immutable; a refresh produces a new instance. Workers hold on to the
 * instance they used so that {@link SessionProvider#refresh(Session)} can
 * tell whether someone else already replaced it.
 *
 * @param cookies    session cookies in the order the service set them
 * @param acquiredAt when the login completed
 * @param expiresAt  after this instant the session is treated as stale
 */
public record Session(Map<String, String> cookies, Instant acquiredAt, Instant expiresAt) {

    public Session {
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        cookies = Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** Value for the {@code Cookie} request header, empty if there are no cookies. */
    public String cookieHeader() {
        return cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        // Cookie values are credentials
        return "Session[cookies=" + cookies.keySet() + ", acquiredAt=" + acquiredAt
                + ", expiresAt=" + expiresAt + "]";
    }
}
