package de.bsommerfeld.patchfetcher.catalog;

/**
 * Source of authenticated sessions. Implementations must be thread-safe:
 * download workers call {@link #refresh(Session)} concurrently when the
 * service starts rejecting a session.
 */
public interface SessionProvider {

    /**
     * Returns a valid session, logging in on first use or after expiry.
     *
     * @throws AuthException                if the credentials are rejected
     * @throws CatalogUnavailableException if the service cannot be reached
     */
    Session current();

    /**
     * Replaces {@code stale} with a fresh session. If another caller already
     * replaced it, the newer session is returned without logging in again.
     *
     * @throws AuthException                if the credentials are rejected
     * @throws CatalogUnavailableException if the service cannot be reached
     */
    Session refresh(Session stale);
}
