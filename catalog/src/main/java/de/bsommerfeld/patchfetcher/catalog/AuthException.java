package de.bsommerfeld.patchfetcher.catalog;

/**
 * The catalog service rejected the credentials or the session. Fatal for the
 * run.
 */
public class AuthException extends CatalogException {

    public AuthException(String message) {
        super(message);
    }
}
