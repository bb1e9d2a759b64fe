package de.bsommerfeld.patchfetcher.catalog;

/**
 * The catalog service could not be reached, or kept answering with errors or
 * unparseable data, for every configured attempt.
 */
public class CatalogUnavailableException extends CatalogException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
