package de.bsommerfeld.patchfetcher.catalog;

/**
 * Query-stage failure of the catalog service. Unchecked so it can surface
 * from inside the lazy record streams returned by {@link CatalogClient}.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
