package de.bsommerfeld.patchfetcher.catalog.xml;

/**
 * A file of a catalog patch, as written in the catalog. The size stays raw
 * text until a record is built from it.
 *
 * @param downloadUrl absolute URL (host attribute + path)
 * @param sha256      {@code null} if the catalog lists no SHA-256 digest
 */
public record CatalogFile(String name, String size, String downloadUrl, String sha256) {
}
