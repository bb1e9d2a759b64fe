package de.bsommerfeld.patchfetcher.catalog.xml;

import java.util.List;

/**
 * A patch entry of {@code patch_recommendations.xml} or a search result.
 *
 * @param uid          catalog-internal identifier, referenced by recommendations;
 *                     {@code null} for search results
 * @param number       patch number
 * @param description  bug abstract
 * @param platformName name in the platform element, may be {@code null}
 * @param releaseName  release the patch was built for
 */
public record CatalogPatch(String uid, String number, String description, String platformCode,
        String platformName, String releaseName, List<CatalogFile> files) {

    public CatalogPatch {
        files = List.copyOf(files);
    }
}
