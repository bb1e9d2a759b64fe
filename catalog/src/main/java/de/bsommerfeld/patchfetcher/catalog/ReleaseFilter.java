package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.catalog.xml.ReleaseComponent;

import java.util.Set;

/**
 * Selects the product release components whose recommended patches are
 * queried.
 *
 * @param productNames exact component names, e.g. {@code Oracle Database}
 */
public record ReleaseFilter(Set<String> productNames) {

    /** Database server, RAC One Node and Clusterware releases. */
    public static final ReleaseFilter DATABASE =
            new ReleaseFilter(Set.of("Oracle Database", "RAC One Node", "Oracle Clusterware"));

    public ReleaseFilter {
        productNames = Set.copyOf(productNames);
    }

    public static ReleaseFilter of(String... productNames) {
        return new ReleaseFilter(Set.of(productNames));
    }

    public boolean accepts(ReleaseComponent component) {
        return productNames.contains(component.name());
    }
}
