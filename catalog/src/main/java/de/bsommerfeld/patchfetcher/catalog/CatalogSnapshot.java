package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.catalog.xml.CatalogPatch;
import de.bsommerfeld.patchfetcher.catalog.xml.Recommendation;
import de.bsommerfeld.patchfetcher.catalog.xml.ReleaseComponent;
import de.bsommerfeld.patchfetcher.core.domain.Platform;

import java.util.List;
import java.util.Map;

/**
 * Parsed content of the catalog archive, fetched once per run.
 */
record CatalogSnapshot(
        Map<String, Platform> platforms,
        Map<String, ReleaseComponent> components,
        Map<String, CatalogPatch> patches,
        List<Recommendation> recommendations) {

    CatalogSnapshot {
        platforms = Map.copyOf(platforms);
        components = Map.copyOf(components);
        patches = Map.copyOf(patches);
        recommendations = List.copyOf(recommendations);
    }

    /** Known platform for {@code code}, or a placeholder named after the code. */
    Platform platform(String code) {
        Platform platform = platforms.get(code);
        return platform != null ? platform : new Platform(code, code);
    }
}
