package de.bsommerfeld.patchfetcher.catalog.xml;

import java.util.List;
import java.util.Map;

/**
 * Parsed content of {@code patch_recommendations.xml}.
 *
 * @param patches         patch entries by uid
 * @param recommendations standalone and component recommendations merged by
 *                        (cid, platform), in document order
 */
public record RecommendationData(Map<String, CatalogPatch> patches, List<Recommendation> recommendations) {
}
