package de.bsommerfeld.patchfetcher.catalog.xml;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Patches recommended for one release component on one platform.
 */
public record Recommendation(String cid, String platformCode, Set<String> patchUids) {

    public Recommendation {
        patchUids = Collections.unmodifiableSet(new LinkedHashSet<>(patchUids));
    }
}
