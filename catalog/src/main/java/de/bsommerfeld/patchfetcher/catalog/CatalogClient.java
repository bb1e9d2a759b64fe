package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Normalized queries against the catalog service.
 *
 * <p>
 * The client maps vendor data into {@link PatchRecord}s and does not filter.
 * Streams are lazy: no request is issued before a terminal operation, and
 * failures surface from that operation as {@link CatalogException}s.
 * Entries that cannot be mapped are logged and left out.
 */
public interface CatalogClient {

    /** Every platform the catalog knows, sorted by name. */
    List<Platform> listPlatforms();

    /**
     * Patches recommended for the release components accepted by
     * {@code releaseFilter}, as {@code QUARTER} records whose release is the
     * component version.
     */
    Stream<PatchRecord> queryRecommendedPatches(ReleaseFilter releaseFilter);

    /**
     * Every file of {@code patchNumber} on each of {@code platforms}, as
     * {@code LISTED} records without a group.
     */
    Stream<PatchRecord> queryPatchByNumber(String patchNumber, Collection<Platform> platforms);
}
