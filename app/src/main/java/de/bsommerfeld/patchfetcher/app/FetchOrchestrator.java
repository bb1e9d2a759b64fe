package de.bsommerfeld.patchfetcher.app;

import de.bsommerfeld.patchfetcher.app.patchlist.PatchListEntry;
import de.bsommerfeld.patchfetcher.catalog.CatalogClient;
import de.bsommerfeld.patchfetcher.catalog.ReleaseFilter;
import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.config.FetcherConfig;
import de.bsommerfeld.patchfetcher.core.domain.FilterConfig;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.core.util.ByteFormatter;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadOutcome;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadScheduler;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadSummary;
import de.bsommerfeld.patchfetcher.downloader.download.StopSignal;
import de.bsommerfeld.patchfetcher.downloader.filter.FilterEngine;
import de.bsommerfeld.patchfetcher.downloader.filter.FilterResult;
import de.bsommerfeld.patchfetcher.downloader.filter.PlatformMatcher;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadPlan;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadPlanner;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one invocation of the tool: catalog queries, filtering, planning and
 * either the dry-run report or the downloads.
 *
 * <h3>Recommended mode</h3>
 * Fetches AHF and OPatch for the configured platforms, then every patch the
 * catalog recommends for the database releases.
 *
 * <h3>Patch-list mode</h3>
 * Fetches the listed patches for the platforms named in each row. The rows'
 * platforms replace the configured ones; release and description exclusions
 * still apply.
 *
 * <p>
 * All catalog queries complete before planning starts. The scheduler, and
 * with it the worker pool, is only created for a real run.
 */
public class FetchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(FetchOrchestrator.class);

    static final String AHF_PATCH_NUMBER = "30166242";
    static final String OPATCH_PATCH_NUMBER = "6880880";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final FetcherConfig config;
    private final CatalogClient catalog;
    private final DownloadPlanner planner;
    private final Provider<DownloadScheduler> scheduler;
    private final StopSignal stopSignal;

    @Inject
    public FetchOrchestrator(FetcherConfig config, CatalogClient catalog, DownloadPlanner planner,
            Provider<DownloadScheduler> scheduler, StopSignal stopSignal) {
        this.config = config;
        this.catalog = catalog;
        this.planner = planner;
        this.scheduler = scheduler;
        this.stopSignal = stopSignal;
    }

    /** Prints {@code CODE - NAME} for every catalog platform, sorted by name. */
    public int listPlatforms(PrintStream out) {
        List<Platform> platforms = catalog.listPlatforms();
        out.println("CODE   - NAME");
        out.println("==========================================================");
        for (Platform platform : platforms) {
            out.printf("%-6s - %s%n", platform.code(), platform.name());
        }
        return EXIT_OK;
    }

    /**
     * @param patchList rows of a patch-list file, {@code null} for the
     *                  recommended patches
     * @return process exit status
     * @throws ConfigException if a filter pattern is invalid
     */
    public int fetch(List<PatchListEntry> patchList, boolean dryRun, PrintStream out) throws ConfigException {
        List<PatchRecord> records = new ArrayList<>();
        FilterConfig filterConfig = patchList == null
                ? collectRecommended(records)
                : collectListed(patchList, records);

        FilterResult selection = FilterEngine.compile(filterConfig).select(records);
        LOG.info("Selected {} of {} catalog file(s)", selection.selected().size(), records.size());

        DownloadPlan plan = planner.plan(selection.selected());
        if (dryRun) {
            out.println("Files to download: " + plan.size());
            out.println("Total downloaded ~ " + ByteFormatter.formatMegabytes(plan.totalBytes()));
            return EXIT_OK;
        }
        if (plan.isEmpty()) {
            LOG.warn("Nothing to download");
            out.println("Total downloaded ~ " + ByteFormatter.formatMegabytes(0));
            return EXIT_OK;
        }

        DownloadSummary summary = scheduler.get().run(plan);
        report(summary, out);
        boolean incomplete = summary.count(DownloadOutcome.Kind.NOT_ATTEMPTED) > 0;
        return summary.hasFailures() || incomplete ? EXIT_FAILURE : EXIT_OK;
    }

    private FilterConfig collectRecommended(List<PatchRecord> records) throws ConfigException {
        List<Platform> targets = PlatformMatcher.compile(config.getPlatforms()).select(catalog.listPlatforms());
        if (targets.isEmpty()) {
            LOG.warn("None of the configured platforms {} is known to the catalog", config.getPlatforms());
        } else {
            LOG.debug("Target platforms: {}", targets);
            collect(AHF_PATCH_NUMBER, targets, PatchCategory.AHF, null, records);
            collect(OPATCH_PATCH_NUMBER, targets, PatchCategory.OPATCH, null, records);
        }
        catalog.queryRecommendedPatches(ReleaseFilter.DATABASE).forEach(records::add);
        return config.toFilterConfig();
    }

    private FilterConfig collectListed(List<PatchListEntry> patchList, List<PatchRecord> records) {
        List<Platform> known = catalog.listPlatforms();
        Set<String> platformCodes = new LinkedHashSet<>();

        for (PatchListEntry entry : patchList) {
            List<Platform> platforms = entry.resolvePlatforms(known);
            if (platforms.isEmpty()) {
                LOG.warn("Platform ({}) for patch {} is unknown, skipping line {}", entry.platform(),
                        entry.patchNumber(), entry.line());
                continue;
            }
            platforms.forEach(p -> platformCodes.add(p.code()));
            List<PatchRecord> found = collect(entry.patchNumber(), platforms, PatchCategory.LISTED, entry.group(),
                    records);
            // the search may answer with a generic build instead of the requested platform
            found.forEach(record -> platformCodes.add(record.platform().code()));
            if (found.isEmpty()) {
                LOG.warn("No files found for patch {} on {}", entry.patchNumber(),
                        platforms.stream().map(Platform::name).collect(Collectors.joining(", ")));
            }
        }
        return config.toFilterConfig().withPlatforms(List.copyOf(platformCodes));
    }

    private List<PatchRecord> collect(String patchNumber, List<Platform> platforms, PatchCategory category, String group,
            List<PatchRecord> records) {
        List<PatchRecord> found = catalog.queryPatchByNumber(patchNumber, platforms)
                .map(record -> record.withPlacement(category, group))
                .toList();
        records.addAll(found);
        return found;
    }

    private void report(DownloadSummary summary, PrintStream out) {
        out.printf("Downloaded: %d, already present: %d, failed: %d, not attempted: %d%n",
                summary.count(DownloadOutcome.Kind.DOWNLOADED),
                summary.count(DownloadOutcome.Kind.ALREADY_PRESENT),
                summary.count(DownloadOutcome.Kind.FAILED),
                summary.count(DownloadOutcome.Kind.NOT_ATTEMPTED));
        for (String file : summary.failedFiles()) {
            out.println("  failed: " + file);
        }
        for (String error : summary.manifestErrors()) {
            out.println("  manifest error: " + error);
        }
        if (stopSignal.isRaised()) {
            out.println("Stopped early: " + stopSignal.reason());
        }
        out.println("Total downloaded ~ " + ByteFormatter.formatMegabytes(summary.bytesTransferred()));
    }
}
