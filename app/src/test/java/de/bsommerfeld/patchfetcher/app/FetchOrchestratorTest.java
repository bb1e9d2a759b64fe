package de.bsommerfeld.patchfetcher.app;

import de.bsommerfeld.patchfetcher.app.patchlist.PatchListEntry;
import de.bsommerfeld.patchfetcher.catalog.CatalogClient;
import de.bsommerfeld.patchfetcher.catalog.ReleaseFilter;
import de.bsommerfeld.patchfetcher.catalog.Session;
import de.bsommerfeld.patchfetcher.catalog.SessionProvider;
import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.config.FetcherConfig;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.downloader.download.DiskSpaceGuard;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadManager;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadScheduler;
import de.bsommerfeld.patchfetcher.downloader.download.StopSignal;
import de.bsommerfeld.patchfetcher.downloader.download.TransferClient;
import de.bsommerfeld.patchfetcher.downloader.download.TransferException;
import de.bsommerfeld.patchfetcher.downloader.layout.LayoutWriter;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs the orchestration against a mocked catalog and an in-memory
 * transfer client.
 */
@ExtendWith(MockitoExtension.class)
class FetchOrchestratorTest {

    private static final long MB = 1024L * 1024;

    private static final Platform LINUX = new Platform("226", "Linux x86-64");
    private static final Platform SOLARIS = new Platform("23", "Oracle Solaris on SPARC (64-bit)");
    private static final Platform GENERIC = new Platform("2000", "Generic Platform");

    @TempDir
    Path tempDir;

    @Mock
    private CatalogClient catalog;

    @Mock
    private SessionProvider sessions;

    private Path root;
    private FetcherConfig config;
    private ByteArrayOutputStream buffer;
    private PrintStream out;
    private StopSignal stopSignal;
    private final Map<String, Long> sizes = new ConcurrentHashMap<>();
    private final Set<String> failingUrls = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("patches");
        config = new FetcherConfig();
        config.setDownloadRoot(root);
        config.setPlatforms(List.of("Linux x86-64"));
        config.setMaxConcurrency(2);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        stopSignal = new StopSignal(new ApplicationEventBus());
        lenient().when(sessions.current()).thenReturn(new Session(Map.of(), Instant.EPOCH, Instant.MAX));
    }

    @Test
    void listPlatforms_shouldPrintCodeAndNamePairs() {
        when(catalog.listPlatforms()).thenReturn(List.of(GENERIC, LINUX, SOLARIS));

        int status = orchestrator().listPlatforms(out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        List<String> lines = output().lines().toList();
        assertEquals("CODE   - NAME", lines.get(0));
        assertEquals("2000   - Generic Platform", lines.get(2));
        assertEquals("226    - Linux x86-64", lines.get(3));
        assertEquals(5, lines.size());
    }

    // -- Recommended mode --

    @Test
    void fetch_shouldPlaceAhfOpatchAndRecommendedPatches() throws Exception {
        PatchRecord ahf = listed("30166242", LINUX, "AHF", 8);
        PatchRecord opatch = listed("6880880", LINUX, "OPatch", 8);
        PatchRecord ru = quarter("36233263", LINUX, "DATABASE RELEASE UPDATE", 16);
        PatchRecord ruSolaris = quarter("36233263", SOLARIS, "DATABASE RELEASE UPDATE", 16);
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX, SOLARIS));
        when(catalog.queryPatchByNumber(eq(FetchOrchestrator.AHF_PATCH_NUMBER), anyCollection()))
                .thenReturn(Stream.of(ahf));
        when(catalog.queryPatchByNumber(eq(FetchOrchestrator.OPATCH_PATCH_NUMBER), anyCollection()))
                .thenReturn(Stream.of(opatch));
        when(catalog.queryRecommendedPatches(ReleaseFilter.DATABASE)).thenReturn(Stream.of(ru, ruSolaris));

        int status = orchestrator().fetch(null, false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertTrue(Files.isRegularFile(root.resolve("ahf").resolve(ahf.fileName())));
        assertTrue(Files.isRegularFile(root.resolve("opatch").resolve(opatch.fileName())));
        Path quarterDir = root.resolve("quarter_patches").resolve("19.0.0.0.0").resolve(LINUX.name());
        assertTrue(Files.isRegularFile(quarterDir.resolve(ru.fileName())));
        assertFalse(Files.exists(root.resolve("quarter_patches").resolve("19.0.0.0.0").resolve(SOLARIS.name())));
        verify(catalog).queryPatchByNumber(FetchOrchestrator.AHF_PATCH_NUMBER, List.of(LINUX));
        assertTrue(output().contains("Downloaded: 3, already present: 0, failed: 0, not attempted: 0"));
    }

    @Test
    void fetch_shouldReportSizeWithoutDownloadingOnDryRun() throws Exception {
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryPatchByNumber(anyString(), anyCollection())).thenReturn(Stream.empty(), Stream.empty());
        when(catalog.queryRecommendedPatches(ReleaseFilter.DATABASE)).thenReturn(Stream.of(
                quarter("1", LINUX, "first", 512 * MB),
                quarter("2", LINUX, "second", 768 * MB)));
        FetchOrchestrator orchestrator = new FetchOrchestrator(config, catalog, new DownloadPlanner(layout()),
                () -> fail("dry run must not create the scheduler"), stopSignal);

        int status = orchestrator.fetch(null, true, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertTrue(output().contains("Total downloaded ~ 1,280.00 MB"));
        assertFalse(Files.exists(root));
    }

    @Test
    void fetch_shouldSkipPlatformQueriesWhenNoConfiguredPlatformIsKnown() throws Exception {
        config.setPlatforms(List.of("HP-UX.*"));
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryRecommendedPatches(ReleaseFilter.DATABASE))
                .thenReturn(Stream.of(quarter("1", LINUX, "first", 8)));

        int status = orchestrator().fetch(null, false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        verify(catalog, never()).queryPatchByNumber(anyString(), anyCollection());
        assertFalse(Files.exists(root));
    }

    @Test
    void fetch_shouldReturnFailureWhenADownloadFails() throws Exception {
        PatchRecord good = quarter("1", LINUX, "first", 8);
        PatchRecord bad = quarter("2", LINUX, "second", 8);
        failingUrls.add(bad.downloadRef());
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryPatchByNumber(anyString(), anyCollection())).thenReturn(Stream.empty(), Stream.empty());
        when(catalog.queryRecommendedPatches(ReleaseFilter.DATABASE)).thenReturn(Stream.of(good, bad));

        int status = orchestrator().fetch(null, false, out);

        assertEquals(FetchOrchestrator.EXIT_FAILURE, status);
        assertTrue(output().contains("  failed: " + bad.fileName()));
        assertTrue(Files.isRegularFile(layout().targetPathFor(good)));
    }

    @Test
    void fetch_shouldRejectInvalidExclusionPattern() {
        config.setIgnoredReleases(List.of("(12"));
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryPatchByNumber(anyString(), anyCollection())).thenReturn(Stream.empty(), Stream.empty());
        when(catalog.queryRecommendedPatches(ReleaseFilter.DATABASE)).thenReturn(Stream.empty());

        assertThrows(ConfigException.class, () -> orchestrator().fetch(null, false, out));
    }

    // -- Patch-list mode --

    @Test
    void fetch_shouldDownloadListedPatchesIntoGroups() throws Exception {
        config.setPlatforms(List.of());
        PatchRecord opatch = listed("6880880", LINUX, "OPatch", 8);
        PatchRecord generic = listed("31424070", GENERIC, "Generic fix", 8);
        when(catalog.listPlatforms()).thenReturn(List.of(GENERIC, LINUX));
        when(catalog.queryPatchByNumber("6880880", List.of(LINUX))).thenReturn(Stream.of(opatch));
        when(catalog.queryPatchByNumber("31424070", List.of(GENERIC))).thenReturn(Stream.of(generic));
        List<PatchListEntry> patchList = List.of(
                new PatchListEntry(1, "6880880", "tools", "226"),
                new PatchListEntry(2, "31424070", "", ""),
                new PatchListEntry(3, "12345", "misc", "AIX"));

        int status = orchestrator().fetch(patchList, false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertTrue(Files.isRegularFile(root.resolve("tools").resolve(opatch.fileName())));
        assertTrue(Files.isRegularFile(root.resolve(generic.fileName())));
        List<String> manifest = Files.readAllLines(root.resolve("tools").resolve(LayoutWriter.MANIFEST_FILE),
                StandardCharsets.UTF_8);
        assertEquals(List.of(opatch.fileName() + " - OPatch"), manifest);
        verify(catalog, never()).queryPatchByNumber(eq("12345"), anyCollection());
    }

    @Test
    void fetch_shouldListSamePatchInEveryGroup() throws Exception {
        config.setPlatforms(List.of());
        PatchRecord opatch = listed("6880880", LINUX, "OPatch", 8);
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryPatchByNumber("6880880", List.of(LINUX)))
                .thenReturn(Stream.of(opatch), Stream.of(opatch));
        List<PatchListEntry> patchList = List.of(
                new PatchListEntry(1, "6880880", "tools", "226"),
                new PatchListEntry(2, "6880880", "db", "226"));

        int status = orchestrator().fetch(patchList, false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertTrue(Files.isRegularFile(root.resolve("db").resolve(opatch.fileName())));
        for (String group : List.of("tools", "db")) {
            assertEquals(List.of(opatch.fileName() + " - OPatch"),
                    Files.readAllLines(root.resolve(group).resolve(LayoutWriter.MANIFEST_FILE),
                            StandardCharsets.UTF_8), group);
        }
        assertTrue(output().contains("Downloaded: 1, already present: 0, failed: 0, not attempted: 0"));
    }

    @Test
    void fetch_shouldKeepResultsTheSearchReturnsForAnotherPlatform() throws Exception {
        config.setPlatforms(List.of());
        PatchRecord generic = listed("31424070", GENERIC, "Generic fix", 8);
        when(catalog.listPlatforms()).thenReturn(List.of(GENERIC, LINUX));
        when(catalog.queryPatchByNumber("31424070", List.of(LINUX))).thenReturn(Stream.of(generic));

        int status = orchestrator().fetch(List.of(new PatchListEntry(1, "31424070", "misc", "226")), false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertTrue(Files.isRegularFile(root.resolve("misc").resolve(generic.fileName())));
        assertTrue(output().contains("Downloaded: 1"));
    }

    @Test
    void fetch_shouldApplyDescriptionExclusionsToListedPatches() throws Exception {
        config.setIgnoredDescriptionWords(List.of("OJVM"));
        PatchRecord ojvm = listed("34672698", LINUX, "OJVM RELEASE UPDATE", 8);
        when(catalog.listPlatforms()).thenReturn(List.of(LINUX));
        when(catalog.queryPatchByNumber("34672698", List.of(LINUX))).thenReturn(Stream.of(ojvm));

        int status = orchestrator().fetch(List.of(new PatchListEntry(1, "34672698", "db", "226")), false, out);

        assertEquals(FetchOrchestrator.EXIT_OK, status);
        assertFalse(Files.exists(root.resolve("db")));
    }

    private FetchOrchestrator orchestrator() {
        LayoutWriter layout = layout();
        DownloadManager manager = new DownloadManager(transferClient(), sessions, RetryPolicy.of(1, 0, 0),
                new ApplicationEventBus(), duration -> {
                });
        DownloadScheduler scheduler = new DownloadScheduler(manager, layout,
                new DiskSpaceGuard(0, path -> Long.MAX_VALUE), stopSignal, config.getMaxConcurrency());
        return new FetchOrchestrator(config, catalog, new DownloadPlanner(layout), () -> scheduler, stopSignal);
    }

    private LayoutWriter layout() {
        return new LayoutWriter(root);
    }

    private TransferClient transferClient() {
        return (url, session, partFile, offset, listener) -> {
            if (failingUrls.contains(url)) {
                throw TransferException.forStatus(404, url);
            }
            try {
                Files.write(partFile, new byte[sizes.get(url).intValue()]);
                return Files.size(partFile);
            } catch (IOException e) {
                throw new TransferException(TransferException.Kind.RETRYABLE, e.getMessage(), e);
            }
        };
    }

    private PatchRecord quarter(String number, Platform platform, String description, long size) {
        return record(number, platform, description, size, PatchCategory.QUARTER);
    }

    private PatchRecord listed(String number, Platform platform, String description, long size) {
        return record(number, platform, description, size, PatchCategory.LISTED);
    }

    private PatchRecord record(String number, Platform platform, String description, long size,
            PatchCategory category) {
        String fileName = "p" + number + "_190000_" + platform.code() + ".zip";
        String url = "https://updates.example.com/files/" + fileName;
        sizes.put(url, size);
        return new PatchRecord(number, "19.0.0.0.0", platform, description, fileName, size, url, null,
                category, null);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
