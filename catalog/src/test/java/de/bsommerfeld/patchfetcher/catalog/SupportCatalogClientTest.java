package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.core.config.CatalogConfig;
import de.bsommerfeld.patchfetcher.core.config.CredentialsConfig;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static de.bsommerfeld.patchfetcher.catalog.FakeCatalogServer.catalogZip;
import static de.bsommerfeld.patchfetcher.catalog.FakeCatalogServer.cookies;
import static de.bsommerfeld.patchfetcher.catalog.FakeCatalogServer.resource;
import static de.bsommerfeld.patchfetcher.catalog.FakeCatalogServer.respond;
import static de.bsommerfeld.patchfetcher.catalog.FakeCatalogServer.utf8;
import static org.junit.jupiter.api.Assertions.*;

class SupportCatalogClientTest {

    private static final String LOGIN = SupportSessionProvider.LOGIN_PATH;
    private static final String CATALOG = SupportCatalogClient.CATALOG_PATH;
    private static final String SEARCH = SupportCatalogClient.SEARCH_PATH;

    private static final Platform LINUX = new Platform("226", "Linux x86-64");
    private static final Platform LINUX_32 = new Platform("46", "Linux x86");

    private FakeCatalogServer server;
    private SupportCatalogClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeCatalogServer();
        server.acceptLogin("s1");

        CatalogConfig config = new CatalogConfig();
        config.setBaseUrl(server.baseUrl());
        HttpClient http = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
        RetryPolicy retryPolicy = RetryPolicy.of(3, 0, 0);
        Sleeper noWait = d -> {
        };
        SessionProvider sessions = new SupportSessionProvider(http, config,
                new CredentialsConfig("dba@example.com", "pw"), retryPolicy, noWait, Clock.systemUTC());
        client = new SupportCatalogClient(http, config, sessions, retryPolicy, noWait);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void listPlatforms_shouldReturnPlatformsSortedByName() {
        serveCatalog();

        List<Platform> platforms = client.listPlatforms();

        assertEquals(List.of("Generic Platform", "Linux x86", "Linux x86-64", "Oracle Solaris on SPARC (64-bit)"),
                platforms.stream().map(Platform::name).toList());
    }

    @Test
    void queryRecommendedPatches_shouldMapFilesOfAcceptedReleases() {
        serveCatalog();

        List<PatchRecord> records = client.queryRecommendedPatches(ReleaseFilter.DATABASE).toList();

        // u3 lacks a size and u9 is not in the patch list; u4 belongs to an EM release
        assertEquals(List.of("p36233263_190000_Linux-x86-64.zip", "p36199232_190000_Linux-x86-64.zip"),
                records.stream().map(PatchRecord::fileName).toList());

        PatchRecord ru = records.get(0);
        assertEquals("36233263", ru.patchNumber());
        assertEquals("19.0.0.0.0", ru.release());
        assertEquals(LINUX, ru.platform());
        assertEquals("Linux x86-64", ru.platform().name());
        assertEquals(512, ru.sizeBytes());
        assertEquals("https://updates.example.com/files/p36233263.zip", ru.downloadRef());
        assertNotNull(ru.sha256());
        assertEquals(PatchCategory.QUARTER, ru.category());
        assertNull(ru.group());
    }

    @Test
    void queryRecommendedPatches_shouldHonourCustomReleaseFilter() {
        serveCatalog();

        List<PatchRecord> records = client
                .queryRecommendedPatches(ReleaseFilter.of("Enterprise Manager Base Platform")).toList();

        assertEquals(1, records.size());
        assertEquals("13.5.0.0.0", records.get(0).release());
    }

    @Test
    void queryRecommendedPatches_shouldNotContactServiceBeforeTerminalOperation() {
        serveCatalog();

        Stream<PatchRecord> records = client.queryRecommendedPatches(ReleaseFilter.DATABASE);
        assertEquals(0, server.hits(LOGIN));
        assertEquals(0, server.hits(CATALOG));

        assertEquals(2, records.count());
        assertEquals(1, server.hits(CATALOG));
    }

    @Test
    void catalog_shouldBeFetchedOncePerClient() {
        serveCatalog();

        client.listPlatforms();
        client.queryRecommendedPatches(ReleaseFilter.DATABASE).toList();
        client.queryRecommendedPatches(ReleaseFilter.of("Oracle Clusterware")).toList();

        assertEquals(1, server.hits(CATALOG));
        assertEquals(1, server.hits(LOGIN));
    }

    @Test
    void queryPatchByNumber_shouldSearchEveryPlatform() {
        server.handle(SEARCH, exchange -> {
            String query = exchange.getRequestURI().getQuery();
            String fixture = query.contains("platform=226") ? "search_opatch.xml" : "search_no_patches.xml";
            respond(exchange, 200, resource(fixture));
        });

        List<PatchRecord> records = client.queryPatchByNumber("6880880", List.of(LINUX, LINUX_32)).toList();

        assertEquals(2, server.hits(SEARCH));
        assertEquals(2, records.size());
        assertEquals(List.of("19.0.0.0.0", "21.0.0.0.0"), records.stream().map(PatchRecord::release).toList());
        assertTrue(records.stream().allMatch(r -> r.category() == PatchCategory.LISTED));
        assertEquals("AA11", records.get(0).sha256());
        assertEquals(128, records.get(0).sizeBytes());
    }

    @Test
    void queryPatchByNumber_shouldFailOnUnexpectedServiceError() {
        server.handle(SEARCH, exchange -> respond(exchange, 200,
                utf8("<results><error><id>10-001</id><message>Bad request</message></error></results>")));

        Stream<PatchRecord> records = client.queryPatchByNumber("1", List.of(LINUX));

        CatalogException ex = assertThrows(CatalogException.class, records::toList);
        assertFalse(ex instanceof CatalogUnavailableException);
    }

    @Test
    void fetch_shouldLoginAgainOnceWhenSessionIsRejected() {
        AtomicInteger calls = new AtomicInteger();
        server.handle(CATALOG, exchange -> {
            if (calls.incrementAndGet() == 1) {
                respond(exchange, 401, new byte[0]);
            } else {
                respond(exchange, 200, catalogZip());
            }
        });

        assertEquals(4, client.listPlatforms().size());
        assertEquals(2, server.hits(LOGIN));
        assertEquals(2, server.hits(CATALOG));
    }

    @Test
    void fetch_shouldRaiseAuthExceptionWhenRejectedAfterRelogin() {
        server.handle(CATALOG, exchange -> respond(exchange, 403, new byte[0]));

        assertThrows(AuthException.class, client::listPlatforms);
        assertEquals(2, server.hits(LOGIN));
        assertEquals(2, server.hits(CATALOG));
    }

    @Test
    void fetch_shouldRaiseCatalogUnavailableAfterConfiguredAttempts() {
        server.handle(CATALOG, exchange -> respond(exchange, 503, new byte[0]));

        assertThrows(CatalogUnavailableException.class, client::listPlatforms);
        assertEquals(3, server.hits(CATALOG));
    }

    @Test
    void fetch_shouldTreatIncompleteArchiveAsUnavailable() {
        byte[] partial = FakeCatalogServer.zip(Map.of(
                SupportCatalogClient.PLATFORMS_ENTRY, resource("aru_platforms.xml")));
        server.handle(CATALOG, exchange -> respond(exchange, 200, partial));

        assertThrows(CatalogUnavailableException.class, client::listPlatforms);
        assertEquals(3, server.hits(CATALOG));
    }

    @Test
    void fetch_shouldRetryAfterFailedCatalogFetchOnNextCall() {
        AtomicInteger calls = new AtomicInteger();
        server.handle(CATALOG, exchange -> {
            if (calls.incrementAndGet() <= 3) {
                respond(exchange, 500, new byte[0]);
            } else {
                respond(exchange, 200, catalogZip());
            }
        });

        assertThrows(CatalogUnavailableException.class, client::listPlatforms);
        assertEquals(4, client.listPlatforms().size());
    }

    private void serveCatalog() {
        server.handle(CATALOG, exchange -> {
            if (!cookies(exchange).contains("ORA_SESSION=s1")) {
                respond(exchange, 401, new byte[0]);
                return;
            }
            respond(exchange, 200, catalogZip());
        });
    }
}
