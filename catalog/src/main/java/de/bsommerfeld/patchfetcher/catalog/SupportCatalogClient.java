package de.bsommerfeld.patchfetcher.catalog;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import de.bsommerfeld.patchfetcher.catalog.xml.CatalogPatch;
import de.bsommerfeld.patchfetcher.catalog.xml.CatalogXmlParser;
import de.bsommerfeld.patchfetcher.catalog.xml.Recommendation;
import de.bsommerfeld.patchfetcher.catalog.xml.RecommendationData;
import de.bsommerfeld.patchfetcher.catalog.xml.ReleaseComponent;
import de.bsommerfeld.patchfetcher.catalog.xml.SearchResultParser;
import de.bsommerfeld.patchfetcher.core.config.CatalogConfig;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * {@link CatalogClient} backed by the support update service.
 *
 * <h3>Data sources</h3>
 * <ul>
 * <li>{@code /download/em_catalog.zip}: platform list, release components
 * and recommended patches. Streamed once per run and parsed straight out of
 * the HTTP body; nothing is written to disk.</li>
 * <li>{@code /Orion/Services/search?bug=N&platform=P}: files of one patch on
 * one platform.</li>
 * </ul>
 *
 * <h3>Session handling</h3>
 * Every request carries the current session cookies. A {@code 401} or
 * {@code 403} triggers one re-login through the {@link SessionProvider};
 * if the retried request is rejected as well, an {@link AuthException} is
 * raised. The re-login does not count as a retry attempt.
 */
public class SupportCatalogClient implements CatalogClient {

    private static final Logger LOG = LoggerFactory.getLogger(SupportCatalogClient.class);

    static final String CATALOG_PATH = "/download/em_catalog.zip";
    static final String SEARCH_PATH = "/Orion/Services/search";

    static final String PLATFORMS_ENTRY = "aru_platforms.xml";
    static final String COMPONENTS_ENTRY = "components.xml";
    static final String RECOMMENDATIONS_ENTRY = "patch_recommendations.xml";

    @FunctionalInterface
    private interface BodyParser<T> {
        T parse(InputStream body) throws IOException, XMLStreamException;
    }

    private final CatalogHttp http;
    private final SessionProvider sessions;
    private final Supplier<CatalogSnapshot> snapshot;

    public SupportCatalogClient(HttpClient client, CatalogConfig config, SessionProvider sessions,
            RetryPolicy retryPolicy, Sleeper sleeper) {
        this.http = new CatalogHttp(client, config, retryPolicy, sleeper);
        this.sessions = sessions;
        // Guava's memoizing supplier retries after a failed computation
        this.snapshot = Suppliers.memoize(this::fetchSnapshot);
    }

    @Override
    public List<Platform> listPlatforms() {
        return snapshot.get().platforms().values().stream()
                .sorted(Comparator.comparing(Platform::name).thenComparing(Platform::code))
                .toList();
    }

    @Override
    public Stream<PatchRecord> queryRecommendedPatches(ReleaseFilter releaseFilter) {
        Objects.requireNonNull(releaseFilter, "releaseFilter");
        return Stream.of(releaseFilter).flatMap(filter -> recommendedPatches(snapshot.get(), filter));
    }

    @Override
    public Stream<PatchRecord> queryPatchByNumber(String patchNumber, Collection<Platform> platforms) {
        Objects.requireNonNull(patchNumber, "patchNumber");
        List<Platform> targets = List.copyOf(platforms);
        return targets.stream().flatMap(platform -> searchPatch(patchNumber, platform).stream());
    }

    private Stream<PatchRecord> recommendedPatches(CatalogSnapshot catalog, ReleaseFilter filter) {
        return catalog.recommendations().stream()
                .filter(recommendation -> {
                    ReleaseComponent component = catalog.components().get(recommendation.cid());
                    return component != null && filter.accepts(component);
                })
                .flatMap(recommendation -> recordsFor(catalog, recommendation));
    }

    private Stream<PatchRecord> recordsFor(CatalogSnapshot catalog, Recommendation recommendation) {
        ReleaseComponent component = catalog.components().get(recommendation.cid());
        Platform platform = catalog.platform(recommendation.platformCode());
        return recommendation.patchUids().stream()
                .map(uid -> {
                    CatalogPatch patch = catalog.patches().get(uid);
                    if (patch == null) {
                        LOG.warn("Recommended patch {} for {} {} on {} is missing from the catalog",
                                uid, component.name(), component.version(), platform.name());
                    }
                    return patch;
                })
                .filter(Objects::nonNull)
                .flatMap(patch -> CatalogRecordMapper
                        .records(patch, platform, component.version(), PatchCategory.QUARTER).stream());
    }

    private List<PatchRecord> searchPatch(String patchNumber, Platform platform) {
        String query = "patch " + patchNumber + " on " + platform.name();
        URI uri = http.resolve(SEARCH_PATH
                + "?bug=" + URLEncoder.encode(patchNumber, StandardCharsets.UTF_8)
                + "&platform=" + URLEncoder.encode(platform.code(), StandardCharsets.UTF_8));
        LOG.debug("Searching {}", query);

        List<CatalogPatch> patches = fetch("Search for " + query, uri, body -> SearchResultParser.parse(body, query));
        return patches.stream()
                .flatMap(patch -> CatalogRecordMapper.records(patch, platformOf(patch, platform),
                        patch.releaseName(), PatchCategory.LISTED).stream())
                .toList();
    }

    private static Platform platformOf(CatalogPatch patch, Platform requested) {
        if (patch.platformCode() == null || patch.platformCode().equals(requested.code())) {
            return requested;
        }
        String name = patch.platformName() != null ? patch.platformName() : patch.platformCode();
        return new Platform(patch.platformCode(), name);
    }

    private CatalogSnapshot fetchSnapshot() {
        LOG.info("Fetching patch catalog");
        CatalogSnapshot catalog = fetch("Catalog download", http.resolve(CATALOG_PATH), this::readCatalogArchive);
        LOG.info("Catalog loaded: {} platforms, {} release components, {} patches",
                catalog.platforms().size(), catalog.components().size(), catalog.patches().size());
        return catalog;
    }

    private CatalogSnapshot readCatalogArchive(InputStream body) throws IOException, XMLStreamException {
        Map<String, String> platformNames = null;
        Map<String, ReleaseComponent> components = null;
        RecommendationData recommendations = null;

        try (ZipInputStream zip = new ZipInputStream(body)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                InputStream entryStream = new NonClosingInputStream(zip);
                switch (baseName(entry.getName())) {
                    case PLATFORMS_ENTRY -> platformNames = CatalogXmlParser.parsePlatforms(entryStream);
                    case COMPONENTS_ENTRY -> components = CatalogXmlParser.parseReleaseComponents(entryStream);
                    case RECOMMENDATIONS_ENTRY -> recommendations = CatalogXmlParser.parseRecommendations(entryStream);
                    default -> LOG.debug("Ignoring catalog entry {}", entry.getName());
                }
                zip.closeEntry();
            }
        }

        if (platformNames == null || components == null || recommendations == null) {
            throw new IOException("Catalog archive is incomplete: expected " + PLATFORMS_ENTRY + ", "
                    + COMPONENTS_ENTRY + " and " + RECOMMENDATIONS_ENTRY);
        }

        Map<String, Platform> platforms = new LinkedHashMap<>();
        platformNames.forEach((code, name) -> platforms.put(code, new Platform(code, name)));
        return new CatalogSnapshot(platforms, components, recommendations.patches(),
                recommendations.recommendations());
    }

    private <T> T fetch(String operation, URI uri, BodyParser<T> parser) {
        return http.withRetries(operation, () -> {
            Session session = sessions.current();
            HttpResponse<InputStream> response = send(uri, session);
            if (CatalogHttp.isAuthFailure(response.statusCode())) {
                response.body().close();
                LOG.info("Session rejected during {}, logging in again", operation);
                response = send(uri, sessions.refresh(session));
                if (CatalogHttp.isAuthFailure(response.statusCode())) {
                    response.body().close();
                    throw new AuthException(operation + " rejected after re-login (HTTP "
                            + response.statusCode() + ")");
                }
            }
            try (InputStream body = response.body()) {
                CatalogHttp.checkStatus(response.statusCode(), operation);
                return parser.parse(body);
            }
        });
    }

    private HttpResponse<InputStream> send(URI uri, Session session) throws IOException, InterruptedException {
        var request = http.request(uri);
        String cookies = session.cookieHeader();
        if (!cookies.isEmpty()) {
            request.header("Cookie", cookies);
        }
        return http.client().send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    private static String baseName(String entryName) {
        int slash = entryName.lastIndexOf('/');
        return slash >= 0 ? entryName.substring(slash + 1) : entryName;
    }

    /** Keeps StAX readers from closing the zip stream between entries. */
    private static final class NonClosingInputStream extends FilterInputStream {

        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // entry is closed by the zip loop
        }
    }
}
