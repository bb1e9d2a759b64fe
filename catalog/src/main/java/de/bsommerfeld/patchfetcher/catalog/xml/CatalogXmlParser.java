package de.bsommerfeld.patchfetcher.catalog.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the three XML files of the catalog archive.
 *
 * <h3>Files</h3>
 * <ul>
 * <li>{@code aru_platforms.xml}: {@code <platform id="226">Linux x86-64</platform>}</li>
 * <li>{@code components.xml}: product components grouped by
 * {@code <ctype name="...">}; only {@code RELEASE} components matter</li>
 * <li>{@code patch_recommendations.xml}: a {@code <patches>} section with
 * every patch entry and two recommendation sections
 * ({@code standalone_recommendations}, {@code components_recommendations})
 * of the form {@code <release cid><platform id><patch uid/></platform></release>}</li>
 * </ul>
 *
 * The recommendations file runs to hundreds of megabytes, mostly fixed-bug
 * lists, so it is streamed and {@code fixed_bugs} subtrees are skipped
 * without being built.
 */
public final class CatalogXmlParser {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogXmlParser.class);

    private static final Set<String> SKIPPED = Set.of("fixed_bugs");
    private static final Set<String> RECOMMENDATION_SECTIONS =
            Set.of("standalone_recommendations", "components_recommendations");

    private CatalogXmlParser() {
    }

    /** Platform names by code, in document order. */
    public static Map<String, String> parsePlatforms(InputStream in) throws XMLStreamException {
        Map<String, String> platforms = new LinkedHashMap<>();
        XMLStreamReader reader = XmlElementReader.open(in);
        try {
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && "platform".equals(reader.getLocalName())) {
                    XmlElement platform = XmlElementReader.read(reader, Set.of());
                    String id = platform.attribute("id");
                    if (id != null && !platform.text().isEmpty()) {
                        platforms.put(id, platform.text());
                    }
                }
            }
        } finally {
            reader.close();
        }
        LOG.debug("Parsed {} platforms", platforms.size());
        return platforms;
    }

    /** All {@code RELEASE} components by cid. */
    public static Map<String, ReleaseComponent> parseReleaseComponents(InputStream in) throws XMLStreamException {
        Map<String, ReleaseComponent> components = new LinkedHashMap<>();
        XMLStreamReader reader = XmlElementReader.open(in);
        try {
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT || !"ctype".equals(reader.getLocalName())) {
                    continue;
                }
                if (!"RELEASE".equals(reader.getAttributeValue(null, "name"))) {
                    XmlElementReader.skip(reader);
                    continue;
                }
                XmlElement ctype = XmlElementReader.read(reader, Set.of("lifecycle"));
                for (XmlElement component : ctype.children("component")) {
                    String cid = component.attribute("cid");
                    String name = component.findText("name");
                    String version = component.findText("version");
                    if (cid == null || name == null || version == null) {
                        LOG.debug("Skipping incomplete release component {}", component);
                        continue;
                    }
                    components.put(cid, new ReleaseComponent(cid, name, version));
                }
            }
        } finally {
            reader.close();
        }
        LOG.debug("Parsed {} release components", components.size());
        return components;
    }

    public static RecommendationData parseRecommendations(InputStream in) throws XMLStreamException {
        Map<String, CatalogPatch> patches = new LinkedHashMap<>();
        Map<List<String>, Set<String>> recommended = new LinkedHashMap<>();

        XMLStreamReader reader = XmlElementReader.open(in);
        try {
            String section = null;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT && reader.getLocalName().equals(section)) {
                    section = null;
                    continue;
                }
                if (event != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }

                String name = reader.getLocalName();
                if (section == null) {
                    if ("patches".equals(name) || RECOMMENDATION_SECTIONS.contains(name)) {
                        section = name;
                    } else if (SKIPPED.contains(name)) {
                        XmlElementReader.skip(reader);
                    }
                } else if ("patches".equals(section) && "patch".equals(name)) {
                    CatalogPatch patch = toPatch(XmlElementReader.read(reader, SKIPPED));
                    if (patch.uid() != null) {
                        patches.put(patch.uid(), patch);
                    }
                } else if (RECOMMENDATION_SECTIONS.contains(section) && "release".equals(name)) {
                    collectRecommendations(XmlElementReader.read(reader, SKIPPED), recommended);
                } else {
                    XmlElementReader.skip(reader);
                }
            }
        } finally {
            reader.close();
        }

        List<Recommendation> recommendations = new ArrayList<>();
        recommended.forEach((key, uids) -> recommendations.add(new Recommendation(key.get(0), key.get(1), uids)));
        LOG.debug("Parsed {} patches and {} recommendation groups", patches.size(), recommendations.size());
        return new RecommendationData(patches, recommendations);
    }

    /**
     * Maps a {@code <patch>} element. Shared by the recommendations file and
     * search results, which use the same layout.
     */
    static CatalogPatch toPatch(XmlElement patch) {
        XmlElement platform = patch.child("platform");
        XmlElement release = patch.child("release");

        List<CatalogFile> files = new ArrayList<>();
        XmlElement filesElement = patch.child("files");
        if (filesElement != null) {
            for (XmlElement file : filesElement.children("file")) {
                files.add(toFile(file));
            }
        }

        String platformName = platform == null || platform.text().isEmpty() ? null : platform.text();
        return new CatalogPatch(
                patch.attribute("uid"),
                patch.findText("name"),
                patch.findText("bug", "abstract"),
                platform == null ? null : platform.attribute("id"),
                platformName,
                release == null ? null : release.attribute("name"),
                files);
    }

    private static CatalogFile toFile(XmlElement file) {
        String url = null;
        XmlElement downloadUrl = file.child("download_url");
        if (downloadUrl != null && !downloadUrl.text().isEmpty()) {
            String host = downloadUrl.attribute("host");
            url = host == null ? downloadUrl.text() : host + downloadUrl.text();
        }

        String sha256 = null;
        for (XmlElement digest : file.children("digest")) {
            if ("SHA-256".equalsIgnoreCase(digest.attribute("type")) && !digest.text().isEmpty()) {
                sha256 = digest.text();
            }
        }
        return new CatalogFile(file.findText("name"), file.findText("size"), url, sha256);
    }

    private static void collectRecommendations(XmlElement release, Map<List<String>, Set<String>> recommended) {
        String cid = release.attribute("cid");
        if (cid == null) {
            return;
        }
        for (XmlElement platform : release.children("platform")) {
            String platformId = platform.attribute("id");
            if (platformId == null) {
                continue;
            }
            Set<String> uids = recommended.computeIfAbsent(List.of(cid, platformId), k -> new LinkedHashSet<>());
            for (XmlElement patch : platform.children("patch")) {
                String uid = patch.attribute("uid");
                if (uid != null) {
                    uids.add(uid);
                }
            }
        }
    }
}
