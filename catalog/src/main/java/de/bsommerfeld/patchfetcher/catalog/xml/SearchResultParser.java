package de.bsommerfeld.patchfetcher.catalog.xml;

import de.bsommerfeld.patchfetcher.catalog.CatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses {@code /Orion/Services/search} answers:
 * {@code <results><patch>...</patch></results>} or
 * {@code <results><error><id>...</id><message>...</message></error></results>}.
 */
public final class SearchResultParser {

    private static final Logger LOG = LoggerFactory.getLogger(SearchResultParser.class);

    /** Error id the service uses for "no patches found". */
    public static final String NO_PATCHES_FOUND = "10-016";

    private SearchResultParser() {
    }

    /**
     * @throws CatalogException if the service answered with any error other
     *                          than {@link #NO_PATCHES_FOUND}
     */
    public static List<CatalogPatch> parse(InputStream in, String query) throws XMLStreamException {
        List<CatalogPatch> patches = new ArrayList<>();
        XMLStreamReader reader = XmlElementReader.open(in);
        try {
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (reader.getLocalName()) {
                    case "patch" -> patches.add(CatalogXmlParser.toPatch(XmlElementReader.read(reader, Set.of("fixed_bugs"))));
                    case "error" -> {
                        XmlElement error = XmlElementReader.read(reader, Set.of());
                        String id = error.findText("id");
                        if (NO_PATCHES_FOUND.equals(id)) {
                            LOG.warn("No patches found for {}", query);
                            return List.of();
                        }
                        throw new CatalogException("Search for " + query + " failed: "
                                + error.findText("message") + " (" + id + ")");
                    }
                    default -> {
                        // results wrapper, generated_date and similar
                    }
                }
            }
        } finally {
            reader.close();
        }
        return patches;
    }
}
