package de.bsommerfeld.patchfetcher.catalog.xml;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * StAX helpers for the catalog parsers.
 */
public final class XmlElementReader {

    private static final XMLInputFactory FACTORY = createFactory();

    private XmlElementReader() {
    }

    /**
     * Opens a reader over {@code in}. Closing the returned reader does not
     * close the stream, so entries of a zip stream can be read one after
     * another.
     */
    public static XMLStreamReader open(InputStream in) throws XMLStreamException {
        return FACTORY.createXMLStreamReader(in);
    }

    /**
     * Reads the element the reader is positioned on (a {@code START_ELEMENT})
     * with all its descendants, leaving the reader on the matching
     * {@code END_ELEMENT}. Subtrees named in {@code skipped} are consumed
     * without being built.
     */
    public static XmlElement read(XMLStreamReader reader, Set<String> skipped) throws XMLStreamException {
        if (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
            throw new XMLStreamException("Expected start element", reader.getLocation());
        }
        String name = reader.getLocalName();
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }

        StringBuilder text = new StringBuilder();
        List<XmlElement> children = new ArrayList<>();
        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    if (skipped.contains(reader.getLocalName())) {
                        skip(reader);
                    } else {
                        children.add(read(reader, skipped));
                    }
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> text.append(reader.getText());
                case XMLStreamConstants.END_ELEMENT -> {
                    return new XmlElement(name, attributes, text.toString().trim(), children);
                }
                default -> {
                    // comments, processing instructions
                }
            }
        }
        throw new XMLStreamException("Unexpected end of document inside <" + name + ">");
    }

    /** Consumes the current element and its subtree. */
    public static void skip(XMLStreamReader reader) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
        if (depth > 0) {
            throw new XMLStreamException("Unexpected end of document while skipping element");
        }
    }

    private static XMLInputFactory createFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }
}
