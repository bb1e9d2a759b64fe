package de.bsommerfeld.patchfetcher.catalog.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small in-memory element tree for one catalog entry. Catalog files are
 * streamed; only the entry currently being mapped is materialized.
 */
public final class XmlElement {

    private final String name;
    private final Map<String, String> attributes;
    private final String text;
    private final List<XmlElement> children;

    XmlElement(String name, Map<String, String> attributes, String text, List<XmlElement> children) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = text;
        this.children = List.copyOf(children);
    }

    public String name() {
        return name;
    }

    /** Attribute value, or {@code null} if absent. */
    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }

    /** Concatenated character content, trimmed. Never {@code null}. */
    public String text() {
        return text;
    }

    public List<XmlElement> children() {
        return children;
    }

    public List<XmlElement> children(String childName) {
        List<XmlElement> result = new ArrayList<>();
        for (XmlElement child : children) {
            if (child.name.equals(childName)) {
                result.add(child);
            }
        }
        return result;
    }

    /** First child with the given name, or {@code null}. */
    public XmlElement child(String childName) {
        for (XmlElement child : children) {
            if (child.name.equals(childName)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Follows a path of child names, e.g. {@code find("bug", "abstract")}.
     * Returns {@code null} if any step is missing.
     */
    public XmlElement find(String... path) {
        XmlElement current = this;
        for (String step : path) {
            current = current.child(step);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /** Text of the element at {@code path}, or {@code null} if missing or blank. */
    public String findText(String... path) {
        XmlElement element = find(path);
        if (element == null || element.text.isEmpty()) {
            return null;
        }
        return element.text;
    }

    @Override
    public String toString() {
        return "<" + name + " " + attributes + ">";
    }
}
