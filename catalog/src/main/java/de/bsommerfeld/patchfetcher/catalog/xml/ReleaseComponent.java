package de.bsommerfeld.patchfetcher.catalog.xml;

/**
 * Product release from {@code components.xml}, e.g. {@code Oracle Database 19.0.0.0.0}.
 */
public record ReleaseComponent(String cid, String name, String version) {
}
