package de.bsommerfeld.patchfetcher.downloader.layout;

import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;

/**
 * One line of a {@code description.txt} manifest.
 */
public record ManifestEntry(String fileName, String description) {

    /** Entry naming the file as it is stored on disk. */
    public static ManifestEntry of(PatchRecord record) {
        return new ManifestEntry(LayoutWriter.sanitize(record.fileName()), record.description());
    }

    /** {@code "<file_name> - <description>"} on a single line. */
    public String line() {
        return fileName + " - " + description.strip().replaceAll("\\s*\\R\\s*", " ");
    }
}
