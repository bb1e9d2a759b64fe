package de.bsommerfeld.patchfetcher.core.domain;

import java.util.Objects;

/**
 * One downloadable patch file as reported by the catalog, normalized into a
 * vendor-neutral shape.
 *
 * @param patchNumber patch identifier (e.g. {@code "6880880"})
 * @param release     release line the record belongs to (e.g. {@code "19.0.0.0.0"})
 * @param platform    target platform
 * @param description abstract of the patch, used for filtering and manifests
 * @param fileName    archive name (e.g. {@code "p6880880_190000_Linux-x86-64.zip"})
 * @param sizeBytes   size reported by the catalog
 * @param downloadRef URL the download manager fetches
 * @param sha256      catalog-reported SHA-256 digest, or {@code null} if none
 * @param category    destination category
 * @param group       destination subdirectory for {@link PatchCategory#LISTED}
 *                    records, {@code null} otherwise
 */
public record PatchRecord(
        String patchNumber,
        String release,
        Platform platform,
        String description,
        String fileName,
        long sizeBytes,
        String downloadRef,
        String sha256,
        PatchCategory category,
        String group) {

    public PatchRecord {
        Objects.requireNonNull(patchNumber, "patchNumber");
        Objects.requireNonNull(release, "release");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(downloadRef, "downloadRef");
        Objects.requireNonNull(category, "category");
        description = description == null ? "" : description;
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("Negative size for " + fileName + ": " + sizeBytes);
        }
    }

    public PatchKey key() {
        return new PatchKey(patchNumber, platform.code(), release, fileName, category, group == null ? "" : group);
    }

    /** Returns a copy that lands in a different destination. */
    public PatchRecord withPlacement(PatchCategory newCategory, String newGroup) {
        return new PatchRecord(patchNumber, release, platform, description, fileName,
                sizeBytes, downloadRef, sha256, newCategory, newGroup);
    }
}
