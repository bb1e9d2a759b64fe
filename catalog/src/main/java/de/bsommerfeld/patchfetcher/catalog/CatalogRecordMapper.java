package de.bsommerfeld.patchfetcher.catalog;

import de.bsommerfeld.patchfetcher.catalog.xml.CatalogFile;
import de.bsommerfeld.patchfetcher.catalog.xml.CatalogPatch;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns catalog patch entries into one {@link PatchRecord} per file.
 */
final class CatalogRecordMapper {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogRecordMapper.class);

    private CatalogRecordMapper() {
    }

    /**
     * Maps every well-formed file of {@code patch}. Malformed files are logged
     * at warn level and skipped.
     */
    static List<PatchRecord> records(CatalogPatch patch, Platform platform, String release, PatchCategory category) {
        List<PatchRecord> records = new ArrayList<>();
        for (CatalogFile file : patch.files()) {
            try {
                records.add(toRecord(patch, file, platform, release, category));
            } catch (MalformedRecordException e) {
                LOG.warn("Skipping catalog entry: {}", e.getMessage());
            }
        }
        return records;
    }

    static PatchRecord toRecord(CatalogPatch patch, CatalogFile file, Platform platform, String release,
            PatchCategory category) throws MalformedRecordException {
        String where = "patch " + patch.number() + " file " + file.name();
        if (patch.number() == null) {
            throw new MalformedRecordException("Patch entry " + patch.uid() + " has no number");
        }
        if (file.name() == null) {
            throw new MalformedRecordException("Patch " + patch.number() + " lists a file without name");
        }
        if (file.downloadUrl() == null) {
            throw new MalformedRecordException(where + " has no download URL");
        }
        if (release == null) {
            throw new MalformedRecordException(where + " has no release");
        }
        return new PatchRecord(patch.number(), release, platform, patch.description(), file.name(),
                parseSize(file.size(), where), file.downloadUrl(), file.sha256(), category, null);
    }

    static long parseSize(String size, String where) throws MalformedRecordException {
        if (size == null || size.isBlank()) {
            throw new MalformedRecordException(where + " has no size");
        }
        try {
            long bytes = Long.parseLong(size.trim());
            if (bytes < 0) {
                throw new MalformedRecordException(where + " has negative size " + size);
            }
            return bytes;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(where + " has non-numeric size '" + size + "'");
        }
    }
}
