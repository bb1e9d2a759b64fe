package de.bsommerfeld.patchfetcher.downloader.layout;

import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the on-disk layout below the download root.
 *
 * <pre>
 * &lt;root&gt;/opatch/                                  OPatch archives
 * &lt;root&gt;/ahf/                                     Autonomous Health Framework
 * &lt;root&gt;/quarter_patches/&lt;release&gt;/&lt;platform&gt;/   recommended patches
 * &lt;root&gt;/&lt;group&gt;/                                patch-list entries (root if no group)
 * </pre>
 *
 * Every directory that receives a file gets a {@value #MANIFEST_FILE}
 * with one {@code "<file> - <description>"} line per artifact, terminated by
 * {@code \n} on every platform. The file is
 * only ever appended to; appends to the same manifest are serialized, so
 * workers can record in parallel.
 */
public class LayoutWriter {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutWriter.class);

    public static final String MANIFEST_FILE = "description.txt";

    static final String OPATCH_DIR = "opatch";
    static final String AHF_DIR = "ahf";
    static final String QUARTER_DIR = "quarter_patches";

    private final Path root;
    private final ConcurrentMap<Path, Object> manifestLocks = new ConcurrentHashMap<>();

    public LayoutWriter(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /** Directory a record's file and manifest line belong to. No I/O. */
    public Path directoryFor(PatchRecord record) {
        return switch (record.category()) {
            case OPATCH -> root.resolve(OPATCH_DIR);
            case AHF -> root.resolve(AHF_DIR);
            case QUARTER -> root.resolve(QUARTER_DIR)
                    .resolve(sanitize(record.release()))
                    .resolve(sanitize(record.platform().name()));
            case LISTED -> record.group() == null || record.group().isBlank()
                    ? root
                    : root.resolve(sanitize(record.group().trim()));
        };
    }

    public Path targetPathFor(PatchRecord record) {
        return directoryFor(record).resolve(sanitize(record.fileName()));
    }

    public Path manifestFor(PatchRecord record) {
        return directoryFor(record).resolve(MANIFEST_FILE);
    }

    /**
     * Appends the record's manifest line, creating the directory first.
     *
     * @param onlyIfMissing skip the append when the manifest already holds
     *                      the exact line (re-runs over files already on disk)
     * @return whether a line was written
     */
    public boolean record(PatchRecord record, boolean onlyIfMissing) throws IOException {
        Path manifest = manifestFor(record);
        String line = ManifestEntry.of(record).line();

        synchronized (manifestLocks.computeIfAbsent(manifest, k -> new Object())) {
            Files.createDirectories(manifest.getParent());
            if (onlyIfMissing && containsLine(manifest, line)) {
                LOG.debug("Manifest {} already lists {}", manifest, record.fileName());
                return false;
            }
            try (Writer writer = Files.newBufferedWriter(manifest, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.write('\n');
            }
        }
        return true;
    }

    private static boolean containsLine(Path manifest, String line) throws IOException {
        if (!Files.exists(manifest)) {
            return false;
        }
        List<String> lines = Files.readAllLines(manifest, StandardCharsets.UTF_8);
        return lines.contains(line);
    }

    /**
     * Makes a catalog value usable as a single path segment: path separators
     * and characters reserved on common file systems become {@code _}.
     */
    static String sanitize(String segment) {
        String cleaned = segment.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        if (cleaned.isBlank() || cleaned.equals(".") || cleaned.equals("..")) {
            return "_";
        }
        return cleaned;
    }
}
