package de.bsommerfeld.patchfetcher.downloader.plan;

import de.bsommerfeld.patchfetcher.core.domain.PatchKey;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.downloader.layout.LayoutWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses selected records into unique download tasks.
 *
 * <ol>
 * <li>Records with the same {@link PatchKey} collapse. When they disagree,
 * the record with the smallest download reference (then size, then digest)
 * is kept.</li>
 * <li>Records with the same download reference become one task. Placements
 * are ordered by category, release, platform and group; the file is stored
 * where the first one puts it, the others are manifests that list it too.</li>
 * <li>When different downloads would land on the same target path, the one
 * with the smallest download reference is kept and the others are dropped
 * with a warning.</li>
 * </ol>
 *
 * The resulting task set and total do not depend on input order; only the
 * task order follows the first appearance of each download. Planning does no
 * I/O, so it is safe for dry runs.
 */
public class DownloadPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadPlanner.class);

    private static final Comparator<PatchRecord> PREFERRED = Comparator
            .comparing(PatchRecord::downloadRef)
            .thenComparingLong(PatchRecord::sizeBytes)
            .thenComparing(PatchRecord::sha256, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PatchRecord::description);

    private static final Comparator<PatchRecord> PLACEMENT_ORDER = Comparator
            .comparing(PatchRecord::category)
            .thenComparing(PatchRecord::release)
            .thenComparing(r -> r.platform().code())
            .thenComparing(r -> r.group() == null ? "" : r.group())
            .thenComparing(PatchRecord::patchNumber)
            .thenComparing(PatchRecord::fileName)
            .thenComparing(PREFERRED);

    private final LayoutWriter layout;

    public DownloadPlanner(LayoutWriter layout) {
        this.layout = layout;
    }

    public DownloadPlan plan(Collection<PatchRecord> records) {
        Map<PatchKey, PatchRecord> unique = new LinkedHashMap<>();
        for (PatchRecord record : records) {
            unique.merge(record.key(), record, DownloadPlanner::preferred);
        }

        Map<String, List<PatchRecord>> bySource = new LinkedHashMap<>();
        for (PatchRecord record : unique.values()) {
            bySource.computeIfAbsent(record.downloadRef(), k -> new ArrayList<>()).add(record);
        }
        bySource.replaceAll((source, placements) -> distinctDirectories(placements));

        Map<Path, String> targetOwners = new HashMap<>();
        for (List<PatchRecord> placements : bySource.values()) {
            String source = placements.get(0).downloadRef();
            targetOwners.merge(layout.targetPathFor(placements.get(0)), source,
                    (a, b) -> a.compareTo(b) <= 0 ? a : b);
        }

        List<DownloadTask> tasks = new ArrayList<>();
        long totalBytes = 0;
        for (List<PatchRecord> placements : bySource.values()) {
            PatchRecord primary = placements.get(0);
            Path target = layout.targetPathFor(primary);
            String owner = targetOwners.get(target);
            if (!owner.equals(primary.downloadRef())) {
                LOG.warn("Skipping {} (patch {}, {}): {} is already planned from {}",
                        primary.fileName(), primary.patchNumber(), primary.platform().name(), target, owner);
                continue;
            }
            tasks.add(new DownloadTask(target, primary.downloadRef(), primary.sizeBytes(), primary.sha256(),
                    placements));
            totalBytes += primary.sizeBytes();
        }

        LOG.debug("Planned {} task(s) from {} record(s), {} bytes", tasks.size(), records.size(), totalBytes);
        return new DownloadPlan(tasks, totalBytes);
    }

    private static PatchRecord preferred(PatchRecord a, PatchRecord b) {
        if (!a.downloadRef().equals(b.downloadRef()) || a.sizeBytes() != b.sizeBytes()
                || !Objects.equals(a.sha256(), b.sha256())) {
            LOG.warn("Conflicting catalog entries for {}: {} ({} bytes) and {} ({} bytes)",
                    a.key(), a.downloadRef(), a.sizeBytes(), b.downloadRef(), b.sizeBytes());
        } else {
            LOG.debug("Duplicate record {} collapsed", a.key());
        }
        return PREFERRED.compare(a, b) <= 0 ? a : b;
    }

    private List<PatchRecord> distinctDirectories(List<PatchRecord> placements) {
        List<PatchRecord> sorted = new ArrayList<>(placements);
        sorted.sort(PLACEMENT_ORDER);
        List<PatchRecord> distinct = new ArrayList<>();
        List<Path> directories = new ArrayList<>();
        for (PatchRecord record : sorted) {
            Path directory = layout.directoryFor(record);
            if (!directories.contains(directory)) {
                directories.add(directory);
                distinct.add(record);
            }
        }
        return distinct;
    }
}
