package de.bsommerfeld.patchfetcher.downloader.download;

import java.util.List;

/**
 * Aggregate of a run's outcomes, in plan order.
 *
 * @param manifestErrors manifest writes that failed for otherwise finished
 *                       downloads
 */
public record DownloadSummary(List<DownloadOutcome> outcomes, List<String> manifestErrors) {

    public DownloadSummary {
        outcomes = List.copyOf(outcomes);
        manifestErrors = List.copyOf(manifestErrors);
    }

    public long count(DownloadOutcome.Kind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).count();
    }

    public List<String> failedFiles() {
        return outcomes.stream()
                .filter(o -> o.kind() == DownloadOutcome.Kind.FAILED)
                .map(o -> o.task().fileName())
                .toList();
    }

    /** Expected bytes of the files fetched in this run. */
    public long bytesTransferred() {
        return outcomes.stream()
                .filter(o -> o.kind() == DownloadOutcome.Kind.DOWNLOADED)
                .mapToLong(o -> o.task().expectedSizeBytes())
                .sum();
    }

    public boolean hasFailures() {
        return count(DownloadOutcome.Kind.FAILED) > 0 || !manifestErrors.isEmpty();
    }
}
