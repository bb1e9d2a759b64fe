package de.bsommerfeld.patchfetcher.downloader.filter;

import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;

import java.util.List;

/**
 * Selected records plus per-stage drop counts.
 */
public record FilterResult(List<PatchRecord> selected, int droppedByPlatform, int droppedByRelease,
        int droppedByDescription) {

    public FilterResult {
        selected = List.copyOf(selected);
    }

    public int dropped() {
        return droppedByPlatform + droppedByRelease + droppedByDescription;
    }
}
