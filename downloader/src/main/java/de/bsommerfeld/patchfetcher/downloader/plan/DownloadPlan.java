package de.bsommerfeld.patchfetcher.downloader.plan;

import java.util.List;

/**
 * Unique download tasks and the sum of their expected sizes.
 */
public record DownloadPlan(List<DownloadTask> tasks, long totalBytes) {

    public DownloadPlan {
        tasks = List.copyOf(tasks);
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public int size() {
        return tasks.size();
    }
}
