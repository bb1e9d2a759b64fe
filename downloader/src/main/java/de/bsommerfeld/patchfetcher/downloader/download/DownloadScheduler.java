package de.bsommerfeld.patchfetcher.downloader.download;

import com.google.common.util.concurrent.Uninterruptibles;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.util.ByteFormatter;
import de.bsommerfeld.patchfetcher.downloader.layout.LayoutWriter;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadPlan;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link DownloadPlan} on a fixed pool of workers.
 *
 * <h3>Per task</h3>
 * <pre>
 * stop raised?          → NOT_ATTEMPTED (task stays PENDING)
 * disk space reserved?  → no: raise stop, NOT_ATTEMPTED
 * DownloadManager.execute
 * done?                 → manifest line in every placement's directory
 * </pre>
 *
 * A failed task never stops the batch. Manifest write errors are collected
 * in the summary.
 */
public class DownloadScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadScheduler.class);

    private final DownloadManager manager;
    private final LayoutWriter layout;
    private final DiskSpaceGuard diskSpace;
    private final StopSignal stopSignal;
    private final int maxConcurrency;

    public DownloadScheduler(DownloadManager manager, LayoutWriter layout, DiskSpaceGuard diskSpace,
            StopSignal stopSignal, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        this.manager = manager;
        this.layout = layout;
        this.diskSpace = diskSpace;
        this.stopSignal = stopSignal;
        this.maxConcurrency = maxConcurrency;
    }

    public DownloadSummary run(DownloadPlan plan) {
        if (plan.isEmpty()) {
            return new DownloadSummary(List.of(), List.of());
        }

        int workers = Math.min(maxConcurrency, plan.size());
        LOG.info("Downloading {} file(s), {} in total, with {} worker(s)", plan.size(),
                ByteFormatter.format(plan.totalBytes()), workers);

        List<String> manifestErrors = new CopyOnWriteArrayList<>();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "download-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<Future<DownloadOutcome>> futures = new ArrayList<>();
        try {
            for (DownloadTask task : plan.tasks()) {
                futures.add(executor.submit(() -> runTask(task, manifestErrors)));
            }
        } finally {
            executor.shutdown();
        }

        List<DownloadOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), plan.tasks().get(i)));
        }
        return new DownloadSummary(outcomes, manifestErrors);
    }

    private DownloadOutcome runTask(DownloadTask task, List<String> manifestErrors) {
        if (stopSignal.isRaised()) {
            return DownloadOutcome.notAttempted(task);
        }

        long needed = DownloadManager.remainingBytes(task);
        if (!diskSpace.tryReserve(task.targetPath(), needed)) {
            stopSignal.raise("not enough disk space for " + task.fileName() + " ("
                    + ByteFormatter.format(needed) + " needed)");
            return DownloadOutcome.notAttempted(task);
        }

        DownloadOutcome outcome;
        try {
            outcome = manager.execute(task);
        } finally {
            diskSpace.release(needed);
        }

        if (outcome.isDone()) {
            boolean onlyIfMissing = outcome.kind() == DownloadOutcome.Kind.ALREADY_PRESENT;
            for (PatchRecord placement : task.placements()) {
                try {
                    layout.record(placement, onlyIfMissing);
                } catch (IOException e) {
                    String message = "Cannot update " + layout.manifestFor(placement) + ": " + e.getMessage();
                    LOG.error(message);
                    manifestErrors.add(message);
                }
            }
        }
        return outcome;
    }

    private static DownloadOutcome await(Future<DownloadOutcome> future, DownloadTask task) {
        try {
            return Uninterruptibles.getUninterruptibly(future);
        } catch (ExecutionException e) {
            LOG.error("Unexpected error while downloading {}", task.fileName(), e.getCause());
            return DownloadOutcome.failed(task, new DownloadError(DownloadError.Kind.TRANSFER,
                    String.valueOf(e.getCause())));
        }
    }
}
