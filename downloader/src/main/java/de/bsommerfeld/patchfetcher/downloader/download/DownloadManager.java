package de.bsommerfeld.patchfetcher.downloader.download;

import de.bsommerfeld.patchfetcher.catalog.CatalogException;
import de.bsommerfeld.patchfetcher.catalog.Session;
import de.bsommerfeld.patchfetcher.catalog.SessionProvider;
import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.core.event.DownloadEvents;
import de.bsommerfeld.patchfetcher.core.util.HashUtil;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Executes a single {@link DownloadTask}.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>A target file of exactly the expected size counts as done; nothing is
 * transferred.</li>
 * <li>Bytes stream into {@code <target>.part}. A part file left by an
 * earlier run is resumed.</li>
 * <li>The part file must have the expected size and, if the catalog
 * reported one, the expected SHA-256 digest. A mismatch discards it.</li>
 * <li>The part file is atomically renamed to the target.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * Retryable failures are retried with exponential backoff up to the policy's
 * attempt limit. A rejected session is renewed once per task without using
 * up an attempt. Every failure ends in a {@code FAILED} outcome rather than
 * an exception, and the part file stays for the next run.
 *
 * <p>
 * Thread-safe: one instance serves all workers.
 */
public class DownloadManager {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadManager.class);

    static final String PART_SUFFIX = ".part";

    private final TransferClient transferClient;
    private final SessionProvider sessions;
    private final RetryPolicy retryPolicy;
    private final ApplicationEventBus eventBus;
    private final Sleeper sleeper;

    public DownloadManager(TransferClient transferClient, SessionProvider sessions, RetryPolicy retryPolicy,
            ApplicationEventBus eventBus, Sleeper sleeper) {
        this.transferClient = transferClient;
        this.sessions = sessions;
        this.retryPolicy = retryPolicy;
        this.eventBus = eventBus;
        this.sleeper = sleeper;
    }

    public static Path partFileFor(Path target) {
        return target.resolveSibling(target.getFileName() + PART_SUFFIX);
    }

    /** Whether the target already holds a file of the expected size. */
    public static boolean isPresent(DownloadTask task) {
        Path target = task.targetPath();
        try {
            return Files.isRegularFile(target) && Files.size(target) == task.expectedSizeBytes();
        } catch (IOException e) {
            LOG.debug("Cannot stat {}: {}", target, e.getMessage());
            return false;
        }
    }

    /** Bytes still to be written to disk for this task. */
    public static long remainingBytes(DownloadTask task) {
        if (isPresent(task)) {
            return 0;
        }
        Path part = partFileFor(task.targetPath());
        try {
            long existing = Files.isRegularFile(part) ? Files.size(part) : 0;
            return Math.max(task.expectedSizeBytes() - existing, 0);
        } catch (IOException e) {
            return task.expectedSizeBytes();
        }
    }

    public DownloadOutcome execute(DownloadTask task) {
        if (isPresent(task)) {
            task.skip();
            LOG.info("{} already present, skipping", task.fileName());
            DownloadOutcome present = DownloadOutcome.alreadyPresent(task);
            finished(task, present);
            return present;
        }

        task.begin();
        eventBus.post(new DownloadEvents.TaskStartedEvent(task.fileName(), task.expectedSizeBytes()));

        DownloadOutcome outcome = transferWithRetries(task);
        if (outcome.isDone()) {
            task.complete();
            LOG.info("Downloaded {} to {}", task.fileName(), task.targetPath().getParent());
        } else {
            task.fail();
            LOG.error("Download of {} failed: {}", task.fileName(), outcome.error());
        }
        finished(task, outcome);
        return outcome;
    }

    private DownloadOutcome transferWithRetries(DownloadTask task) {
        Path target = task.targetPath();
        Path part = partFileFor(target);
        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            return fail(task, DownloadError.Kind.FILESYSTEM, "Cannot create " + target.getParent() + ": " + e.getMessage());
        }

        Session session;
        try {
            session = sessions.current();
        } catch (CatalogException e) {
            return fail(task, DownloadError.Kind.SESSION, e.getMessage());
        }

        boolean reauthenticated = false;
        int attempt = 1;
        while (true) {
            try {
                fetchInto(task, session, part);
                verify(task, part);
            } catch (TransferException e) {
                switch (e.kind()) {
                    case SESSION_EXPIRED -> {
                        if (reauthenticated) {
                            return fail(task, DownloadError.Kind.SESSION, e.getMessage());
                        }
                        reauthenticated = true;
                        LOG.info("Session rejected while fetching {}, logging in again", task.fileName());
                        try {
                            session = sessions.refresh(session);
                        } catch (CatalogException ce) {
                            return fail(task, DownloadError.Kind.SESSION, ce.getMessage());
                        }
                        continue;
                    }
                    case FATAL -> {
                        return fail(task, DownloadError.Kind.TRANSFER, e.getMessage());
                    }
                    case INTERRUPTED -> {
                        return fail(task, DownloadError.Kind.INTERRUPTED, e.getMessage());
                    }
                    default -> {
                        // retryable
                    }
                }

                DownloadError.Kind errorKind = e.kind() == TransferException.Kind.INTEGRITY
                        ? DownloadError.Kind.INTEGRITY
                        : DownloadError.Kind.TRANSFER;
                if (!retryPolicy.canRetry(attempt)) {
                    return fail(task, errorKind, e.getMessage() + " (after " + attempt + " attempt(s))");
                }
                Duration wait = retryPolicy.backoffAfter(attempt);
                LOG.warn("{} (attempt {}/{}), retrying in {} ms", e.getMessage(), attempt,
                        retryPolicy.maxAttempts(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return fail(task, DownloadError.Kind.INTERRUPTED, "Interrupted while waiting to retry");
                }
                attempt++;
                continue;
            }

            try {
                moveIntoPlace(part, target);
            } catch (IOException e) {
                return fail(task, DownloadError.Kind.FILESYSTEM, "Cannot move " + part + " to " + target + ": "
                        + e.getMessage());
            }
            return DownloadOutcome.downloaded(task);
        }
    }

    private void fetchInto(DownloadTask task, Session session, Path part) throws TransferException {
        long expected = task.expectedSizeBytes();
        long offset = 0;
        try {
            if (Files.isRegularFile(part)) {
                offset = Files.size(part);
                if (offset > expected) {
                    LOG.debug("Part file of {} is larger than expected, starting over", task.fileName());
                    Files.delete(part);
                    offset = 0;
                }
            }
        } catch (IOException e) {
            throw new TransferException(TransferException.Kind.RETRYABLE,
                    "Cannot inspect " + part + ": " + e.getMessage(), e);
        }

        if (offset == expected && offset > 0) {
            LOG.debug("Part file of {} is complete, verifying", task.fileName());
            return;
        }
        if (offset > 0) {
            LOG.info("Resuming {} at {} of {} bytes", task.fileName(), offset, expected);
        }
        transferClient.transfer(task.source(), session, part, offset, new ProgressPublisher(task));
    }

    private void verify(DownloadTask task, Path part) throws TransferException {
        try {
            long actual = Files.size(part);
            if (actual != task.expectedSizeBytes()) {
                Files.deleteIfExists(part);
                throw new TransferException(TransferException.Kind.INTEGRITY, "Size mismatch for "
                        + task.fileName() + ": expected " + task.expectedSizeBytes() + " bytes, got " + actual);
            }
            if (task.sha256() != null && !HashUtil.matches(part, task.sha256())) {
                Files.deleteIfExists(part);
                throw new TransferException(TransferException.Kind.INTEGRITY,
                        "SHA-256 mismatch for " + task.fileName());
            }
        } catch (IOException e) {
            throw new TransferException(TransferException.Kind.RETRYABLE,
                    "Cannot verify " + part + ": " + e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private DownloadOutcome fail(DownloadTask task, DownloadError.Kind kind, String message) {
        return DownloadOutcome.failed(task, new DownloadError(kind, message));
    }

    private void finished(DownloadTask task, DownloadOutcome outcome) {
        String detail = outcome.error() == null ? null : outcome.error().toString();
        eventBus.post(new DownloadEvents.TaskFinishedEvent(task.fileName(), outcome.path(), outcome.kind().name(),
                detail));
    }

    /** Publishes progress whenever the whole-percent value changes. */
    private final class ProgressPublisher implements DownloadProgressListener {

        private final DownloadTask task;
        private int lastPercent = -1;

        ProgressPublisher(DownloadTask task) {
            this.task = task;
        }

        @Override
        public void onProgress(long bytesRead, long totalBytes) {
            long total = totalBytes > 0 ? totalBytes : task.expectedSizeBytes();
            int percent = total > 0 ? (int) Math.min(100, bytesRead * 100 / total) : 0;
            if (percent != lastPercent) {
                lastPercent = percent;
                eventBus.post(new DownloadEvents.ProgressEvent(task.fileName(), bytesRead, total));
            }
        }
    }
}
