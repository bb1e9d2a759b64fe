package de.bsommerfeld.patchfetcher.downloader.download;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.patchfetcher.catalog.AuthException;
import de.bsommerfeld.patchfetcher.catalog.Session;
import de.bsommerfeld.patchfetcher.catalog.SessionProvider;
import de.bsommerfeld.patchfetcher.core.domain.PatchCategory;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.core.event.DownloadEvents;
import de.bsommerfeld.patchfetcher.core.util.HashUtil;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadTask;
import de.bsommerfeld.patchfetcher.downloader.plan.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests the per-task download flow against a scripted transfer client.
 * Backoff waits are recorded instead of slept.
 */
@ExtendWith(MockitoExtension.class)
class DownloadManagerTest {

    private static final byte[] CONTENT = "0123456789".getBytes(StandardCharsets.US_ASCII);
    private static final String URL = "https://updates.example.com/files/p1.zip";

    private static final Session FIRST = new Session(Map.of("ORA_SESSION", "first"), Instant.EPOCH, Instant.MAX);
    private static final Session SECOND = new Session(Map.of("ORA_SESSION", "second"), Instant.EPOCH, Instant.MAX);

    @TempDir
    Path root;

    @Mock
    private SessionProvider sessions;

    private ScriptedTransferClient transfer;
    private ApplicationEventBus eventBus;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        transfer = new ScriptedTransferClient().serve(URL, CONTENT);
        eventBus = new ApplicationEventBus();
        sleeps = new ArrayList<>();
        lenient().when(sessions.current()).thenReturn(FIRST);
    }

    // -- Happy path --

    @Test
    void execute_shouldDownloadIntoPartFileAndMoveIntoPlace() throws Exception {
        DownloadTask task = task(null);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        assertEquals(task.targetPath(), outcome.path());
        assertArrayEquals(CONTENT, Files.readAllBytes(task.targetPath()));
        assertFalse(Files.exists(DownloadManager.partFileFor(task.targetPath())));
        assertEquals(TaskStatus.DONE, task.status());
        assertEquals(FIRST, transfer.calls().get(0).session());
        assertEquals(0, transfer.calls().get(0).offset());
    }

    @Test
    void execute_shouldSkipFileAlreadyPresentWithExpectedSize() throws Exception {
        DownloadTask task = task(null);
        Files.createDirectories(task.targetPath().getParent());
        Files.write(task.targetPath(), CONTENT);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.ALREADY_PRESENT, outcome.kind());
        assertEquals(TaskStatus.DONE, task.status());
        assertTrue(transfer.calls().isEmpty());
        verifyNoInteractions(sessions);
    }

    @Test
    void execute_shouldReplaceFileOfWrongSize() throws Exception {
        DownloadTask task = task(null);
        Files.createDirectories(task.targetPath().getParent());
        Files.write(task.targetPath(), new byte[3]);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        assertArrayEquals(CONTENT, Files.readAllBytes(task.targetPath()));
    }

    @Test
    void execute_shouldAcceptMatchingDigest() throws Exception {
        Path reference = root.resolve("reference.bin");
        Files.write(reference, CONTENT);
        DownloadTask task = task(HashUtil.sha256(reference).toUpperCase());

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, manager(1).execute(task).kind());
    }

    // -- Resume --

    @Test
    void execute_shouldResumeExistingPartFileWithOffset() throws Exception {
        DownloadTask task = task(null);
        Path part = DownloadManager.partFileFor(task.targetPath());
        Files.createDirectories(part.getParent());
        Files.write(part, new byte[] {'0', '1', '2', '3', '4', '5'});

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        assertEquals(6, transfer.calls().get(0).offset());
        assertArrayEquals(CONTENT, Files.readAllBytes(task.targetPath()));
    }

    @Test
    void execute_shouldVerifyCompletePartFileWithoutTransfer() throws Exception {
        DownloadTask task = task(null);
        Path part = DownloadManager.partFileFor(task.targetPath());
        Files.createDirectories(part.getParent());
        Files.write(part, CONTENT);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        assertTrue(transfer.calls().isEmpty());
    }

    // -- Retries --

    @Test
    void execute_shouldRetryTransientFailuresWithExponentialBackoff() throws Exception {
        transfer.failing(URL, TransferException.Kind.RETRYABLE, 2);
        DownloadTask task = task(null);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        assertEquals(3, transfer.calls().size());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void execute_shouldFailAfterLastAttemptAndKeepPartFile() throws Exception {
        for (int i = 0; i < 3; i++) {
            transfer.then(URL, call -> {
                if (call.offset() == 0) {
                    ScriptedTransferClient.write(call.partFile(), new byte[] {'0', '1', '2', '3'}, false);
                }
                throw new TransferException(TransferException.Kind.RETRYABLE, "connection reset");
            });
        }
        DownloadTask task = task(null);

        DownloadOutcome outcome = manager(3).execute(task);

        assertEquals(DownloadOutcome.Kind.FAILED, outcome.kind());
        assertEquals(DownloadError.Kind.TRANSFER, outcome.error().kind());
        assertEquals(TaskStatus.FAILED, task.status());
        assertFalse(Files.exists(task.targetPath()));
        assertEquals(4, Files.size(DownloadManager.partFileFor(task.targetPath())));
        assertEquals(List.of(0L, 4L, 4L), transfer.calls().stream().map(ScriptedTransferClient.Call::offset).toList());
        assertEquals(2, sleeps.size());
    }

    @Test
    void execute_shouldNotRetryFatalStatus() {
        transfer.failing(URL, TransferException.Kind.FATAL, 1);

        DownloadOutcome outcome = manager(5).execute(task(null));

        assertEquals(DownloadOutcome.Kind.FAILED, outcome.kind());
        assertEquals(1, transfer.calls().size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_shouldRetrySizeMismatchAndReportIntegrityFailure() throws Exception {
        for (int i = 0; i < 2; i++) {
            transfer.then(URL, call -> ScriptedTransferClient.write(call.partFile(), new byte[5], false));
        }
        DownloadTask task = task(null);

        DownloadOutcome outcome = manager(2).execute(task);

        assertEquals(DownloadOutcome.Kind.FAILED, outcome.kind());
        assertEquals(DownloadError.Kind.INTEGRITY, outcome.error().kind());
        assertEquals(2, transfer.calls().size());
        assertFalse(Files.exists(DownloadManager.partFileFor(task.targetPath())));
    }

    @Test
    void execute_shouldRejectDigestMismatch() {
        DownloadTask task = task("00".repeat(32));

        DownloadOutcome outcome = manager(2).execute(task);

        assertEquals(DownloadError.Kind.INTEGRITY, outcome.error().kind());
        assertEquals(2, transfer.calls().size());
        assertFalse(Files.exists(task.targetPath()));
    }

    // -- Session --

    @Test
    void execute_shouldRenewSessionOnceWithoutUsingAnAttempt() {
        when(sessions.refresh(FIRST)).thenReturn(SECOND);
        transfer.failing(URL, TransferException.Kind.SESSION_EXPIRED, 1);

        DownloadOutcome outcome = manager(1).execute(task(null));

        assertEquals(DownloadOutcome.Kind.DOWNLOADED, outcome.kind());
        verify(sessions).refresh(FIRST);
        assertEquals(SECOND, transfer.calls().get(1).session());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_shouldFailWhenRenewedSessionIsRejectedToo() {
        when(sessions.refresh(FIRST)).thenReturn(SECOND);
        transfer.failing(URL, TransferException.Kind.SESSION_EXPIRED, 2);

        DownloadOutcome outcome = manager(5).execute(task(null));

        assertEquals(DownloadError.Kind.SESSION, outcome.error().kind());
        verify(sessions, times(1)).refresh(any());
        assertEquals(2, transfer.calls().size());
    }

    @Test
    void execute_shouldFailWhenNoSessionCanBeEstablished() {
        when(sessions.current()).thenThrow(new AuthException("Login rejected"));

        DownloadOutcome outcome = manager(3).execute(task(null));

        assertEquals(DownloadError.Kind.SESSION, outcome.error().kind());
        assertTrue(transfer.calls().isEmpty());
    }

    // -- Events --

    @Test
    void execute_shouldPublishStartProgressAndFinish() {
        List<Object> events = new ArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onStarted(DownloadEvents.TaskStartedEvent event) {
                events.add(event);
            }

            @Subscribe
            public void onProgress(DownloadEvents.ProgressEvent event) {
                events.add(event);
            }

            @Subscribe
            public void onFinished(DownloadEvents.TaskFinishedEvent event) {
                events.add(event);
            }
        });

        manager(1).execute(task(null));

        assertInstanceOf(DownloadEvents.TaskStartedEvent.class, events.get(0));
        assertInstanceOf(DownloadEvents.ProgressEvent.class, events.get(1));
        DownloadEvents.TaskFinishedEvent finished = assertInstanceOf(DownloadEvents.TaskFinishedEvent.class,
                events.get(events.size() - 1));
        assertEquals("DOWNLOADED", finished.outcome());
        assertNull(finished.detail());
    }

    private DownloadManager manager(int maxAttempts) {
        return new DownloadManager(transfer, sessions, RetryPolicy.of(maxAttempts, 100, 1000), eventBus, sleeps::add);
    }

    private DownloadTask task(String sha256) {
        PatchRecord record = new PatchRecord("1", "19.0.0.0.0", new Platform("226", "Linux x86-64"), "desc", "p1.zip",
                CONTENT.length, URL, sha256, PatchCategory.QUARTER, null);
        Path target = root.resolve("quarter_patches").resolve("p1.zip");
        return new DownloadTask(target, URL, CONTENT.length, sha256, List.of(record));
    }
}
