package de.bsommerfeld.patchfetcher.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.patchfetcher.core.event.DownloadEvents;
import de.bsommerfeld.patchfetcher.core.util.ByteFormatter;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prints download progress to the console. Each file reports at most one
 * line per 10 % step, so parallel workers produce readable output.
 */
public class ConsoleProgressReporter {

    private static final int STEP_PERCENT = 10;

    private final PrintStream out;
    private final Map<String, Integer> lastStep = new ConcurrentHashMap<>();

    public ConsoleProgressReporter(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onStarted(DownloadEvents.TaskStartedEvent event) {
        lastStep.put(event.fileName(), -1);
        out.printf("Downloading %s (%s)%n", event.fileName(), ByteFormatter.format(event.expectedBytes()));
    }

    @Subscribe
    public void onProgress(DownloadEvents.ProgressEvent event) {
        if (event.totalBytes() <= 0) {
            return;
        }
        int percent = (int) Math.min(100, event.bytesRead() * 100 / event.totalBytes());
        int step = percent / STEP_PERCENT;
        Integer previous = lastStep.get(event.fileName());
        if (previous == null || step > previous) {
            lastStep.put(event.fileName(), step);
            out.printf("  %-40s %3d%%%n", event.fileName(), step * STEP_PERCENT);
        }
    }

    @Subscribe
    public void onFinished(DownloadEvents.TaskFinishedEvent event) {
        lastStep.remove(event.fileName());
        if (event.detail() == null) {
            out.printf("%s: %s%n", event.fileName(), event.outcome());
        } else {
            out.printf("%s: %s (%s)%n", event.fileName(), event.outcome(), event.detail());
        }
    }

    @Subscribe
    public void onStopRequested(DownloadEvents.StopRequestedEvent event) {
        out.printf("Stopping after running downloads: %s%n", event.reason());
    }
}
