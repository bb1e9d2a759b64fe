package de.bsommerfeld.patchfetcher.downloader.download;

import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.core.event.DownloadEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide stop flag. Once raised, no further task starts; tasks already
 * running finish normally.
 */
public class StopSignal {

    private static final Logger LOG = LoggerFactory.getLogger(StopSignal.class);

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final ApplicationEventBus eventBus;

    public StopSignal(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Raises the signal. Only the first reason is kept and announced.
     *
     * @return {@code true} if this call raised it
     */
    public boolean raise(String stopReason) {
        if (reason.compareAndSet(null, stopReason)) {
            LOG.warn("Stopping: {}. Running downloads will finish, no new ones start", stopReason);
            eventBus.post(new DownloadEvents.StopRequestedEvent(stopReason));
            return true;
        }
        return false;
    }

    public boolean isRaised() {
        return reason.get() != null;
    }

    /** First reason given, {@code null} if not raised. */
    public String reason() {
        return reason.get();
    }
}
