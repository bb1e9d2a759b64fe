package de.bsommerfeld.patchfetcher.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples the download
 * workers from whoever reports on them (console, tests).
 *
 * <p>
 * Delivery is synchronous on the posting thread. Subscribers are invoked from
 * multiple worker threads concurrently and must be thread-safe.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus("PatchFetcher-EventBus");
    }

    public void post(Object event) {
        // Progress events fire per buffer and would flood the debug log
        if (!(event instanceof DownloadEvents.ProgressEvent)) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
