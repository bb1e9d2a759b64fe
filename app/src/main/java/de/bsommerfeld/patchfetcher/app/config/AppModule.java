package de.bsommerfeld.patchfetcher.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.patchfetcher.catalog.CatalogClient;
import de.bsommerfeld.patchfetcher.catalog.SessionProvider;
import de.bsommerfeld.patchfetcher.catalog.SupportCatalogClient;
import de.bsommerfeld.patchfetcher.catalog.SupportSessionProvider;
import de.bsommerfeld.patchfetcher.core.config.CatalogConfig;
import de.bsommerfeld.patchfetcher.core.config.DownloadConfig;
import de.bsommerfeld.patchfetcher.core.config.FetcherConfig;
import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.core.util.RetryPolicy;
import de.bsommerfeld.patchfetcher.core.util.Sleeper;
import de.bsommerfeld.patchfetcher.downloader.download.DiskSpaceGuard;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadManager;
import de.bsommerfeld.patchfetcher.downloader.download.DownloadScheduler;
import de.bsommerfeld.patchfetcher.downloader.download.HttpTransferClient;
import de.bsommerfeld.patchfetcher.downloader.download.StopSignal;
import de.bsommerfeld.patchfetcher.downloader.download.TransferClient;
import de.bsommerfeld.patchfetcher.downloader.layout.LayoutWriter;
import de.bsommerfeld.patchfetcher.downloader.plan.DownloadPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Guice module wiring the catalog, planner and download components from a
 * loaded and validated {@link FetcherConfig}.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private static final long MEGABYTE = 1024L * 1024;
    private static final long CATALOG_INITIAL_BACKOFF_MILLIS = 1_000;
    private static final long CATALOG_MAX_BACKOFF_MILLIS = 30_000;

    private final FetcherConfig config;

    public AppModule(FetcherConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.debug("Download root: {}", config.getDownloadRoot());
        bind(FetcherConfig.class).toInstance(config);
    }

    /** Catalog client; login relies on seeing every redirect. */
    @Provides
    @Singleton
    HttpClient catalogHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(config.getCatalog().getTimeoutSeconds()))
                .build();
    }

    @Provides
    @Singleton
    SessionProvider sessionProvider(HttpClient client) {
        return new SupportSessionProvider(client, config.getCatalog(), config.getCredentials(),
                catalogRetryPolicy(config.getCatalog()), Sleeper.SYSTEM, Clock.systemUTC());
    }

    @Provides
    @Singleton
    CatalogClient catalogClient(HttpClient client, SessionProvider sessions) {
        return new SupportCatalogClient(client, config.getCatalog(), sessions,
                catalogRetryPolicy(config.getCatalog()), Sleeper.SYSTEM);
    }

    @Provides
    @Singleton
    LayoutWriter layoutWriter() {
        return new LayoutWriter(config.getDownloadRoot());
    }

    @Provides
    @Singleton
    DownloadPlanner downloadPlanner(LayoutWriter layout) {
        return new DownloadPlanner(layout);
    }

    @Provides
    @Singleton
    TransferClient transferClient() {
        CatalogConfig catalog = config.getCatalog();
        return new HttpTransferClient(catalog.getUserAgent(), Duration.ofSeconds(catalog.getTimeoutSeconds()));
    }

    @Provides
    @Singleton
    DownloadManager downloadManager(TransferClient transferClient, SessionProvider sessions,
            ApplicationEventBus eventBus) {
        DownloadConfig download = config.getDownload();
        RetryPolicy retryPolicy = RetryPolicy.of(download.getMaxAttempts(), download.getInitialBackoffMillis(),
                download.getMaxBackoffMillis());
        return new DownloadManager(transferClient, sessions, retryPolicy, eventBus, Sleeper.SYSTEM);
    }

    @Provides
    @Singleton
    StopSignal stopSignal(ApplicationEventBus eventBus) {
        return new StopSignal(eventBus);
    }

    @Provides
    @Singleton
    DiskSpaceGuard diskSpaceGuard() {
        return new DiskSpaceGuard(config.getDownload().getDiskSpaceReserveMb() * MEGABYTE, DiskSpaceGuard.FILE_STORE);
    }

    @Provides
    @Singleton
    DownloadScheduler downloadScheduler(DownloadManager manager, LayoutWriter layout, DiskSpaceGuard diskSpace,
            StopSignal stopSignal) {
        return new DownloadScheduler(manager, layout, diskSpace, stopSignal, config.getMaxConcurrency());
    }

    private static RetryPolicy catalogRetryPolicy(CatalogConfig catalog) {
        return RetryPolicy.of(catalog.getMaxAttempts(), CATALOG_INITIAL_BACKOFF_MILLIS, CATALOG_MAX_BACKOFF_MILLIS);
    }
}
