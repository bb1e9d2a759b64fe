package de.bsommerfeld.patchfetcher.app;

import ch.qos.logback.classic.Level;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.patchfetcher.app.config.AppModule;
import de.bsommerfeld.patchfetcher.app.patchlist.PatchListEntry;
import de.bsommerfeld.patchfetcher.app.patchlist.PatchListReader;
import de.bsommerfeld.patchfetcher.catalog.AuthException;
import de.bsommerfeld.patchfetcher.catalog.CatalogException;
import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.config.ConfigLoader;
import de.bsommerfeld.patchfetcher.core.config.ConfigLocations;
import de.bsommerfeld.patchfetcher.core.config.FetcherConfig;
import de.bsommerfeld.patchfetcher.core.event.ApplicationEventBus;
import de.bsommerfeld.patchfetcher.downloader.download.StopSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <p>
 * Without {@code -f} the recommended patches for the configured platforms
 * are fetched; with {@code -f} the patches listed in the CSV file. Ctrl-C
 * lets running downloads finish and starts no new ones.
 */
@Command(name = PatchFetcherMain.APP_NAME,
        mixinStandardHelpOptions = true,
        version = "patch-fetcher 1.0.0",
        description = "Downloads the recommended patches for the configured platforms, "
                + "or the patches listed in a CSV file.",
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:success",
                "1:a download failed or the catalog could not be queried",
                "2:invalid configuration or usage"
        })
public final class PatchFetcherMain implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PatchFetcherMain.class);

    static final String APP_NAME = "patch-fetcher";
    static final int EXIT_CONFIG = 2;

    @Option(names = {"-c", "--config"},
            description = "JSON configuration file (default: ./config.json, then the user configuration directory)")
    private Path configFile;

    @Option(names = "--dry-run",
            description = "Report the size of the files to download without downloading them")
    private boolean dryRun;

    @Option(names = "--debug", description = "Log at debug level")
    private boolean debug;

    @Option(names = {"-f", "--file"}, paramLabel = "<patches.csv>",
            description = "Download the patches listed in this CSV file instead of the recommended ones")
    private Path patchListFile;

    @Option(names = {"-u", "--user"}, description = "Support account user name, overrides the configuration")
    private String user;

    @Option(names = {"-p", "--password"}, arity = "0..1", interactive = true,
            description = "Support account password; prompted for when given without a value")
    private char[] password;

    @Option(names = {"-l", "--list-platforms"}, description = "Only print the platform codes and names")
    private boolean listPlatforms;

    private final PrintStream out;

    public PatchFetcherMain() {
        this(System.out);
    }

    PatchFetcherMain(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PatchFetcherMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (debug) {
            enableDebugLogging();
        }

        FetcherConfig config;
        List<PatchListEntry> patchList = null;
        try {
            config = new ConfigLoader().load(ConfigLocations.system().resolve(APP_NAME, configFile));
            applyOverrides(config);
            if (patchListFile != null) {
                patchList = new PatchListReader().read(patchListFile);
            }
            ConfigLoader.validate(config, patchList == null && !listPlatforms);
        } catch (ConfigException e) {
            LOG.error(e.getMessage());
            return EXIT_CONFIG;
        }

        Injector injector = Guice.createInjector(new AppModule(config));
        injector.getInstance(ApplicationEventBus.class).register(new ConsoleProgressReporter(out));
        StopSignal stopSignal = injector.getInstance(StopSignal.class);
        FetchOrchestrator orchestrator = injector.getInstance(FetchOrchestrator.class);

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            stopSignal.raise("interrupted");
            Uninterruptibles.awaitUninterruptibly(finished);
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            if (listPlatforms) {
                return orchestrator.listPlatforms(out);
            }
            out.println("Initializing Downloader.");
            return orchestrator.fetch(patchList, dryRun, out);
        } catch (ConfigException e) {
            LOG.error(e.getMessage());
            return EXIT_CONFIG;
        } catch (AuthException e) {
            LOG.error("Login to {} rejected: {}", config.getCatalog().getBaseUrl(), e.getMessage());
            return FetchOrchestrator.EXIT_FAILURE;
        } catch (CatalogException e) {
            LOG.error("Not able to query {}: {}", config.getCatalog().getBaseUrl(), e.getMessage());
            return FetchOrchestrator.EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    private void applyOverrides(FetcherConfig config) {
        if (user != null) {
            config.getCredentials().setUsername(user);
        }
        if (password != null) {
            config.getCredentials().setPassword(new String(password));
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM is shutting down, hook stays registered");
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        } else {
            LOG.warn("--debug has no effect with logger backend {}", root.getClass().getName());
        }
    }
}
