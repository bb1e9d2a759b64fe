package de.bsommerfeld.patchfetcher.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@link FetcherConfig} from a JSON file and validates the values the
 * engine cannot run without.
 *
 * <p>
 * Unknown keys are rejected so that typos such as {@code ignored_release}
 * fail loudly instead of silently disabling a filter.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Binds the configuration file. Validation is a separate step, see
     * {@link #validate(FetcherConfig, boolean)}.
     *
     * @throws ConfigException if the file is missing or not valid JSON
     */
    public FetcherConfig load(Path configFile) throws ConfigException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("Configuration file not found: " + configFile.toAbsolutePath());
        }

        LOG.info("Loading configuration from: {}", configFile.toAbsolutePath());

        FetcherConfig config;
        try {
            config = mapper.readValue(configFile.toFile(), FetcherConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Invalid configuration file " + configFile + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Configuration file is empty: " + configFile);
        }
        return config;
    }

    /**
     * Checks the values required for a run. Called after command-line
     * overrides have been applied, since a username may come from there.
     *
     * @throws ConfigException listing every violation found
     */
    public static void validate(FetcherConfig config) throws ConfigException {
        validate(config, true);
    }

    /**
     * @param requirePlatforms {@code false} when a patch list supplies the
     *                         platforms instead of the configuration
     */
    public static void validate(FetcherConfig config, boolean requirePlatforms) throws ConfigException {
        List<String> problems = new ArrayList<>();

        String username = config.getCredentials().getUsername();
        if (username == null || username.isBlank()) {
            problems.add("credentials.username is required");
        }
        if (config.getDownloadRoot() == null) {
            problems.add("download_root is required");
        }
        if (requirePlatforms && (config.getPlatforms() == null || config.getPlatforms().isEmpty())) {
            problems.add("platforms must list at least one platform");
        }
        if (config.getMaxConcurrency() < 1) {
            problems.add("max_concurrency must be at least 1");
        }
        if (config.getDownload().getMaxAttempts() < 1) {
            problems.add("download.max_attempts must be at least 1");
        }
        if (config.getCatalog().getMaxAttempts() < 1) {
            problems.add("catalog.max_attempts must be at least 1");
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }
    }
}
