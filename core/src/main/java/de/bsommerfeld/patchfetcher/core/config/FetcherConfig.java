package de.bsommerfeld.patchfetcher.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.patchfetcher.core.domain.FilterConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Root of the JSON configuration file. Values are loaded once at startup by
 * {@link ConfigLoader}; setters exist for command-line overrides and tests.
 */
public class FetcherConfig {

    @JsonProperty("credentials")
    private CredentialsConfig credentials = new CredentialsConfig();

    /** Platform codes, exact platform names, or regular expressions over the name. */
    @JsonProperty("platforms")
    private List<String> platforms = new ArrayList<>();

    @JsonProperty("ignored_releases")
    private List<String> ignoredReleases = new ArrayList<>();

    @JsonProperty("ignored_description_words")
    private List<String> ignoredDescriptionWords = new ArrayList<>();

    @JsonProperty("download_root")
    @JsonAlias("target_dir")
    private String downloadRoot;

    @JsonProperty("max_concurrency")
    private int maxConcurrency = 4;

    @JsonProperty("catalog")
    private CatalogConfig catalog = new CatalogConfig();

    @JsonProperty("download")
    private DownloadConfig download = new DownloadConfig();

    public CredentialsConfig getCredentials() {
        return credentials;
    }

    public List<String> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(List<String> platforms) {
        this.platforms = platforms;
    }

    public List<String> getIgnoredReleases() {
        return ignoredReleases;
    }

    public void setIgnoredReleases(List<String> ignoredReleases) {
        this.ignoredReleases = ignoredReleases;
    }

    public List<String> getIgnoredDescriptionWords() {
        return ignoredDescriptionWords;
    }

    public void setIgnoredDescriptionWords(List<String> ignoredDescriptionWords) {
        this.ignoredDescriptionWords = ignoredDescriptionWords;
    }

    public Path getDownloadRoot() {
        return downloadRoot == null ? null : Path.of(downloadRoot);
    }

    public void setDownloadRoot(Path downloadRoot) {
        this.downloadRoot = downloadRoot.toString();
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public CatalogConfig getCatalog() {
        return catalog;
    }

    public DownloadConfig getDownload() {
        return download;
    }

    /** Extracts the selection rules consumed by the filter engine. */
    public FilterConfig toFilterConfig() {
        return new FilterConfig(platforms, ignoredReleases, ignoredDescriptionWords);
    }
}
