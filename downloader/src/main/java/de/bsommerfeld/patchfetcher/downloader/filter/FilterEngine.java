package de.bsommerfeld.patchfetcher.downloader.filter;

import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.domain.FilterConfig;
import de.bsommerfeld.patchfetcher.core.domain.PatchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies the selection rules to catalog records.
 *
 * <h3>Stages</h3>
 * Each record passes three stages in fixed order and is dropped at the first
 * one it fails:
 * <ol>
 * <li>Platform inclusion, see {@link PlatformMatcher}</li>
 * <li>Release exclusion: any {@code ignored_releases} pattern found in the
 * release string</li>
 * <li>Description exclusion: any {@code ignored_description_words} pattern
 * found in the description (case-sensitive)</li>
 * </ol>
 *
 * Exclusion patterns are not anchored: {@code OJVM} drops
 * {@code "OJVM RELEASE UPDATE 19.23.0.0.0"}, {@code ^12\.} drops every
 * 12.x release.
 *
 * <p>
 * Patterns are compiled once in {@link #compile(FilterConfig)}. The engine
 * is immutable and {@link #select} has no side effects besides debug
 * logging, so applying it to its own output changes nothing.
 */
public final class FilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);

    private final PlatformMatcher platforms;
    private final List<Pattern> ignoredReleases;
    private final List<Pattern> ignoredDescriptions;

    private FilterEngine(PlatformMatcher platforms, List<Pattern> ignoredReleases, List<Pattern> ignoredDescriptions) {
        this.platforms = platforms;
        this.ignoredReleases = List.copyOf(ignoredReleases);
        this.ignoredDescriptions = List.copyOf(ignoredDescriptions);
    }

    /**
     * @throws ConfigException if any pattern is not a valid regular expression
     */
    public static FilterEngine compile(FilterConfig config) throws ConfigException {
        return new FilterEngine(
                PlatformMatcher.compile(config.platforms()),
                compileAll(config.ignoredReleases(), "ignored_releases"),
                compileAll(config.ignoredDescriptionWords(), "ignored_description_words"));
    }

    public FilterResult select(Collection<PatchRecord> records) {
        List<PatchRecord> selected = new ArrayList<>();
        int byPlatform = 0;
        int byRelease = 0;
        int byDescription = 0;

        for (PatchRecord record : records) {
            if (!platforms.matches(record.platform())) {
                byPlatform++;
            } else if (findsAny(ignoredReleases, record.release())) {
                byRelease++;
            } else if (findsAny(ignoredDescriptions, record.description())) {
                byDescription++;
            } else {
                selected.add(record);
            }
        }

        LOG.debug("Selected {} of {} records (dropped: platform={}, release={}, description={})",
                selected.size(), records.size(), byPlatform, byRelease, byDescription);
        return new FilterResult(selected, byPlatform, byRelease, byDescription);
    }

    private static boolean findsAny(List<Pattern> patterns, String value) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(value).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileAll(List<String> expressions, String key) throws ConfigException {
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression));
            } catch (PatternSyntaxException e) {
                throw new ConfigException("Invalid pattern in " + key + ": '" + expression + "' ("
                        + e.getDescription() + ")", e);
            }
        }
        return patterns;
    }
}
