package de.bsommerfeld.patchfetcher.core.domain;

import java.util.List;

/**
 * Selection rules applied to catalog records. Patterns are kept as raw
 * strings here; the filter engine compiles them once.
 *
 * @param platforms               platform codes, names, or name regexes to include
 * @param ignoredReleases         regexes; matching release strings are dropped
 * @param ignoredDescriptionWords regexes; matching descriptions are dropped
 */
public record FilterConfig(List<String> platforms, List<String> ignoredReleases,
        List<String> ignoredDescriptionWords) {

    public FilterConfig {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        ignoredReleases = ignoredReleases == null ? List.of() : List.copyOf(ignoredReleases);
        ignoredDescriptionWords = ignoredDescriptionWords == null ? List.of() : List.copyOf(ignoredDescriptionWords);
    }

    /** Same exclusions, different platform inclusion set. */
    public FilterConfig withPlatforms(List<String> newPlatforms) {
        return new FilterConfig(newPlatforms, ignoredReleases, ignoredDescriptionWords);
    }
}
