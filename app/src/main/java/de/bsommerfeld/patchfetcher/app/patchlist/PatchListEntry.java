package de.bsommerfeld.patchfetcher.app.patchlist;

import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.domain.Platform;
import de.bsommerfeld.patchfetcher.downloader.filter.PlatformMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * One row of a patch-list file.
 *
 * @param line        line number in the file, for messages
 * @param patchNumber patch to fetch
 * @param group       destination subdirectory, empty for the download root
 * @param platform    platform code, name or name regex; empty for the
 *                    generic platform
 */
public record PatchListEntry(long line, String patchNumber, String group, String platform) {

    private static final Logger LOG = LoggerFactory.getLogger(PatchListEntry.class);

    public PatchListEntry {
        group = group == null ? "" : group.trim();
        platform = platform == null ? "" : platform.trim();
    }

    /**
     * Resolves the platform column against the catalog's platforms.
     *
     * @return matching platforms, empty if the column names none of them
     */
    public List<Platform> resolvePlatforms(Collection<Platform> known) {
        if (platform.isEmpty()) {
            return List.of(known.stream()
                    .filter(p -> Platform.GENERIC_CODE.equals(p.code()))
                    .findFirst()
                    .orElseGet(Platform::generic));
        }
        if (platform.chars().allMatch(Character::isDigit)) {
            return known.stream().filter(p -> p.code().equals(platform)).toList();
        }
        try {
            return PlatformMatcher.compile(List.of(platform)).select(known);
        } catch (ConfigException e) {
            LOG.warn("Line {}: {}", line, e.getMessage());
            return List.of();
        }
    }
}
