package de.bsommerfeld.patchfetcher.downloader.filter;

import de.bsommerfeld.patchfetcher.core.config.ConfigException;
import de.bsommerfeld.patchfetcher.core.domain.Platform;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Platform selection by code, exact name, or a regular expression that must
 * match the whole platform name. {@code "226"}, {@code "Linux x86-64"} and
 * {@code "Linux.*"} all select the 64-bit Linux platform.
 */
public final class PlatformMatcher {

    private record Entry(String literal, Pattern pattern) {

        boolean matches(Platform platform) {
            return literal.equals(platform.code())
                    || literal.equals(platform.name())
                    || pattern.matcher(platform.name()).matches();
        }
    }

    private final List<Entry> entries;

    private PlatformMatcher(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * @throws ConfigException if an entry is not a valid regular expression
     */
    public static PlatformMatcher compile(Collection<String> selectors) throws ConfigException {
        List<Entry> entries = new ArrayList<>();
        for (String selector : selectors) {
            String trimmed = selector.trim();
            try {
                entries.add(new Entry(trimmed, Pattern.compile(trimmed)));
            } catch (PatternSyntaxException e) {
                throw new ConfigException("Invalid platform pattern '" + selector + "': " + e.getDescription(), e);
            }
        }
        return new PlatformMatcher(entries);
    }

    public boolean matches(Platform platform) {
        for (Entry entry : entries) {
            if (entry.matches(platform)) {
                return true;
            }
        }
        return false;
    }

    /** Known platforms selected by this matcher, in the given order. */
    public List<Platform> select(Collection<Platform> known) {
        return known.stream().filter(this::matches).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
