package de.bsommerfeld.patchfetcher.core.domain;

import java.util.Objects;

/**
 * An operating-system/architecture target as published by the catalog.
 * Two platforms are equal when their codes are equal; the name is display
 * data only.
 *
 * @param code catalog identifier (e.g. {@code "226"})
 * @param name human-readable name (e.g. {@code "Linux x86-64"})
 */
public record Platform(String code, String name) {

    /** Code the catalog uses for platform-independent patches. */
    public static final String GENERIC_CODE = "2000";

    public Platform {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(name, "name");
    }

    public static Platform generic() {
        return new Platform(GENERIC_CODE, "Generic Platform");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Platform other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }
}
