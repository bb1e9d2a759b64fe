package de.bsommerfeld.patchfetcher.core.domain;

/**
 * Identity of a catalog record. Multiple query results describing the same
 * patch file for the same platform, release and destination collapse onto
 * one key.
 *
 * <p>
 * A patch may ship several files (e.g. {@code _1of2.zip}, {@code _2of2.zip}),
 * so the file name is part of the key. Category and group are part of it too:
 * the same file requested for two destinations is two placements, not a
 * duplicate.
 *
 * @param group destination group, {@code ""} when the record has none
 */
public record PatchKey(String patchNumber, String platformCode, String release, String fileName,
        PatchCategory category, String group) {
}
