package de.bsommerfeld.patchfetcher.core.domain;

/**
 * Decides where a downloaded patch file lands below the download root.
 */
public enum PatchCategory {

    /** The patching utility itself, stored under {@code opatch/}. */
    OPATCH,

    /** Autonomous Health Framework bundles, stored under {@code ahf/}. */
    AHF,

    /** Recommended quarterly patches, stored per release and platform. */
    QUARTER,

    /** Patches requested through a patch-list file, stored per group. */
    LISTED
}
