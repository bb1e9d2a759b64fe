package de.bsommerfeld.patchfetcher.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry and disk-space parameters for patch transfers.
 */
public class DownloadConfig {

    @JsonProperty("max_attempts")
    private int maxAttempts = 5;

    @JsonProperty("initial_backoff_millis")
    private long initialBackoffMillis = 1000;

    @JsonProperty("max_backoff_millis")
    private long maxBackoffMillis = 30_000;

    /** Free space that must remain on the target file store after a transfer. */
    @JsonProperty("disk_space_reserve_mb")
    private long diskSpaceReserveMb = 512;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
        this.initialBackoffMillis = initialBackoffMillis;
    }

    public long getMaxBackoffMillis() {
        return maxBackoffMillis;
    }

    public long getDiskSpaceReserveMb() {
        return diskSpaceReserveMb;
    }

    public void setDiskSpaceReserveMb(long diskSpaceReserveMb) {
        this.diskSpaceReserveMb = diskSpaceReserveMb;
    }
}
