package com.example.intake.storage;

/**
 * Current usage of the managed key space.
 *
 * @param usedBytes  UTF-8 bytes of all managed keys and values
 * @param limitBytes configured budget
 * @param percentage usage as a percentage of the budget, rounded to an integer
 * @param canWrite   false once usage passes the write headroom ratio
 */
public record StorageQuota(
        long usedBytes,
        long limitBytes,
        int percentage,
        boolean canWrite
) {
    private static final double MEGABYTE = 1024.0 * 1024.0;

    public double usedMb() {
        return Math.round(usedBytes / MEGABYTE * 100) / 100.0;
    }

    public double limitMb() {
        return Math.round(limitBytes / MEGABYTE * 100) / 100.0;
    }
}
