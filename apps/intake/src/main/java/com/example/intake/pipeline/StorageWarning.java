package com.example.intake.pipeline;

import com.example.intake.storage.StorageQuota;

import java.util.Locale;

/**
 * Shown to the user when storage usage crosses the warning ratio after a batch.
 */
public record StorageWarning(
        int percentage,
        double usedMb,
        double limitMb,
        String message,
        boolean dismissible
) {
    public static StorageWarning of(StorageQuota quota) {
        String message = String.format(Locale.ROOT,
                "Depolama alanı %%%d dolu (%.1f MB / %.1f MB). Eski belgelerin görselleri temizlenebilir.",
                quota.percentage(), quota.usedMb(), quota.limitMb());
        return new StorageWarning(quota.percentage(), quota.usedMb(), quota.limitMb(), message, true);
    }
}
