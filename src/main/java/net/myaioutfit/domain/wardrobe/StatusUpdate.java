package net.myaioutfit.domain.wardrobe;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Partial update of the processing slice; null fields are left untouched.
 * {@code clearCompletedAt} writes a null {@code completedAt} when a run restarts.
 */
public record StatusUpdate(ProcessingStatus status,
                           @Nullable Instant startedAt,
                           @Nullable Instant completedAt,
                           @Nullable String imageUrl,
                           boolean clearCompletedAt) {

    public StatusUpdate {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (clearCompletedAt && completedAt != null) {
            throw new IllegalArgumentException("completedAt cannot be both set and cleared");
        }
    }

    public static StatusUpdate processing(Instant startedAt) {
        return new StatusUpdate(ProcessingStatus.PROCESSING, startedAt, null, null, true);
    }

    public static StatusUpdate completed(Instant completedAt, String imageUrl) {
        return new StatusUpdate(ProcessingStatus.COMPLETED, null, completedAt, imageUrl, false);
    }

    /**
     * Terminal failure; {@code imageUrl} keeps a fallback image when one exists.
     */
    public static StatusUpdate failed(Instant completedAt, @Nullable String imageUrl) {
        return new StatusUpdate(ProcessingStatus.FAILED, null, completedAt, imageUrl, false);
    }
}
