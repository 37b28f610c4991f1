package net.myaioutfit.application.pipeline;

import jakarta.annotation.Nullable;

/**
 * Successful (or partially successful) pipeline outcome.
 *
 * @param imageUrl public URL now recorded on the item
 * @param storagePath object key of {@code imageUrl}
 * @param backgroundRemovalStatus {@code completed} or {@code failed} when removal was part of the run
 * @param message human-readable summary for direct uploads
 * @param generationDurationMs time spent generating, Flow B only
 * @param costUnits estimated cost of the run, Flow B only
 * @param processingTimeMs wall time of the run, Flow A only
 */
public record PipelineResult(String imageUrl,
                             String storagePath,
                             @Nullable String backgroundRemovalStatus,
                             @Nullable String message,
                             @Nullable Long generationDurationMs,
                             @Nullable Integer costUnits,
                             @Nullable Long processingTimeMs) {

    static PipelineResult upload(String imageUrl, String storagePath, @Nullable String backgroundRemovalStatus,
                                 String message, long processingTimeMs) {
        return new PipelineResult(imageUrl, storagePath, backgroundRemovalStatus, message, null, null, processingTimeMs);
    }

    static PipelineResult generated(String imageUrl, String storagePath, long generationDurationMs, int costUnits) {
        return new PipelineResult(imageUrl, storagePath, null, null, generationDurationMs, costUnits, null);
    }
}
