package net.myaioutfit.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.myaioutfit.application.pipeline.PipelineResult;

/**
 * Success (or Flow A partial success) payload. Absent fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResponse(@JsonProperty("success") boolean success,
                               @JsonProperty("image_url") String imageUrl,
                               @JsonProperty("storage_path") String storagePath,
                               @JsonProperty("background_removal_status") String backgroundRemovalStatus,
                               @JsonProperty("message") String message,
                               @JsonProperty("generation_duration_ms") Long generationDurationMs,
                               @JsonProperty("cost_units") Integer costUnits,
                               @JsonProperty("processing_time_ms") Long processingTimeMs) {

    public static PipelineResponse from(PipelineResult result) {
        return new PipelineResponse(
            true,
            result.imageUrl(),
            result.storagePath(),
            result.backgroundRemovalStatus(),
            result.message(),
            result.generationDurationMs(),
            result.costUnits(),
            result.processingTimeMs()
        );
    }
}
