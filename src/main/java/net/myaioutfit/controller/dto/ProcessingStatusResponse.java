package net.myaioutfit.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingStatusResponse(@JsonProperty("item_id") UUID itemId,
                                       @JsonProperty("processing_status") String processingStatus,
                                       @JsonProperty("processing_started_at") Instant processingStartedAt,
                                       @JsonProperty("processing_completed_at") Instant processingCompletedAt,
                                       @JsonProperty("image_url") String imageUrl) {

    public static ProcessingStatusResponse from(WardrobeItemStatus status) {
        return new ProcessingStatusResponse(
            status.itemId(),
            status.status() == null ? null : status.status().dbValue(),
            status.startedAt(),
            status.completedAt(),
            status.imageUrl()
        );
    }
}
