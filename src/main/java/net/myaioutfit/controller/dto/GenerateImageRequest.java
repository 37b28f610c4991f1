package net.myaioutfit.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /api/wardrobe-images/generate}.
 */
public record GenerateImageRequest(@JsonProperty("wardrobe_item_id") String wardrobeItemId,
                                   @JsonProperty("user_id") String userId,
                                   @JsonProperty("prompt") String prompt) {
}
