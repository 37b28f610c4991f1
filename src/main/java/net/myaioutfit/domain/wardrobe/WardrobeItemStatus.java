package net.myaioutfit.domain.wardrobe;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a wardrobe item record that the image pipeline reads and writes.
 *
 * @param itemId owning item id
 * @param ownerId owner of the item
 * @param status current processing status, null when never processed
 * @param startedAt when processing last entered {@code processing}
 * @param completedAt when processing last reached a terminal state
 * @param imageUrl public URL of the best available image
 */
public record WardrobeItemStatus(UUID itemId,
                                 String ownerId,
                                 @Nullable ProcessingStatus status,
                                 @Nullable Instant startedAt,
                                 @Nullable Instant completedAt,
                                 @Nullable String imageUrl) {
}
