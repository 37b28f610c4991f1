package net.myaioutfit.domain.wardrobe;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Port onto the external item store. Every read and write is scoped by owner.
 */
public interface WardrobeItemStatusRepository {

    /**
     * @return true when the item exists and belongs to {@code ownerId}
     */
    boolean existsForOwner(UUID itemId, String ownerId);

    Optional<WardrobeItemStatus> findStatus(UUID itemId, String ownerId);

    /**
     * Writes only the non-null fields of {@code update}.
     *
     * @return number of rows touched; 0 when the item is missing or owned by someone else
     */
    int updateStatus(UUID itemId, String ownerId, StatusUpdate update);

    /**
     * Items still in {@code processing} whose start time is older than {@code startedBefore}.
     */
    List<WardrobeItemStatus> findStaleProcessing(Instant startedBefore, int limit);

    /**
     * Moves an item to {@code failed} only if it is still {@code processing} and started before
     * {@code startedBefore}; {@code image_url} is left as is.
     *
     * @return true when the row was changed
     */
    boolean failIfStillProcessing(UUID itemId, String ownerId, Instant startedBefore, Instant completedAt);
}
