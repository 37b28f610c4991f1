package net.myaioutfit.service.status;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.myaioutfit.domain.wardrobe.StatusUpdate;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatus;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatusRepository;
import net.myaioutfit.service.storage.StoredObject;
import net.myaioutfit.service.storage.WardrobeImageStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Records pipeline transitions on the owning wardrobe item.
 *
 * <p>Writes are scoped by item and owner. Item-store failures are logged and reported as
 * {@code false} so a status write never masks the pipeline error that triggered it.</p>
 */
@Service
public class ProcessingStatusTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingStatusTracker.class);

    private final WardrobeItemStatusRepository repository;
    private final WardrobeImageStorageService storageService;
    private final Clock clock;

    public ProcessingStatusTracker(WardrobeItemStatusRepository repository,
                                   WardrobeImageStorageService storageService,
                                   Clock clock) {
        this.repository = repository;
        this.storageService = storageService;
        this.clock = clock;
    }

    /**
     * Applies {@code update} to the item if it belongs to {@code ownerId}.
     *
     * @return true when a row was written
     */
    public boolean setStatus(UUID itemId, String ownerId, StatusUpdate update) {
        try {
            int rows = repository.updateStatus(itemId, ownerId, update);
            if (rows > 0) {
                logger.info("Item {} -> {}{}", itemId, update.status().dbValue(),
                    update.imageUrl() != null ? " (image " + update.imageUrl() + ")" : "");
                return true;
            }
            logger.warn("Item {} not found for owner {}; status {} not written", itemId, ownerId, update.status().dbValue());
            return false;
        } catch (DataAccessException ex) {
            logger.error("Failed to write status {} for item {}: {}", update.status().dbValue(), itemId, ex.getMessage(), ex);
            return false;
        }
    }

    public boolean markProcessing(UUID itemId, String ownerId) {
        return setStatus(itemId, ownerId, StatusUpdate.processing(clock.instant()));
    }

    /**
     * Terminal failure. {@code fallbackImageUrl} keeps a usable image on the record when one exists.
     */
    public boolean markFailed(UUID itemId, String ownerId, @Nullable String fallbackImageUrl) {
        return setStatus(itemId, ownerId, StatusUpdate.failed(clock.instant(), fallbackImageUrl));
    }

    public boolean markCompleted(UUID itemId, String ownerId, String imageUrl) {
        return setStatus(itemId, ownerId, StatusUpdate.completed(clock.instant(), imageUrl));
    }

    /**
     * Final write of a run: re-checks the item still exists, then marks it completed with
     * {@code stored}'s URL. A vanished item gets no write and {@code stored} is deleted.
     */
    public CompletionOutcome completeIfPresent(UUID itemId, String ownerId, StoredObject stored) {
        boolean present;
        try {
            present = repository.existsForOwner(itemId, ownerId);
        } catch (DataAccessException ex) {
            logger.error("Could not re-check item {} before completion: {}", itemId, ex.getMessage(), ex);
            return CompletionOutcome.WRITE_FAILED;
        }
        if (!present) {
            logger.warn("Item {} was deleted mid-pipeline; discarding {}", itemId, stored.path());
            storageService.remove(List.of(stored.path()));
            return CompletionOutcome.ASSET_GONE;
        }
        return markCompleted(itemId, ownerId, stored.publicUrl())
            ? CompletionOutcome.COMPLETED
            : CompletionOutcome.WRITE_FAILED;
    }

    /**
     * Ownership check made before any external call. Item-store errors propagate.
     */
    public boolean isOwnedBy(UUID itemId, String ownerId) {
        return repository.existsForOwner(itemId, ownerId);
    }

    public Optional<WardrobeItemStatus> findStatus(UUID itemId, String ownerId) {
        return repository.findStatus(itemId, ownerId);
    }
}
