package net.myaioutfit.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatus;
import net.myaioutfit.domain.wardrobe.WardrobeItemStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves items left in {@code processing} past the configured threshold to {@code failed}.
 * Covers runs whose JVM died between the processing and terminal status writes; the image URL is left untouched.
 */
@Component
public class StaleProcessingSweeper {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaleProcessingSweeper.class);
    static final int BATCH_SIZE = 100;

    private final WardrobeItemStatusRepository repository;
    private final ImagePipelineProperties properties;
    private final Clock clock;

    public StaleProcessingSweeper(WardrobeItemStatusRepository repository,
                                  ImagePipelineProperties properties,
                                  Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return number of items moved to {@code failed}
     */
    @Scheduled(fixedDelayString = "${image-pipeline.stale-processing-sweep-interval:5m}",
        initialDelayString = "${image-pipeline.stale-processing-sweep-interval:5m}")
    public int sweepStaleProcessing() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getStaleProcessingThreshold());
        List<WardrobeItemStatus> stale;
        try {
            stale = repository.findStaleProcessing(cutoff, BATCH_SIZE);
        } catch (DataAccessException ex) {
            LOGGER.error("Stale processing sweep could not query items: {}", ex.getMessage(), ex);
            return 0;
        }
        if (stale.isEmpty()) {
            LOGGER.debug("No items stuck in processing before {}", cutoff);
            return 0;
        }

        int failed = 0;
        for (WardrobeItemStatus item : stale) {
            try {
                if (repository.failIfStillProcessing(item.itemId(), item.ownerId(), cutoff, now)) {
                    failed++;
                    LOGGER.warn("Item {} stuck in processing since {}; marked failed", item.itemId(), item.startedAt());
                }
            } catch (DataAccessException ex) {
                LOGGER.error("Could not fail stale item {}: {}", item.itemId(), ex.getMessage(), ex);
            }
        }
        LOGGER.info("Stale processing sweep: {}/{} items marked failed", failed, stale.size());
        return failed;
    }
}
