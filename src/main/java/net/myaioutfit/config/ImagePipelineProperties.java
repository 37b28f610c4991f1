package net.myaioutfit.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the wardrobe image pipeline.
 *
 * <p>Passed explicitly into the orchestrator and storage layer instead of being read from
 * ambient environment variables at call time.</p>
 */
@ConfigurationProperties(prefix = "image-pipeline")
public class ImagePipelineProperties {

    private String bucketName = "wardrobe-images";
    private long maxSourceBytes = 5L * 1024 * 1024;
    private long maxStorageBytes = 10L * 1024 * 1024;
    private List<String> allowedMimeTypes = new ArrayList<>(List.of("image/jpeg", "image/png", "image/webp"));
    private List<String> storageMimeTypes = new ArrayList<>(List.of("image/webp", "image/png", "image/jpeg"));
    private int maxBgRemovalAttempts = 3;
    private Duration bgRemovalRetryDelay = Duration.ofSeconds(1);
    private int resizeMaxDimension = 1024;
    private int costUnitsPerGeneration = 5;
    private Duration staleProcessingThreshold = Duration.ofMinutes(10);
    private Duration staleProcessingSweepInterval = Duration.ofMinutes(5);

    /**
     * Storage bucket holding original and processed wardrobe images.
     */
    public String getBucketName() {
        return bucketName;
    }

    public void setBucketName(String bucketName) {
        this.bucketName = bucketName;
    }

    /**
     * Ceiling for directly uploaded source images.
     */
    public long getMaxSourceBytes() {
        return maxSourceBytes;
    }

    public void setMaxSourceBytes(long maxSourceBytes) {
        this.maxSourceBytes = maxSourceBytes;
    }

    /**
     * Per-object ceiling enforced on every bucket write and recorded on the bucket.
     */
    public long getMaxStorageBytes() {
        return maxStorageBytes;
    }

    public void setMaxStorageBytes(long maxStorageBytes) {
        this.maxStorageBytes = maxStorageBytes;
    }

    /**
     * MIME types accepted from direct uploads.
     */
    public List<String> getAllowedMimeTypes() {
        return allowedMimeTypes;
    }

    public void setAllowedMimeTypes(List<String> allowedMimeTypes) {
        this.allowedMimeTypes = allowedMimeTypes;
    }

    /**
     * MIME types the bucket accepts for stored objects.
     */
    public List<String> getStorageMimeTypes() {
        return storageMimeTypes;
    }

    public void setStorageMimeTypes(List<String> storageMimeTypes) {
        this.storageMimeTypes = storageMimeTypes;
    }

    public int getMaxBgRemovalAttempts() {
        return maxBgRemovalAttempts;
    }

    public void setMaxBgRemovalAttempts(int maxBgRemovalAttempts) {
        this.maxBgRemovalAttempts = maxBgRemovalAttempts;
    }

    /**
     * Base delay for background-removal retries; attempt {@code n} waits {@code n} times this value.
     */
    public Duration getBgRemovalRetryDelay() {
        return bgRemovalRetryDelay;
    }

    public void setBgRemovalRetryDelay(Duration bgRemovalRetryDelay) {
        this.bgRemovalRetryDelay = bgRemovalRetryDelay;
    }

    public int getResizeMaxDimension() {
        return resizeMaxDimension;
    }

    public void setResizeMaxDimension(int resizeMaxDimension) {
        this.resizeMaxDimension = resizeMaxDimension;
    }

    public int getCostUnitsPerGeneration() {
        return costUnitsPerGeneration;
    }

    public void setCostUnitsPerGeneration(int costUnitsPerGeneration) {
        this.costUnitsPerGeneration = costUnitsPerGeneration;
    }

    /**
     * Age after which a record still marked {@code processing} is considered abandoned.
     */
    public Duration getStaleProcessingThreshold() {
        return staleProcessingThreshold;
    }

    public void setStaleProcessingThreshold(Duration staleProcessingThreshold) {
        this.staleProcessingThreshold = staleProcessingThreshold;
    }

    public Duration getStaleProcessingSweepInterval() {
        return staleProcessingSweepInterval;
    }

    public void setStaleProcessingSweepInterval(Duration staleProcessingSweepInterval) {
        this.staleProcessingSweepInterval = staleProcessingSweepInterval;
    }
}
