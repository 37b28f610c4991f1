package net.myaioutfit.service.storage;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.exception.ImagePipelineException;
import net.myaioutfit.exception.ImageStorageException;
import net.myaioutfit.model.image.ImageFormat;
import net.myaioutfit.model.image.StoragePurpose;
import net.myaioutfit.support.s3.S3ObjectStorageGateway;
import net.myaioutfit.support.s3.S3PublicUrlSupport;
import net.myaioutfit.support.s3.StorageObjectPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Storage manager for wardrobe images.
 *
 * Features:
 * - Idempotent bucket provisioning with a size ceiling and MIME allow-list recorded as bucket tags
 * - Policy enforcement on every upload
 * - Non-overwriting original uploads and overwriting processed uploads
 * - Network-free public URL derivation
 * - Best-effort cleanup of superseded objects
 */
@Service
public class WardrobeImageStorageService {

    private static final Logger logger = LoggerFactory.getLogger(WardrobeImageStorageService.class);

    static final String MAX_OBJECT_BYTES_TAG = "max-object-bytes";
    static final String ALLOWED_MIME_TYPES_TAG = "allowed-mime-types";

    private final S3ObjectStorageGateway gateway;
    private final S3PublicUrlSupport publicUrlSupport;
    private final ImagePipelineProperties properties;
    private final Clock clock;

    public WardrobeImageStorageService(S3ObjectStorageGateway gateway,
                                       S3PublicUrlSupport publicUrlSupport,
                                       ImagePipelineProperties properties,
                                       Clock clock) {
        this.gateway = gateway;
        this.publicUrlSupport = publicUrlSupport;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Guarantees the bucket exists and carries the configured size ceiling and MIME allow-list.
     * Safe to call on every pipeline run.
     */
    public void ensureBucket() {
        if (!gateway.bucketExists()) {
            logger.info("Storage bucket {} not found; creating it", gateway.bucketName());
            gateway.createBucket();
            gateway.putBucketTags(policyTags());
            return;
        }
        Map<String, String> tags = gateway.bucketTags();
        String recordedCeiling = tags.get(MAX_OBJECT_BYTES_TAG);
        if (!String.valueOf(properties.getMaxStorageBytes()).equals(recordedCeiling)
            || !Objects.equals(allowedMimeTypesTagValue(), tags.get(ALLOWED_MIME_TYPES_TAG))) {
            logger.info("Storage bucket {} policy is stale (max-object-bytes={}); updating",
                gateway.bucketName(), recordedCeiling);
            Map<String, String> merged = new LinkedHashMap<>(tags);
            merged.putAll(policyTags());
            gateway.putBucketTags(merged);
        }
    }

    /**
     * Writes {@code bytes} at exactly {@code path}.
     *
     * @param overwrite false for original uploads, where an existing object is a collision error
     */
    public StoredObject upload(String path, byte[] bytes, String contentType, boolean overwrite) {
        enforcePolicy(path, bytes, contentType);
        gateway.putObject(path, bytes, contentType, overwrite);
        return new StoredObject(path, publicUrl(path));
    }

    /**
     * Uploads an asset to the deterministic path for its purpose.
     */
    public StoredObject store(StoragePurpose purpose, String ownerId, UUID assetId, ImageFormat format, byte[] bytes) {
        String path = StorageObjectPaths.forPurpose(purpose, ownerId, assetId, clock.millis(), format);
        return upload(path, bytes, format.mimeType(), purpose.overwrite());
    }

    public String publicUrl(String path) {
        return publicUrlSupport.publicUrl(path);
    }

    /**
     * Best-effort delete. Failures are logged and never thrown.
     */
    public void remove(List<String> paths) {
        List<String> targets = paths == null ? List.of()
            : paths.stream().filter(Objects::nonNull).filter(path -> !path.isBlank()).distinct().toList();
        if (targets.isEmpty()) {
            return;
        }
        try {
            List<String> errors = gateway.deleteObjects(targets);
            for (String error : errors) {
                logger.warn("Failed to delete storage object {}", error);
            }
        } catch (ImagePipelineException exception) {
            logger.warn("Cleanup of {} failed: {}", targets, exception.getMessage());
        }
    }

    private void enforcePolicy(String path, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageStorageException("Refusing to store empty object at " + path, false);
        }
        if (bytes.length > properties.getMaxStorageBytes()) {
            throw new ImageStorageException("Object " + path + " is " + bytes.length
                + " bytes, over the bucket limit of " + properties.getMaxStorageBytes(), false);
        }
        String normalizedType = contentType == null ? "" : contentType.trim().toLowerCase(Locale.ROOT);
        if (!properties.getStorageMimeTypes().contains(normalizedType)) {
            throw new ImageStorageException("Content type " + contentType + " is not allowed in bucket "
                + gateway.bucketName(), false);
        }
    }

    private Map<String, String> policyTags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(MAX_OBJECT_BYTES_TAG, String.valueOf(properties.getMaxStorageBytes()));
        tags.put(ALLOWED_MIME_TYPES_TAG, allowedMimeTypesTagValue());
        return tags;
    }

    // Tag values may not contain commas
    private String allowedMimeTypesTagValue() {
        return String.join(" ", properties.getStorageMimeTypes());
    }
}
