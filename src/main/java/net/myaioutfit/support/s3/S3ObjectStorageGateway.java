package net.myaioutfit.support.s3;

import jakarta.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.exception.ImageStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyExistsException;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

/**
 * Infrastructure adapter for the wardrobe image bucket.
 *
 * <p>All direct AWS SDK usage lives here; SDK failures surface as {@link ImageStorageException}
 * so the storage service and orchestrator never see SDK types.</p>
 */
@Component
public class S3ObjectStorageGateway {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageGateway.class);
    private static final String NO_SUCH_TAG_SET = "NoSuchTagSet";
    private static final int PRECONDITION_FAILED = 412;

    private final S3Client s3Client;
    private final String bucketName;

    public S3ObjectStorageGateway(@Nullable S3Client s3Client, ImagePipelineProperties properties) {
        this.s3Client = s3Client;
        this.bucketName = properties.getBucketName();
    }

    public boolean isAvailable() {
        return s3Client != null;
    }

    public String bucketName() {
        return bucketName;
    }

    /**
     * @return false when the bucket does not exist
     */
    public boolean bucketExists() {
        S3Client client = requireClient("head-bucket", bucketName);
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            return true;
        } catch (NoSuchBucketException exception) {
            return false;
        } catch (S3Exception exception) {
            if (exception.statusCode() == 404) {
                return false;
            }
            throw new ImageStorageException("S3 error checking bucket " + bucketName + ": "
                + resolveS3ErrorMessage(exception), true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error checking bucket " + bucketName + ": "
                + exception.getMessage(), true, exception);
        }
    }

    /**
     * Creates the bucket. A concurrent creator winning the race counts as success.
     *
     * @return true when this call created the bucket
     */
    public boolean createBucket() {
        S3Client client = requireClient("create-bucket", bucketName);
        try {
            CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucketName);
            var clientConfiguration = client.serviceClientConfiguration();
            Region region = clientConfiguration != null ? clientConfiguration.region() : null;
            if (region != null && !Region.US_EAST_1.equals(region) && !Region.AWS_GLOBAL.equals(region)) {
                request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region.id())
                    .build());
            }
            client.createBucket(request.build());
            logger.info("Created storage bucket {}", bucketName);
            return true;
        } catch (BucketAlreadyOwnedByYouException | BucketAlreadyExistsException exception) {
            logger.info("Storage bucket {} was created concurrently; continuing", bucketName);
            return false;
        } catch (S3Exception exception) {
            String message = resolveS3ErrorMessage(exception);
            if (message != null && message.toLowerCase(Locale.ROOT).contains("already exists")) {
                logger.info("Storage bucket {} already exists; continuing", bucketName);
                return false;
            }
            throw new ImageStorageException("S3 error creating bucket " + bucketName + ": " + message, true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error creating bucket " + bucketName + ": "
                + exception.getMessage(), true, exception);
        }
    }

    /**
     * Reads bucket tags; an untagged bucket yields an empty map.
     */
    public Map<String, String> bucketTags() {
        S3Client client = requireClient("get-bucket-tagging", bucketName);
        try {
            Map<String, String> tags = new LinkedHashMap<>();
            for (Tag tag : client.getBucketTagging(GetBucketTaggingRequest.builder().bucket(bucketName).build()).tagSet()) {
                tags.put(tag.key(), tag.value());
            }
            return tags;
        } catch (S3Exception exception) {
            if (exception.awsErrorDetails() != null
                && NO_SUCH_TAG_SET.equals(exception.awsErrorDetails().errorCode())) {
                return Map.of();
            }
            throw new ImageStorageException("S3 error reading tags of bucket " + bucketName + ": "
                + resolveS3ErrorMessage(exception), true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error reading tags of bucket " + bucketName + ": "
                + exception.getMessage(), true, exception);
        }
    }

    /**
     * Replaces the bucket's tag set.
     */
    public void putBucketTags(Map<String, String> tags) {
        S3Client client = requireClient("put-bucket-tagging", bucketName);
        List<Tag> tagSet = tags.entrySet().stream()
            .map(entry -> Tag.builder().key(entry.getKey()).value(entry.getValue()).build())
            .toList();
        try {
            client.putBucketTagging(PutBucketTaggingRequest.builder()
                .bucket(bucketName)
                .tagging(Tagging.builder().tagSet(tagSet).build())
                .build());
            logger.info("Updated storage policy tags on bucket {}: {}", bucketName, tags);
        } catch (S3Exception exception) {
            throw new ImageStorageException("S3 error tagging bucket " + bucketName + ": "
                + resolveS3ErrorMessage(exception), true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error tagging bucket " + bucketName + ": "
                + exception.getMessage(), true, exception);
        }
    }

    /**
     * Writes a public-read object. With {@code overwrite=false} the write is conditional on the key
     * being absent and a collision fails.
     */
    public void putObject(String key, byte[] bytes, String contentType, boolean overwrite) {
        S3Client client = requireClient("upload", key);
        PutObjectRequest.Builder request = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentType(contentType)
            .contentLength((long) bytes.length)
            .acl(ObjectCannedACL.PUBLIC_READ);
        if (!overwrite) {
            request.ifNoneMatch("*");
        }
        try {
            client.putObject(request.build(), RequestBody.fromBytes(bytes));
            logger.info("Uploaded {} ({} bytes, {}) to bucket {}", key, bytes.length, contentType, bucketName);
        } catch (S3Exception exception) {
            if (exception.statusCode() == PRECONDITION_FAILED) {
                throw new ImageStorageException("Object already exists at " + key, false, exception);
            }
            throw new ImageStorageException("S3 error uploading " + key + ": "
                + resolveS3ErrorMessage(exception), true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error uploading " + key + ": "
                + exception.getMessage(), true, exception);
        }
    }

    /**
     * Deletes keys in one batch.
     *
     * @return per-key error descriptions; empty when every key was removed
     */
    public List<String> deleteObjects(List<String> keys) {
        S3Client client = requireClient("delete", String.join(",", keys));
        List<ObjectIdentifier> identifiers = keys.stream()
            .map(key -> ObjectIdentifier.builder().key(key).build())
            .toList();
        try {
            DeleteObjectsResponse response = client.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucketName)
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build());
            List<String> errors = response.hasErrors()
                ? response.errors().stream().map(S3ObjectStorageGateway::describe).toList()
                : List.of();
            if (errors.isEmpty()) {
                logger.info("Deleted {} object(s) from bucket {}: {}", keys.size(), bucketName, keys);
            }
            return errors;
        } catch (S3Exception exception) {
            throw new ImageStorageException("S3 error deleting " + keys + ": "
                + resolveS3ErrorMessage(exception), true, exception);
        } catch (SdkClientException exception) {
            throw new ImageStorageException("Unexpected error deleting " + keys + ": "
                + exception.getMessage(), true, exception);
        }
    }

    private S3Client requireClient(String operation, String keyName) {
        if (s3Client == null) {
            throw new ImageStorageException("S3 client is not configured for " + operation
                + " operation (key: " + keyName + ")", false);
        }
        return s3Client;
    }

    private static String describe(S3Error error) {
        return error.key() + ": " + error.code() + " " + error.message();
    }

    private static String resolveS3ErrorMessage(S3Exception exception) {
        if (exception.awsErrorDetails() != null && exception.awsErrorDetails().errorMessage() != null) {
            return exception.awsErrorDetails().errorMessage();
        }
        return exception.getMessage();
    }
}
