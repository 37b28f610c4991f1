package net.myaioutfit.config;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Reports whether the wardrobe image bucket is reachable.
 */
@Component("wardrobeBucketHealthIndicator")
public class StorageBucketHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration S3_TIMEOUT = Duration.ofSeconds(5);

    private final S3Client s3Client;
    private final String bucketName;

    public StorageBucketHealthIndicator(@Nullable S3Client s3Client, ImagePipelineProperties properties) {
        this.s3Client = s3Client;
        this.bucketName = properties.getBucketName();
    }

    @Override
    public Mono<Health> health() {
        if (s3Client == null) {
            return Mono.just(Health.down()
                    .withDetail("storage_status", "misconfigured_or_disabled")
                    .withDetail("detail", "S3Client bean is not available, check s3.* credentials.")
                    .build());
        }

        if (bucketName == null || bucketName.isBlank()) {
            return Mono.just(Health.down()
                    .withDetail("storage_status", "misconfigured")
                    .withDetail("detail", "image-pipeline.bucket-name is not configured.")
                    .build());
        }

        HeadBucketRequest headBucketRequest = HeadBucketRequest.builder()
                .bucket(bucketName)
                .build();

        return Mono.fromCallable(() -> {
                    s3Client.headBucket(headBucketRequest);
                    return Health.up()
                            .withDetail("storage_status", "available")
                            .withDetail("bucket", bucketName)
                            .build();
                })
                .timeout(S3_TIMEOUT)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(S3Exception.class, ex -> {
                    var details = ex.awsErrorDetails();
                    String error = (details != null)
                            ? details.errorCode() + ": " + details.errorMessage()
                            : ex.getMessage();
                    return Mono.just(Health.down()
                            .withDetail("storage_status", ex.statusCode() == 404 ? "bucket_missing" : "s3_error")
                            .withDetail("bucket", bucketName)
                            .withDetail("error", error)
                            .build());
                })
                .onErrorResume(TimeoutException.class, ex -> Mono.just(Health.down()
                        .withDetail("storage_status", "timeout")
                        .withDetail("bucket", bucketName)
                        .build()))
                .onErrorResume(SdkClientException.class, ex -> Mono.just(Health.down()
                        .withDetail("storage_status", "sdk_client_error")
                        .withDetail("bucket", bucketName)
                        .withDetail("message", ex.getMessage())
                        .build()));
    }
}
