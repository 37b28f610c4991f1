package net.myaioutfit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.springframework.boot.health.contributor.Status;
import reactor.test.StepVerifier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

class StorageBucketHealthIndicatorTest {

    private final ImagePipelineProperties properties = new ImagePipelineProperties();

    @Test
    void shouldReportDownWhenClientMissing() {
        StorageBucketHealthIndicator indicator = new StorageBucketHealthIndicator(null, properties);

        StepVerifier.create(indicator.health())
            .assertNext(health -> {
                assertEquals(Status.DOWN, health.getStatus());
                assertEquals("misconfigured_or_disabled", health.getDetails().get("storage_status"));
            })
            .verifyComplete();
    }

    @Test
    void shouldReportUpWhenBucketReachable() {
        S3Client s3Client = mock(S3Client.class);
        when(s3Client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());

        StepVerifier.create(new StorageBucketHealthIndicator(s3Client, properties).health())
            .assertNext(health -> {
                assertEquals(Status.UP, health.getStatus());
                assertEquals("wardrobe-images", health.getDetails().get("bucket"));
            })
            .verifyComplete();
    }

    @Test
    void shouldReportBucketMissingWhenHeadBucketReturns404() {
        S3Client s3Client = mock(S3Client.class);
        S3Exception notFound = (S3Exception) S3Exception.builder()
            .statusCode(404)
            .awsErrorDetails(AwsErrorDetails.builder()
                .errorCode("NoSuchBucket")
                .errorMessage("The specified bucket does not exist")
                .build())
            .build();
        when(s3Client.headBucket(any(HeadBucketRequest.class))).thenThrow(notFound);

        StepVerifier.create(new StorageBucketHealthIndicator(s3Client, properties).health())
            .assertNext(health -> {
                assertEquals(Status.DOWN, health.getStatus());
                assertEquals("bucket_missing", health.getDetails().get("storage_status"));
            })
            .verifyComplete();
    }
}
