/**
 * Configuration for the S3-compatible client used for wardrobe image storage
 *
 * Features:
 * - Creates S3Client bean only when storage credentials are present
 * - Supports custom endpoints (MinIO, Supabase S3 gateway) with optional path-style access
 * - Bounds every storage call with an API call timeout
 */
package net.myaioutfit.config;

import java.net.URI;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}")
    private String accessKeyId;

    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}")
    private String secretAccessKey;

    @Value("${s3.server-url:${S3_SERVER_URL:}}")
    private String s3ServerUrl;

    @Value("${s3.region:${AWS_REGION:us-west-2}}")
    private String s3Region;

    @Value("${s3.path-style-access:false}")
    private boolean pathStyleAccess;

    @Value("${s3.api-call-timeout:20s}")
    private Duration apiCallTimeout;

    /**
     * Creates the S3Client used by the storage gateway.
     *
     * @return configured S3Client instance
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        if (!hasText(accessKeyId) || !hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Ensure s3.access-key-id and s3.secret-access-key are configured.");
        }

        try {
            var builder = S3Client.builder()
                    .region(Region.of(s3Region))
                    .forcePathStyle(pathStyleAccess)
                    .overrideConfiguration(ClientOverrideConfiguration.builder()
                            .apiCallTimeout(apiCallTimeout)
                            .build())
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
            if (hasText(s3ServerUrl)) {
                builder.endpointOverride(URI.create(s3ServerUrl));
                logger.info("Configuring S3Client with custom endpoint {} (region {}, pathStyle={})",
                        s3ServerUrl, s3Region, pathStyleAccess);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", s3Region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
