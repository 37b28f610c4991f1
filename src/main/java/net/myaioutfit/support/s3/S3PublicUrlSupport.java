package net.myaioutfit.support.s3;

import java.util.Objects;
import net.myaioutfit.config.ImagePipelineProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Derives public object URLs without touching the network.
 *
 * <p>Resolution order: public CDN base, then {@code {server-url}/{bucket}}, then the AWS
 * virtual-hosted bucket URL.</p>
 */
@Component
public class S3PublicUrlSupport {

    private final String publicCdnUrl;
    private final String serverUrl;
    private final String bucketName;

    public S3PublicUrlSupport(@Value("${s3.public-cdn-url:${S3_PUBLIC_CDN_URL:}}") String publicCdnUrl,
                              @Value("${s3.server-url:${S3_SERVER_URL:}}") String serverUrl,
                              ImagePipelineProperties properties) {
        this.publicCdnUrl = publicCdnUrl;
        this.serverUrl = serverUrl;
        this.bucketName = properties.getBucketName();
    }

    public String publicUrl(String objectPath) {
        String normalizedKey = normalizePathSegment(objectPath);

        if (hasText(publicCdnUrl)) {
            return joinPath(normalizeBaseUrl(publicCdnUrl), normalizedKey);
        }
        if (hasText(serverUrl)) {
            return joinPath(joinPath(normalizeBaseUrl(serverUrl), bucketName), normalizedKey);
        }
        return "https://" + bucketName + ".s3.amazonaws.com/" + normalizedKey;
    }

    private static String normalizeBaseUrl(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String normalizePathSegment(String value) {
        String trimmed = Objects.requireNonNullElse(value, "").trim();
        if (trimmed.startsWith("/")) {
            return trimmed.substring(1);
        }
        return trimmed;
    }

    private static String joinPath(String base, String suffix) {
        if (!hasText(base)) {
            return suffix;
        }
        if (base.endsWith("/")) {
            return base + suffix;
        }
        return base + "/" + suffix;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
