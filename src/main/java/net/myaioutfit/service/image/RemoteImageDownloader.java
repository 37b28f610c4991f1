package net.myaioutfit.service.image;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import net.myaioutfit.config.ReplicateProperties;
import net.myaioutfit.exception.BackgroundRemovalException;
import net.myaioutfit.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Downloads background-removed results from the URL the removal model returned.
 */
@Component
public class RemoteImageDownloader {

    private static final Logger log = LoggerFactory.getLogger(RemoteImageDownloader.class);
    private static final String API_NAME = "IMAGE-DOWNLOAD";

    private final WebClient webClient;
    private final Duration downloadTimeout;

    public RemoteImageDownloader(WebClient.Builder webClientBuilder, ReplicateProperties replicateProperties) {
        this.webClient = webClientBuilder.build();
        this.downloadTimeout = replicateProperties.getDownloadTimeout();
    }

    /**
     * Fetches {@code imageUrl}, blocking up to the configured download timeout.
     * The body is read as raw bytes and the declared content type is reported without being parsed.
     *
     * @throws BackgroundRemovalException when the request fails, times out or returns an empty body
     */
    public DownloadedImage download(String imageUrl) {
        long startedAt = System.nanoTime();
        DownloadedImage downloaded;
        try {
            downloaded = webClient.get()
                .uri(imageUrl)
                .exchangeToMono(this::readImage)
                .timeout(downloadTimeout)
                .block();
        } catch (BackgroundRemovalException ex) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", imageUrl, ex.getMessage());
            throw ex;
        } catch (WebClientRequestException ex) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", imageUrl, ex.getMessage());
            throw new BackgroundRemovalException("Failed to download processed image: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            if (ex.getCause() instanceof TimeoutException) {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", imageUrl, "timed out after " + downloadTimeout);
                throw new BackgroundRemovalException("Timed out downloading processed image", ex);
            }
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", imageUrl, ex.getMessage());
            throw new BackgroundRemovalException("Failed to download processed image: " + ex.getMessage(), ex);
        }
        if (downloaded == null || downloaded.bytes().length == 0) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "GET", imageUrl, "empty body");
            throw new BackgroundRemovalException("Processed image download returned no content");
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "GET", imageUrl, elapsedMillis(startedAt));
        return downloaded;
    }

    private Mono<DownloadedImage> readImage(ClientResponse response) {
        int status = response.statusCode().value();
        if (response.statusCode().isError()) {
            boolean retryable = status == 429 || response.statusCode().is5xxServerError();
            return response.releaseBody().then(Mono.error(
                new BackgroundRemovalException("Failed to download processed image: HTTP " + status, retryable)));
        }
        String contentType = bareContentType(response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
        return DataBufferUtils.join(response.body(BodyExtractors.toDataBuffers()))
            .map(buffer -> {
                try {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    return new DownloadedImage(bytes, contentType);
                } finally {
                    DataBufferUtils.release(buffer);
                }
            })
            .defaultIfEmpty(new DownloadedImage(new byte[0], contentType));
    }

    @Nullable
    static String bareContentType(@Nullable String headerValue) {
        if (headerValue == null) {
            return null;
        }
        String bare = headerValue.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return bare.isEmpty() ? null : bare;
    }

    private static long elapsedMillis(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos).toMillis();
    }
}
