package net.myaioutfit.service.ai;

import java.time.Duration;
import java.util.Map;
import net.myaioutfit.config.ImagePipelineProperties;
import net.myaioutfit.config.ReplicateProperties;
import net.myaioutfit.exception.BackgroundRemovalException;
import net.myaioutfit.support.retry.BackoffSleeper;
import net.myaioutfit.support.retry.BoundedRetrySupport;
import net.myaioutfit.support.retry.BoundedRetrySupport.RetryConfig;
import net.myaioutfit.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Removes image backgrounds with a Replicate-hosted model.
 *
 * <p>The model version is resolved on every call: an explicit {@code owner/name:version},
 * then the configured version, then the model's {@code latest_version}. The prediction is
 * submitted with {@code Prefer: wait} so the service answers once the job finishes.
 * The whole call is retried with linear backoff.</p>
 */
@Service
public class ReplicateBackgroundRemovalClient implements BackgroundRemovalClient {

    private static final Logger log = LoggerFactory.getLogger(ReplicateBackgroundRemovalClient.class);
    private static final String API_NAME = "REPLICATE-BG-REMOVAL";

    private final ReplicateApiSupport api;
    private final ReplicateProperties properties;
    private final RetryConfig retryConfig;

    ReplicateBackgroundRemovalClient(ReplicateApiSupport api,
                                     ReplicateProperties properties,
                                     ImagePipelineProperties pipelineProperties,
                                     BackoffSleeper sleeper) {
        this.api = api;
        this.properties = properties;
        this.retryConfig = new RetryConfig(log,
            pipelineProperties.getMaxBgRemovalAttempts(),
            pipelineProperties.getBgRemovalRetryDelay(),
            sleeper);
    }

    @Override
    public String removeBackground(String imageUrl) {
        return BoundedRetrySupport.execute(retryConfig, "Background removal",
            ex -> ex instanceof BackgroundRemovalException removal && removal.isRetryable(),
            () -> removeOnce(imageUrl));
    }

    private String removeOnce(String imageUrl) {
        if (!api.hasApiToken()) {
            throw new BackgroundRemovalException("Replicate API token is not configured", false);
        }
        String version = resolveVersion();
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "predict", properties.getBgModel(), 1, 1);
        long started = System.nanoTime();

        ReplicateResponse response;
        try {
            response = api.post("/predictions",
                Map.of("version", version, "input", Map.of("image", imageUrl)),
                properties.getSubmitTimeout(),
                true);
        } catch (ReplicateCallException ex) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "predict", properties.getBgModel(), ex.getMessage());
            throw new BackgroundRemovalException("Background removal request failed: " + ex.getMessage(), ex);
        }
        if (!response.isSuccessful()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "predict", properties.getBgModel(), response.errorDetail());
            throw new BackgroundRemovalException("Background removal request failed: " + response.errorDetail());
        }

        ReplicatePrediction prediction = ReplicatePrediction.fromJson(response.body());
        if (ReplicatePrediction.SUCCEEDED.equals(prediction.status()) && prediction.outputUrl() != null) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "predict", properties.getBgModel(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
            return prediction.outputUrl();
        }
        if (ReplicatePrediction.FAILED.equals(prediction.status())) {
            String error = prediction.error() != null ? prediction.error() : "no error message";
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "predict", properties.getBgModel(), error);
            throw new BackgroundRemovalException("Background removal failed: " + error);
        }
        ExternalApiLogger.logApiCallFailure(log, API_NAME, "predict", properties.getBgModel(),
            "status " + prediction.status());
        throw new BackgroundRemovalException("Unexpected background removal status: " + prediction.status());
    }

    /**
     * Version to run: {@code owner/name:version}, else the configured version, else the registry's latest.
     */
    String resolveVersion() {
        String model = properties.getBgModel();
        if (!StringUtils.hasText(model)) {
            throw new BackgroundRemovalException("Background removal model is not configured", false);
        }
        int separator = model.indexOf(':');
        if (separator > 0 && separator < model.length() - 1) {
            return model.substring(separator + 1).trim();
        }
        if (StringUtils.hasText(properties.getBgVersion())) {
            return properties.getBgVersion().trim();
        }
        String modelPath = separator > 0 ? model.substring(0, separator) : model;
        return lookupLatestVersion(modelPath.trim());
    }

    private String lookupLatestVersion(String modelPath) {
        ReplicateResponse response;
        try {
            response = api.get("/models/" + modelPath, properties.getModelLookupTimeout());
        } catch (ReplicateCallException ex) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "model-lookup", modelPath, ex.getMessage());
            throw new BackgroundRemovalException("Failed to resolve model version: " + ex.getMessage(), ex);
        }
        if (!response.isSuccessful()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "model-lookup", modelPath, response.errorDetail());
            throw new BackgroundRemovalException("Failed to resolve model version: " + response.errorDetail());
        }
        JsonNode body = response.body();
        JsonNode latest = body != null ? body.get("latest_version") : null;
        JsonNode id = latest != null ? latest.get("id") : null;
        if (id == null || !id.isString() || id.asString().isBlank()) {
            throw new BackgroundRemovalException("Model " + modelPath + " has no latest version");
        }
        return id.asString();
    }
}
