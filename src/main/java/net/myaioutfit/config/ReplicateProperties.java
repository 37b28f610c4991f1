package net.myaioutfit.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the Replicate prediction API used for generation and background removal.
 */
@ConfigurationProperties(prefix = "replicate")
public class ReplicateProperties {

    private String apiToken;
    private String baseUrl = "https://api.replicate.com/v1";
    private String imagenVersion;
    private List<String> fallbackModels = new ArrayList<>(List.of("google/imagen-4", "google-deepmind/imagen-4"));
    private String aspectRatio = "1:1";
    private String bgModel = "851-labs/background-remover";
    private String bgVersion;
    private int maxSubmitAttempts = 3;
    private Duration defaultRetryAfter = Duration.ofSeconds(10);
    private Duration maxRetryAfter = Duration.ofSeconds(30);
    private Duration submitRetryDelay = Duration.ofSeconds(1);
    private Duration submitTimeout = Duration.ofSeconds(60);
    private Duration modelLookupTimeout = Duration.ofSeconds(20);
    private Duration pollInterval = Duration.ofMillis(1500);
    private Duration pollRequestTimeout = Duration.ofSeconds(30);
    private Duration pollCeiling = Duration.ofSeconds(120);
    private Duration downloadTimeout = Duration.ofSeconds(30);

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Optional pinned generation model version, tried before any fallback model alias.
     */
    public String getImagenVersion() {
        return imagenVersion;
    }

    public void setImagenVersion(String imagenVersion) {
        this.imagenVersion = imagenVersion;
    }

    /**
     * Model aliases ({@code owner/name}) tried in order after the pinned version.
     */
    public List<String> getFallbackModels() {
        return fallbackModels;
    }

    public void setFallbackModels(List<String> fallbackModels) {
        this.fallbackModels = fallbackModels;
    }

    public String getAspectRatio() {
        return aspectRatio;
    }

    public void setAspectRatio(String aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    /**
     * Background-removal model, either {@code owner/name} or {@code owner/name:version}.
     */
    public String getBgModel() {
        return bgModel;
    }

    public void setBgModel(String bgModel) {
        this.bgModel = bgModel;
    }

    public String getBgVersion() {
        return bgVersion;
    }

    public void setBgVersion(String bgVersion) {
        this.bgVersion = bgVersion;
    }

    public int getMaxSubmitAttempts() {
        return maxSubmitAttempts;
    }

    public void setMaxSubmitAttempts(int maxSubmitAttempts) {
        this.maxSubmitAttempts = maxSubmitAttempts;
    }

    public Duration getDefaultRetryAfter() {
        return defaultRetryAfter;
    }

    public void setDefaultRetryAfter(Duration defaultRetryAfter) {
        this.defaultRetryAfter = defaultRetryAfter;
    }

    public Duration getMaxRetryAfter() {
        return maxRetryAfter;
    }

    public void setMaxRetryAfter(Duration maxRetryAfter) {
        this.maxRetryAfter = maxRetryAfter;
    }

    public Duration getSubmitRetryDelay() {
        return submitRetryDelay;
    }

    public void setSubmitRetryDelay(Duration submitRetryDelay) {
        this.submitRetryDelay = submitRetryDelay;
    }

    public Duration getSubmitTimeout() {
        return submitTimeout;
    }

    public void setSubmitTimeout(Duration submitTimeout) {
        this.submitTimeout = submitTimeout;
    }

    public Duration getModelLookupTimeout() {
        return modelLookupTimeout;
    }

    public void setModelLookupTimeout(Duration modelLookupTimeout) {
        this.modelLookupTimeout = modelLookupTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getPollRequestTimeout() {
        return pollRequestTimeout;
    }

    public void setPollRequestTimeout(Duration pollRequestTimeout) {
        this.pollRequestTimeout = pollRequestTimeout;
    }

    /**
     * Overall deadline for a generation job to reach a terminal state.
     */
    public Duration getPollCeiling() {
        return pollCeiling;
    }

    public void setPollCeiling(Duration pollCeiling) {
        this.pollCeiling = pollCeiling;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }
}
