package net.myaioutfit.service.ai;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.myaioutfit.config.ReplicateProperties;
import net.myaioutfit.exception.GenerationException;
import net.myaioutfit.support.retry.BackoffSleeper;
import net.myaioutfit.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Generates wardrobe images with Imagen models hosted on Replicate.
 *
 * <p>Candidates are tried in order: the pinned model version when configured, then each fallback
 * model alias. Each candidate gets a bounded number of submission attempts:</p>
 * <ul>
 *   <li>429: wait for the advertised retry-after (header, then body, then default; capped) and retry</li>
 *   <li>404 / 422: the model or input is rejected, move to the next candidate at once</li>
 *   <li>other failures: retry after a linear pause, then move on</li>
 * </ul>
 * <p>The first accepted submission is polled until it reaches a terminal state or the poll
 * deadline passes. Failures after submission are final; other candidates are not tried.</p>
 */
@Service
public class ReplicateImageGenerationClient implements ImageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ReplicateImageGenerationClient.class);
    private static final String API_NAME = "REPLICATE-GENERATE";
    private static final String RETRY_AFTER_BODY_FIELD = "retry_after";

    private final ReplicateApiSupport api;
    private final ReplicateProperties properties;
    private final Clock clock;
    private final BackoffSleeper sleeper;

    ReplicateImageGenerationClient(ReplicateApiSupport api,
                                   ReplicateProperties properties,
                                   Clock clock,
                                   BackoffSleeper sleeper) {
        this.api = api;
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public GeneratedImage generate(String prompt) {
        if (!api.hasApiToken()) {
            throw new GenerationException("Replicate API token is not configured", false);
        }
        Instant startedAt = clock.instant();
        List<Candidate> candidates = candidates(prompt);
        if (candidates.isEmpty()) {
            throw new GenerationException("No image generation model is configured", false);
        }

        String lastFailure = null;
        boolean lastFailureRetryable = false;
        for (Candidate candidate : candidates) {
            Submission submission = submit(candidate);
            if (submission.prediction() != null) {
                Instant deadline = clock.instant().plus(properties.getPollCeiling());
                String imageUrl = awaitOutput(submission.prediction(), deadline);
                Duration elapsed = Duration.between(startedAt, clock.instant());
                log.info("Generated image with {} in {}ms", candidate.label(), elapsed.toMillis());
                return new GeneratedImage(imageUrl, elapsed);
            }
            lastFailure = candidate.label() + ": " + submission.failure();
            lastFailureRetryable = submission.retryable();
            log.warn("Generation candidate {} failed ({}); trying next candidate", candidate.label(), submission.failure());
        }
        throw new GenerationException("Image generation failed on all models. Last error: " + lastFailure,
            lastFailureRetryable);
    }

    private Submission submit(Candidate candidate) {
        int maxAttempts = Math.max(1, properties.getMaxSubmitAttempts());
        String failure = "not attempted";
        boolean retryable = false;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ExternalApiLogger.logApiCallAttempt(log, API_NAME, "submit", candidate.label(), attempt, maxAttempts);
            long started = System.nanoTime();
            ReplicateResponse response;
            try {
                response = api.post(candidate.path(), candidate.body(), properties.getSubmitTimeout(), false);
            } catch (ReplicateCallException ex) {
                failure = ex.getMessage();
                retryable = true;
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "submit", candidate.label(), failure);
                pauseBeforeRetry(attempt, maxAttempts);
                continue;
            }

            if (response.isSuccessful()) {
                ExternalApiLogger.logApiCallSuccess(log, API_NAME, "submit", candidate.label(),
                    Duration.ofNanos(System.nanoTime() - started).toMillis());
                return new Submission(ReplicatePrediction.fromJson(response.body()), null, false);
            }

            int status = response.statusCode();
            failure = response.errorDetail();
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "submit", candidate.label(), failure);
            if (status == 404 || status == 422) {
                return new Submission(null, failure, false);
            }
            retryable = true;
            if (status == 429) {
                if (attempt < maxAttempts) {
                    Duration wait = retryAfter(response);
                    ExternalApiLogger.logRateLimited(log, API_NAME, candidate.label(), wait.toMillis());
                    sleeper.sleep(wait);
                }
                continue;
            }
            pauseBeforeRetry(attempt, maxAttempts);
        }
        return new Submission(null, failure, retryable);
    }

    private void pauseBeforeRetry(int attempt, int maxAttempts) {
        if (attempt < maxAttempts) {
            sleeper.sleep(properties.getSubmitRetryDelay().multipliedBy(attempt));
        }
    }

    /**
     * Polls {@code submitted} until it is terminal or {@code deadline} passes, then extracts its output.
     */
    String awaitOutput(ReplicatePrediction submitted, Instant deadline) {
        ReplicatePrediction current = submitted;
        int polls = 0;
        while (!current.isTerminal()) {
            if (!StringUtils.hasText(current.pollUrl())) {
                throw new GenerationException("Prediction " + current.id() + " is '" + current.status()
                    + "' but returned no poll URL", false);
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new GenerationException("Image generation timed out after "
                    + properties.getPollCeiling().toSeconds() + "s", true);
            }
            sleeper.sleep(properties.getPollInterval());
            current = poll(current);
            polls++;
            ExternalApiLogger.logPollProgress(log, API_NAME, current.id(), current.status(), polls);
        }
        return outputOf(current);
    }

    private ReplicatePrediction poll(ReplicatePrediction current) {
        ReplicateResponse response;
        try {
            response = api.get(current.pollUrl(), properties.getPollRequestTimeout());
        } catch (ReplicateCallException ex) {
            throw new GenerationException("Polling prediction " + current.id() + " failed: " + ex.getMessage(), true, ex);
        }
        if (!response.isSuccessful()) {
            throw new GenerationException("Polling prediction " + current.id() + " failed: " + response.errorDetail(),
                response.statusCode() >= 500 || response.statusCode() == 429);
        }
        return ReplicatePrediction.fromJson(response.body());
    }

    private String outputOf(ReplicatePrediction prediction) {
        switch (prediction.status()) {
            case ReplicatePrediction.SUCCEEDED:
                if (prediction.outputUrl() == null) {
                    throw new GenerationException("Generation succeeded but returned no output", false);
                }
                return prediction.outputUrl();
            case ReplicatePrediction.FAILED:
            case ReplicatePrediction.CANCELED:
                throw new GenerationException("Generation " + prediction.status() + ": "
                    + (prediction.error() != null ? prediction.error() : "no error message"), false);
            default:
                throw new GenerationException("Unexpected prediction status: " + prediction.status(), false);
        }
    }

    /**
     * Retry-after hint for a 429: {@code Retry-After} header, then the body's {@code retry_after},
     * then the configured default; never longer than the configured cap.
     */
    Duration retryAfter(ReplicateResponse response) {
        Duration wait = headerRetryAfter(response.headers());
        if (wait == null) {
            wait = bodyRetryAfter(response.body());
        }
        if (wait == null) {
            wait = properties.getDefaultRetryAfter();
        }
        return wait.compareTo(properties.getMaxRetryAfter()) > 0 ? properties.getMaxRetryAfter() : wait;
    }

    @Nullable
    private static Duration headerRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ex) {
            // HTTP-date form is not used by Replicate
            return null;
        }
    }

    @Nullable
    private static Duration bodyRetryAfter(@Nullable JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode node = body.get(RETRY_AFTER_BODY_FIELD);
        if (node == null || !node.isNumber()) {
            return null;
        }
        double seconds = node.asDouble();
        return seconds > 0 ? Duration.ofMillis(Math.round(seconds * 1000)) : null;
    }

    private List<Candidate> candidates(String prompt) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("prompt", prompt);
        input.put("aspect_ratio", properties.getAspectRatio());

        List<Candidate> candidates = new ArrayList<>();
        if (StringUtils.hasText(properties.getImagenVersion())) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("version", properties.getImagenVersion());
            body.put("input", input);
            candidates.add(new Candidate("version " + properties.getImagenVersion(), "/predictions", body));
        }
        for (String model : properties.getFallbackModels()) {
            if (StringUtils.hasText(model)) {
                candidates.add(new Candidate(model, "/models/" + model.trim() + "/predictions", Map.of("input", input)));
            }
        }
        return candidates;
    }

    private record Candidate(String label, String path, Map<String, Object> body) {
    }

    private record Submission(@Nullable ReplicatePrediction prediction, @Nullable String failure, boolean retryable) {
    }
}
