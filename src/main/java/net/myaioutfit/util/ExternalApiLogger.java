package net.myaioutfit.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to Replicate, the identity endpoint and image downloads.
 *
 * Lines share the {@code [EXTERNAL-API]} prefix so a single grep shows every outbound call
 * a pipeline run made.
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String target, int attempt, int maxAttempts) {
        String message = String.format("%s [%s] ATTEMPT %d/%d: %s target='%s'",
            PREFIX, apiName, attempt, maxAttempts, operation, target);
        log.info(message);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String target, long elapsedMillis) {
        String message = String.format("%s [%s] SUCCESS: %s target='%s' in %dms",
            PREFIX, apiName, operation, target, elapsedMillis);
        log.info(message);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String target, String reason) {
        String message = String.format("%s [%s] FAILURE: %s failed for target='%s' - %s",
            PREFIX, apiName, operation, target, reason);
        log.warn(message);
    }

    /**
     * Log a rate-limit pause before the next attempt
     */
    public static void logRateLimited(Logger log, String apiName, String target, long waitMillis) {
        String message = String.format("%s [%s] RATE-LIMITED: target='%s', waiting %dms",
            PREFIX, apiName, target, waitMillis);
        log.warn(message);
    }

    /**
     * Log prediction polling progress
     */
    public static void logPollProgress(Logger log, String apiName, String predictionId, String status, int pollCount) {
        String message = String.format("%s [%s] POLL #%d: prediction='%s' status=%s",
            PREFIX, apiName, pollCount, predictionId, status);
        log.debug(message);
    }
}
