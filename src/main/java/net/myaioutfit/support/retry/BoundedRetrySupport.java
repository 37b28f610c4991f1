package net.myaioutfit.support.retry;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Executes an operation with bounded retry and linear backoff.
 */
public final class BoundedRetrySupport {

    /**
     * Bundles the retry parameters that are constant per call site:
     * the logger, maximum attempts, base backoff interval and the sleeper used between attempts.
     */
    public record RetryConfig(Logger logger, int maxAttempts, Duration baseBackoff, BackoffSleeper sleeper) {

        public RetryConfig(Logger logger, int maxAttempts, Duration baseBackoff) {
            this(logger, maxAttempts, baseBackoff, BackoffSleeper.THREAD_SLEEP);
        }
    }

    private BoundedRetrySupport() {
    }

    /**
     * Executes the action, retrying runtime exceptions accepted by {@code retryOn}.
     *
     * <p>Other runtime exceptions propagate immediately. Attempt {@code n} is followed by a pause of
     * {@code baseBackoff * n}. After the last attempt the last exception is rethrown.</p>
     */
    public static <T> T execute(RetryConfig config,
                                String operationLabel,
                                Predicate<RuntimeException> retryOn,
                                Supplier<T> action) {
        int maxAttempts = config.maxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 for operation '" + operationLabel + "' but was " + maxAttempts
            );
        }
        RuntimeException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException exception) {
                if (!retryOn.test(exception)) {
                    throw exception;
                }
                lastException = exception;
                if (attempt < maxAttempts) {
                    Duration backoff = config.baseBackoff().multipliedBy(attempt);
                    config.logger().warn(
                        "{} failed (attempt {}/{}): {}. Retrying in {}ms",
                        operationLabel,
                        attempt,
                        maxAttempts,
                        exception.getMessage(),
                        backoff.toMillis()
                    );
                    config.sleeper().sleep(backoff);
                } else {
                    config.logger().warn("{} failed (attempt {}/{}): {}. Giving up",
                        operationLabel, attempt, maxAttempts, exception.getMessage());
                }
            }
        }
        throw lastException;
    }
}
