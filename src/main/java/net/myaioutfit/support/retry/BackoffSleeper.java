package net.myaioutfit.support.retry;

import java.time.Duration;

/**
 * Blocking pause between retry attempts and poll requests.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = duration -> {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", interruptedException);
        }
    };

    void sleep(Duration duration);
}
