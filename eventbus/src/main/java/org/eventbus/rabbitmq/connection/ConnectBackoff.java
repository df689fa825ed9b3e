package org.eventbus.rabbitmq.connection;

import java.time.Duration;

/**
 * Pause between two connection attempts.
 */
@FunctionalInterface
public interface ConnectBackoff {

    /**
     * Block before the attempt that follows the failed {@code attempt} (1-based).
     */
    void await(int attempt) throws InterruptedException;

    /**
     * Sleeps {@code 2^attempt} seconds.
     */
    static ConnectBackoff exponential() {
        return attempt -> Thread.sleep(delay(attempt).toMillis());
    }

    static Duration delay(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofSeconds(1L << Math.min(attempt, 16));
    }
}
