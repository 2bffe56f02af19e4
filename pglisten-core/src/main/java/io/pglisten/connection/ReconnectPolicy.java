package io.pglisten.connection;

/**
 * Strategy for computing the delay before the next connect attempt.
 *
 * @see ExponentialBackoffReconnectPolicy
 */
@FunctionalInterface
public interface ReconnectPolicy {

    /**
     * Computes the delay in milliseconds before the next connect attempt.
     *
     * @param consecutiveFailures failures since the last successful subscribe (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int consecutiveFailures);
}
