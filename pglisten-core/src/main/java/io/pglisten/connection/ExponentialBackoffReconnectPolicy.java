package io.pglisten.connection;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect policy using capped exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code min(maxDelay, baseDelay * 2^failures)}. With jitter enabled
 * the result is multiplied by a random factor in [0.5, 1.5) and capped at
 * {@code maxDelay} again.
 */
public final class ExponentialBackoffReconnectPolicy implements ReconnectPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    /**
     * Creates a policy with jitter enabled.
     *
     * @param baseDelayMs base delay (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffReconnectPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, true);
    }

    /**
     * @param baseDelayMs base delay (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     * @param jitter      whether to randomize delays
     */
    public ExponentialBackoffReconnectPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    @Override
    public long computeDelayMs(int consecutiveFailures) {
        if (consecutiveFailures <= 0 || baseDelayMs == 0) {
            return 0L;
        }
        long expDelay;
        if (consecutiveFailures >= 62) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << consecutiveFailures;
            // Overflow guard: anything above maxDelay is capped anyway
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (!jitter) {
            return capped;
        }
        double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
