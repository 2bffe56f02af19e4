package io.pglisten.spi;

/**
 * Observability hook for exporting listener counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of connections established and fully subscribed.
     */
    void incrementConnected();

    /**
     * Increments the count of failed connect or subscribe attempts.
     */
    void incrementConnectFailure();

    /**
     * Increments the count of established connections that were lost, including
     * failed heartbeat probes.
     */
    void incrementConnectionLost();

    /**
     * Increments the count of heartbeat queries issued.
     */
    void incrementHeartbeat();

    /**
     * Increments the count of notifications received on a channel.
     *
     * @param channel the channel name
     */
    void incrementReceived(String channel);

    /**
     * Increments the count of timeout events synthesized for a silent channel.
     *
     * @param channel the channel name
     */
    void incrementTimeout(String channel);

    /**
     * Increments the count of handler invocations that threw.
     *
     * @param channel the channel name
     */
    void incrementHandlerFailure(String channel);

    /**
     * Records the time spent in one handler invocation.
     *
     * @param channel    the channel name
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(String channel, long durationMs) {
    }

    /**
     * Records the number of notifications waiting in a channel's mailbox.
     *
     * @param channel the channel name
     * @param depth   current mailbox depth
     */
    default void recordMailboxDepth(String channel, int depth) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementConnected() {
        }

        @Override
        public void incrementConnectFailure() {
        }

        @Override
        public void incrementConnectionLost() {
        }

        @Override
        public void incrementHeartbeat() {
        }

        @Override
        public void incrementReceived(String channel) {
        }

        @Override
        public void incrementTimeout(String channel) {
        }

        @Override
        public void incrementHandlerFailure(String channel) {
        }
    }
}
