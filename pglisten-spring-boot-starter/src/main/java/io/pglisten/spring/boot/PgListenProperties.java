package io.pglisten.spring.boot;

import io.pglisten.ListenPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the LISTEN/NOTIFY listener.
 *
 * @see PgListenAutoConfiguration
 */
@ConfigurationProperties(prefix = "pglisten")
public class PgListenProperties {

    /**
     * Whether the listener is auto-configured at all.
     */
    private boolean enabled = true;

    /**
     * Delivery policy applied to every channel.
     */
    private ListenPolicy policy = ListenPolicy.ALL;

    /**
     * Silence after which a channel's handler receives a timeout event. Zero or
     * negative disables timeout events.
     */
    private Duration notificationTimeout = Duration.ofSeconds(30);

    /**
     * Interval between connection liveness checks. Derived from the notification
     * timeout when unset.
     */
    private Duration heartbeatInterval;

    /**
     * How long context shutdown waits for handlers to finish.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private final Reconnect reconnect = new Reconnect();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ListenPolicy getPolicy() {
        return policy;
    }

    public void setPolicy(ListenPolicy policy) {
        this.policy = policy;
    }

    public Duration getNotificationTimeout() {
        return notificationTimeout;
    }

    public void setNotificationTimeout(Duration notificationTimeout) {
        this.notificationTimeout = notificationTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reconnect {
        private long baseDelayMs = 500;
        private long maxDelayMs = 30000;
        private boolean jitter = true;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Jdbc {
        private long pollTimeoutMs = 500;

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "pglisten";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
