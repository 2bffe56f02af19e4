package io.pglisten;

import io.pglisten.connection.ConnectionSupervisor;
import io.pglisten.connection.ExponentialBackoffReconnectPolicy;
import io.pglisten.connection.ReconnectPolicy;
import io.pglisten.dispatch.ChannelWorker;
import io.pglisten.dispatch.Mailbox;
import io.pglisten.spi.ListenConnectionFactory;
import io.pglisten.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resilient LISTEN/NOTIFY listener that routes notifications of each channel to a
 * dedicated handler.
 *
 * <p>A listener holds configuration only; every {@link #start} (or {@link #run}) call
 * creates an independent {@link ListenSession} with its own connection, mailboxes and
 * workers. Within a session:
 * <ul>
 *   <li>one connection is kept open and every channel is subscribed on it; on loss it
 *       is replaced after a {@linkplain ReconnectPolicy backoff}, forever</li>
 *   <li>each channel has a mailbox governed by the {@link ListenPolicy} and a worker
 *       thread that invokes the channel's handler sequentially</li>
 *   <li>a channel silent for the notification timeout receives a {@link Timeout}</li>
 *   <li>a heartbeat query detects silent connection death when no traffic flows</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. This class is immutable and thread-safe.
 *
 * <pre>{@code
 * NotificationListener listener = NotificationListener.builder()
 *     .connectionFactory(JdbcListenConnectionFactory.of(dataSource))
 *     .build();
 *
 * try (ListenSession session = listener.start(
 *         Map.of("orders", event -> System.out.println(event)),
 *         ListenPolicy.ALL,
 *         Duration.ofSeconds(30))) {
 *     ...
 * }
 * }</pre>
 *
 * @see NotificationListener.Builder
 * @see ListenSession
 */
public final class NotificationListener {
    private static final Duration MIN_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);
    private static final Duration NO_TIMEOUT_HEARTBEAT_INTERVAL = Duration.ofSeconds(10);

    private final ListenConnectionFactory connectionFactory;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration heartbeatInterval;
    private final Duration shutdownTimeout;
    private final MetricsExporter metrics;

    private NotificationListener(Builder builder) {
        this.connectionFactory = Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
        this.reconnectPolicy = builder.reconnectPolicy != null
                ? builder.reconnectPolicy : new ExponentialBackoffReconnectPolicy(500, 30_000);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        if (builder.heartbeatInterval != null && !isPositive(builder.heartbeatInterval)) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
        if (!isPositive(builder.shutdownTimeout)) {
            throw new IllegalArgumentException("shutdownTimeout must be > 0");
        }
        this.heartbeatInterval = builder.heartbeatInterval;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a session delivering a {@link Timeout} to a channel's handler whenever the
     * channel stays silent for {@code notificationTimeout}.
     *
     * @param handlers            handler per channel name; copied, must not be empty
     * @param policy              delivery policy for every channel
     * @param notificationTimeout silence after which a {@link Timeout} is delivered; must be &gt; 0
     * @return the running session; the caller must close it
     * @throws IllegalArgumentException if {@code handlers} is empty, a channel name is blank,
     *     or {@code notificationTimeout} is not positive
     */
    public ListenSession start(Map<String, NotificationHandler> handlers, ListenPolicy policy,
                               Duration notificationTimeout) {
        Objects.requireNonNull(notificationTimeout, "notificationTimeout");
        if (!isPositive(notificationTimeout)) {
            throw new IllegalArgumentException("notificationTimeout must be > 0");
        }
        return startSession(handlers, policy, notificationTimeout);
    }

    /**
     * Starts a session that never delivers {@link Timeout} events.
     *
     * @param handlers handler per channel name; copied, must not be empty
     * @param policy   delivery policy for every channel
     * @return the running session; the caller must close it
     */
    public ListenSession start(Map<String, NotificationHandler> handlers, ListenPolicy policy) {
        return startSession(handlers, policy, null);
    }

    /**
     * Runs a session on the calling thread's behalf until the thread is interrupted.
     * On interruption the session is closed and every task joined before the
     * {@link InterruptedException} propagates. Transient failures are never thrown.
     *
     * @param handlers            handler per channel name
     * @param policy              delivery policy for every channel
     * @param notificationTimeout silence after which a {@link Timeout} is delivered
     * @throws InterruptedException when the calling thread is interrupted
     */
    public void run(Map<String, NotificationHandler> handlers, ListenPolicy policy,
                    Duration notificationTimeout) throws InterruptedException {
        runUntilInterrupted(start(handlers, policy, notificationTimeout));
    }

    /**
     * Same as {@link #run(Map, ListenPolicy, Duration)} without {@link Timeout} events.
     *
     * @param handlers handler per channel name
     * @param policy   delivery policy for every channel
     * @throws InterruptedException when the calling thread is interrupted
     */
    public void run(Map<String, NotificationHandler> handlers, ListenPolicy policy) throws InterruptedException {
        runUntilInterrupted(start(handlers, policy));
    }

    private static void runUntilInterrupted(ListenSession session) throws InterruptedException {
        try {
            session.await();
        } finally {
            session.close();
        }
        throw new InterruptedException("Listen session was cancelled");
    }

    private ListenSession startSession(Map<String, NotificationHandler> handlers, ListenPolicy policy,
                                       Duration notificationTimeout) {
        Objects.requireNonNull(handlers, "handlers");
        Objects.requireNonNull(policy, "policy");
        if (handlers.isEmpty()) {
            throw new IllegalArgumentException("handlers must not be empty");
        }

        Map<String, Mailbox> mailboxes = new LinkedHashMap<>();
        List<ChannelWorker> workers = new ArrayList<>();
        for (Map.Entry<String, NotificationHandler> entry : handlers.entrySet()) {
            String channel = Objects.requireNonNull(entry.getKey(), "channel");
            NotificationHandler handler = Objects.requireNonNull(entry.getValue(), "handler for " + channel);
            if (channel.isBlank()) {
                throw new IllegalArgumentException("channel must not be blank");
            }
            Mailbox mailbox = Mailbox.forPolicy(policy);
            mailboxes.put(channel, mailbox);
            workers.add(new ChannelWorker(channel, mailbox, handler, notificationTimeout, metrics));
        }

        ConnectionSupervisor supervisor = new ConnectionSupervisor(
                connectionFactory, mailboxes, reconnectPolicy, heartbeatIntervalFor(notificationTimeout), metrics);
        return ListenSession.start(supervisor, workers, shutdownTimeout);
    }

    Duration heartbeatIntervalFor(Duration notificationTimeout) {
        if (heartbeatInterval != null) {
            return heartbeatInterval;
        }
        if (notificationTimeout == null) {
            return NO_TIMEOUT_HEARTBEAT_INTERVAL;
        }
        Duration third = notificationTimeout.dividedBy(3);
        return third.compareTo(MIN_HEARTBEAT_INTERVAL) < 0 ? MIN_HEARTBEAT_INTERVAL : third;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    /** Builder for {@link NotificationListener}. */
    public static final class Builder {
        private ListenConnectionFactory connectionFactory;
        private ReconnectPolicy reconnectPolicy;
        private Duration heartbeatInterval;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the factory used to open the listening connection, initially and on
         * every reconnect.
         *
         * <p><b>Required.</b>
         *
         * @param connectionFactory the connection factory
         * @return this builder
         */
        public Builder connectionFactory(ListenConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        /**
         * Sets the policy computing the delay between consecutive connect attempts.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffReconnectPolicy} with
         * {@code baseDelayMs=500}, {@code maxDelayMs=30000} and jitter.
         *
         * @param reconnectPolicy the reconnect policy
         * @return this builder
         */
        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        /**
         * Sets how often connection liveness is checked.
         *
         * <p>Optional. Defaults to a third of the notification timeout, at least one
         * second, or ten seconds for sessions without a notification timeout.
         *
         * @param heartbeatInterval the heartbeat interval; must be &gt; 0
         * @return this builder
         */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        /**
         * Sets how long {@link ListenSession#close()} waits for tasks to terminate.
         *
         * <p>Optional. Defaults to 5 seconds. Must be &gt; 0.
         *
         * @param shutdownTimeout the shutdown grace period
         * @return this builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the listener. No connection is opened until a session is started.
         *
         * @return a new {@link NotificationListener}
         * @throws NullPointerException     if {@code connectionFactory} is null
         * @throws IllegalArgumentException if a duration is not positive
         */
        public NotificationListener build() {
            return new NotificationListener(this);
        }
    }
}
