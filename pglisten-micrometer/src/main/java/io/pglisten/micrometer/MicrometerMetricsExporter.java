package io.pglisten.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.pglisten.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pglisten.connection.established}: connections opened and fully subscribed</li>
 *   <li>{@code pglisten.connection.failures}: failed connect or subscribe attempts</li>
 *   <li>{@code pglisten.connection.lost}: established connections that were lost</li>
 *   <li>{@code pglisten.heartbeat}: heartbeat queries issued</li>
 *   <li>{@code pglisten.notifications.received}: notifications received, tagged {@code channel}</li>
 *   <li>{@code pglisten.notifications.timeouts}: timeout events delivered, tagged {@code channel}</li>
 *   <li>{@code pglisten.handler.failures}: handler invocations that threw, tagged {@code channel}</li>
 * </ul>
 *
 * <h3>Timers and gauges</h3>
 * <ul>
 *   <li>{@code pglisten.handler.duration}: handler execution time, tagged {@code channel}</li>
 *   <li>{@code pglisten.mailbox.depth}: pending notifications, tagged {@code channel}</li>
 * </ul>
 *
 * <p>Per-channel meters are registered on first use.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    private static final String CHANNEL_TAG = "channel";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter connected;
    private final Counter connectFailures;
    private final Counter connectionsLost;
    private final Counter heartbeats;

    private final Map<String, Counter> received = new ConcurrentHashMap<>();
    private final Map<String, Counter> timeouts = new ConcurrentHashMap<>();
    private final Map<String, Counter> handlerFailures = new ConcurrentHashMap<>();
    private final Map<String, Timer> handlerDurations = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> mailboxDepths = new ConcurrentHashMap<>();
    private final Map<String, Gauge> mailboxDepthGauges = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "pglisten"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "pglisten");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.pglisten"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.connected = Counter.builder(namePrefix + ".connection.established")
                .description("Connections opened and subscribed to every channel")
                .register(registry);
        this.connectFailures = Counter.builder(namePrefix + ".connection.failures")
                .description("Failed connect or subscribe attempts")
                .register(registry);
        this.connectionsLost = Counter.builder(namePrefix + ".connection.lost")
                .description("Established connections that were lost")
                .register(registry);
        this.heartbeats = Counter.builder(namePrefix + ".heartbeat")
                .description("Heartbeat queries issued")
                .register(registry);
    }

    @Override
    public void incrementConnected() {
        if (closed) return;
        connected.increment();
    }

    @Override
    public void incrementConnectFailure() {
        if (closed) return;
        connectFailures.increment();
    }

    @Override
    public void incrementConnectionLost() {
        if (closed) return;
        connectionsLost.increment();
    }

    @Override
    public void incrementHeartbeat() {
        if (closed) return;
        heartbeats.increment();
    }

    @Override
    public void incrementReceived(String channel) {
        if (closed) return;
        received.computeIfAbsent(channel, ch -> Counter.builder(namePrefix + ".notifications.received")
                .description("Notifications received")
                .tag(CHANNEL_TAG, ch)
                .register(registry)).increment();
    }

    @Override
    public void incrementTimeout(String channel) {
        if (closed) return;
        timeouts.computeIfAbsent(channel, ch -> Counter.builder(namePrefix + ".notifications.timeouts")
                .description("Timeout events delivered for silent channels")
                .tag(CHANNEL_TAG, ch)
                .register(registry)).increment();
    }

    @Override
    public void incrementHandlerFailure(String channel) {
        if (closed) return;
        handlerFailures.computeIfAbsent(channel, ch -> Counter.builder(namePrefix + ".handler.failures")
                .description("Handler invocations that threw")
                .tag(CHANNEL_TAG, ch)
                .register(registry)).increment();
    }

    @Override
    public void recordHandlerDurationMs(String channel, long durationMs) {
        if (closed) return;
        handlerDurations.computeIfAbsent(channel, ch -> Timer.builder(namePrefix + ".handler.duration")
                .description("Handler execution time")
                .tag(CHANNEL_TAG, ch)
                .register(registry)).record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordMailboxDepth(String channel, int depth) {
        if (closed) return;
        AtomicInteger holder = mailboxDepths.computeIfAbsent(channel, ch -> {
            AtomicInteger value = new AtomicInteger();
            mailboxDepthGauges.put(ch, Gauge.builder(namePrefix + ".mailbox.depth", value, AtomicInteger::get)
                    .description("Notifications waiting for the channel handler")
                    .tag(CHANNEL_TAG, ch)
                    .register(registry));
            return value;
        });
        holder.set(depth);
    }

    /**
     * Removes all meters registered by this exporter from the registry. Later calls
     * to any recording method are ignored.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(connected, connectFailures, connectionsLost, heartbeats));
        meters.addAll(received.values());
        meters.addAll(timeouts.values());
        meters.addAll(handlerFailures.values());
        meters.addAll(handlerDurations.values());
        meters.addAll(mailboxDepthGauges.values());

        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
