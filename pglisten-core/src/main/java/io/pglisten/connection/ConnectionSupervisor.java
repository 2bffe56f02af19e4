package io.pglisten.connection;

import io.pglisten.dispatch.Mailbox;
import io.pglisten.spi.ListenConnection;
import io.pglisten.spi.ListenConnectionFactory;
import io.pglisten.spi.MetricsExporter;
import io.pglisten.spi.NotificationCallback;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the connection lifecycle of one listen session: connect, subscribe every
 * channel, watch for loss, back off, reconnect.
 *
 * <p>Runs until its thread is interrupted. Connect failures, subscribe failures,
 * connection loss and failed heartbeats are all treated as transient: they are
 * logged, counted as consecutive failures and followed by a
 * {@linkplain ReconnectPolicy backoff} before the next attempt. The failure count
 * resets once every channel has been subscribed again.
 *
 * <p>Mailboxes outlive connections. Notifications received on any connection are
 * offered to the same mailbox for a channel, so workers never notice reconnects.
 *
 * <p>Heartbeat: every {@code heartbeatInterval} the supervisor checks whether any
 * notification arrived since the previous check. If none did, it runs
 * {@value #HEARTBEAT_QUERY} on the connection; a failing probe counts as loss.
 */
public final class ConnectionSupervisor implements Runnable {
    private static final Logger logger = Logger.getLogger(ConnectionSupervisor.class.getName());

    static final String HEARTBEAT_QUERY = "SELECT 1";

    private final ListenConnectionFactory connectionFactory;
    private final Map<String, Mailbox> mailboxes;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration heartbeatInterval;
    private final MetricsExporter metrics;

    private final AtomicBoolean trafficSeen = new AtomicBoolean();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile int failures;

    public ConnectionSupervisor(ListenConnectionFactory connectionFactory, Map<String, Mailbox> mailboxes,
                                ReconnectPolicy reconnectPolicy, Duration heartbeatInterval,
                                MetricsExporter metrics) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.mailboxes = Map.copyOf(mailboxes);
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    connectAndListen();
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    recordFailure(e);
                    backoff();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = ConnectionState.DISCONNECTED;
            logger.fine("Connection supervisor stopped");
        }
    }

    private void connectAndListen() throws Exception {
        state = ConnectionState.CONNECTING;
        ListenConnection connection = connectionFactory.connect();
        try {
            if (Thread.interrupted()) {
                throw new InterruptedException("Cancelled while connecting");
            }
            CompletableFuture<Throwable> lost = new CompletableFuture<>();
            connection.onTermination(lost::complete);
            for (Map.Entry<String, Mailbox> entry : mailboxes.entrySet()) {
                connection.listen(entry.getKey(), callbackFor(entry.getKey(), entry.getValue()));
            }
            failures = 0;
            trafficSeen.set(false);
            state = ConnectionState.LISTENING;
            metrics.incrementConnected();
            logger.info("Listening on channels " + mailboxes.keySet());
            awaitLoss(connection, lost);
        } finally {
            connection.close();
        }
    }

    private NotificationCallback callbackFor(String channel, Mailbox mailbox) {
        return notification -> {
            trafficSeen.set(true);
            metrics.incrementReceived(channel);
            mailbox.offer(notification);
        };
    }

    private void awaitLoss(ListenConnection connection, CompletableFuture<Throwable> lost) throws Exception {
        long intervalMs = heartbeatInterval.toMillis();
        while (true) {
            try {
                Throwable cause = lost.get(intervalMs, TimeUnit.MILLISECONDS);
                throw new ConnectionLostException("Connection was lost", cause);
            } catch (TimeoutException e) {
                heartbeat(connection);
            } catch (ExecutionException e) {
                throw new ConnectionLostException("Connection was lost", e.getCause());
            }
        }
    }

    private void heartbeat(ListenConnection connection) throws SQLException {
        if (trafficSeen.getAndSet(false)) {
            logger.finest("Notifications seen since last check; heartbeat skipped");
            return;
        }
        metrics.incrementHeartbeat();
        logger.fine("Sending heartbeat");
        connection.execute(HEARTBEAT_QUERY, heartbeatInterval);
    }

    private void recordFailure(Exception e) {
        if (state == ConnectionState.LISTENING) {
            metrics.incrementConnectionLost();
        } else {
            metrics.incrementConnectFailure();
        }
        state = ConnectionState.DISCONNECTED;
        failures++;
        logger.log(Level.WARNING, "Connection was lost or not established (consecutive failures: "
                + failures + ")", e);
    }

    private void backoff() throws InterruptedException {
        long delayMs = reconnectPolicy.computeDelayMs(failures);
        if (delayMs > 0L) {
            logger.fine(() -> "Reconnecting in " + delayMs + " ms");
            TimeUnit.MILLISECONDS.sleep(delayMs);
        }
    }

    ConnectionState state() {
        return state;
    }

    int failures() {
        return failures;
    }
}
