package io.pglisten.jdbc;

import io.pglisten.Notification;
import io.pglisten.spi.ListenConnection;
import io.pglisten.spi.NotificationCallback;
import io.pglisten.util.DaemonThreadFactory;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ListenConnection} over a pgjdbc {@link Connection}.
 *
 * <p>pgjdbc has no push callback for notifications, so a daemon reader thread polls
 * {@link PGConnection#getNotifications(int)} and hands every notification to the
 * callback registered for its channel. The reader is also what notices a dead
 * connection: the first {@link SQLException} it sees fires the termination listeners
 * and ends the reader.
 */
public final class PgListenConnection implements ListenConnection {
    private static final Logger logger = Logger.getLogger(PgListenConnection.class.getName());
    private static final DaemonThreadFactory READER_THREADS = new DaemonThreadFactory("pglisten-reader-");

    private final Connection connection;
    private final PGConnection pgConnection;
    private final int pollTimeoutMs;
    private final Map<String, NotificationCallback> callbacks = new ConcurrentHashMap<>();
    private final List<Consumer<Throwable>> terminationListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Thread reader;

    /**
     * Takes ownership of {@code connection}: it is switched to auto-commit and closed
     * together with this object.
     *
     * @param connection  an open connection that unwraps to {@link PGConnection}
     * @param pollTimeout how long one notification poll blocks; must be &gt; 0
     * @throws SQLException if the connection is not a PostgreSQL connection
     */
    public PgListenConnection(Connection connection, Duration pollTimeout) throws SQLException {
        this.connection = Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be > 0");
        }
        this.pollTimeoutMs = (int) Math.min(Integer.MAX_VALUE, pollTimeout.toMillis());
        this.pgConnection = connection.unwrap(PGConnection.class);
        connection.setAutoCommit(true);
        this.reader = READER_THREADS.newThread(this::readLoop);
        reader.start();
    }

    @Override
    public void listen(String channel, NotificationCallback callback) throws SQLException {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callback, "callback");
        callbacks.put(channel, callback);
        try (Statement statement = connection.createStatement()) {
            statement.execute("LISTEN " + quoteIdentifier(channel));
        }
        logger.fine(() -> "Subscribed to channel " + channel);
    }

    @Override
    public void execute(String sql, Duration timeout) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds(timeout));
            statement.execute(sql);
        }
    }

    @Override
    public void onTermination(Consumer<Throwable> listener) {
        terminationListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public boolean isClosed() {
        return closed.get() || terminated.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        reader.interrupt();
        try {
            connection.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close listen connection", e);
        }
    }

    private void readLoop() {
        try {
            while (!closed.get()) {
                PGNotification[] notifications = pgConnection.getNotifications(pollTimeoutMs);
                if (notifications == null) {
                    continue;
                }
                for (PGNotification notification : notifications) {
                    dispatch(notification);
                }
            }
        } catch (SQLException e) {
            if (!closed.get()) {
                terminate(e);
            }
        }
    }

    private void dispatch(PGNotification notification) {
        NotificationCallback callback = callbacks.get(notification.getName());
        if (callback == null) {
            logger.finest(() -> "Ignoring notification on unknown channel " + notification.getName());
            return;
        }
        try {
            callback.onNotification(new Notification(notification.getName(), notification.getParameter()));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Notification callback failed for channel " + notification.getName(), e);
        }
    }

    private void terminate(Throwable cause) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        logger.fine(() -> "Listen connection terminated: " + cause.getMessage());
        for (Consumer<Throwable> listener : terminationListeners) {
            try {
                listener.accept(cause);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Termination listener failed", e);
            }
        }
    }

    static String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    static int queryTimeoutSeconds(Duration timeout) {
        if (timeout == null) {
            return 0;
        }
        long millis = timeout.toMillis();
        long seconds = (millis + 999L) / 1000L;
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
    }
}
