package io.pglisten.spi;

import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * A database connection able to subscribe to notification channels.
 *
 * <p>A connection is owned by a single connection supervisor. Subscriptions end
 * when the connection is closed; there is no explicit unsubscribe.
 *
 * @see ListenConnectionFactory
 */
public interface ListenConnection extends AutoCloseable {

    /**
     * Subscribes to a channel. Notifications for the channel are pushed to
     * {@code callback} on the connection's delivery thread.
     *
     * @param channel  the channel name
     * @param callback receives each notification of the channel
     * @throws SQLException if the subscription fails
     */
    void listen(String channel, NotificationCallback callback) throws SQLException;

    /**
     * Executes a statement, used as a liveness probe.
     *
     * @param sql     the statement to run
     * @param timeout maximum time the statement may take
     * @throws SQLException if the statement fails or times out
     */
    void execute(String sql, Duration timeout) throws SQLException;

    /**
     * Registers a listener invoked once when the connection is lost by itself.
     * Not invoked for an explicit {@link #close()}.
     *
     * @param listener receives the cause of the loss, may be {@code null}
     */
    void onTermination(Consumer<Throwable> listener);

    /**
     * @return {@code true} once the connection was closed or lost
     */
    boolean isClosed();

    /**
     * Closes the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
