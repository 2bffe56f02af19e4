package io.pglisten;

import io.pglisten.spi.ListenConnection;
import io.pglisten.spi.ListenConnectionFactory;
import io.pglisten.spi.NotificationCallback;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * In-memory connection capability. {@link #notify(String, String)} behaves like a
 * server-side NOTIFY reaching the most recent connection.
 */
public final class FakeListenConnectionFactory implements ListenConnectionFactory {
    private final AtomicInteger connectAttempts = new AtomicInteger();
    private final AtomicInteger failuresToInject = new AtomicInteger();
    private final List<FakeListenConnection> connections = new CopyOnWriteArrayList<>();

    /** Makes the next {@code count} connect attempts fail. */
    public FakeListenConnectionFactory failNextConnects(int count) {
        failuresToInject.set(count);
        return this;
    }

    @Override
    public ListenConnection connect() throws SQLException {
        connectAttempts.incrementAndGet();
        if (failuresToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new SQLException("Connection refused");
        }
        FakeListenConnection connection = new FakeListenConnection();
        connections.add(connection);
        return connection;
    }

    public int connectAttempts() {
        return connectAttempts.get();
    }

    public List<FakeListenConnection> connections() {
        return connections;
    }

    public FakeListenConnection latest() {
        return connections.isEmpty() ? null : connections.get(connections.size() - 1);
    }

    /** Delivers a notification to the most recent connection, if it listens on the channel. */
    public boolean notify(String channel, String payload) {
        FakeListenConnection connection = latest();
        return connection != null && connection.notify(channel, payload);
    }

    /**
     * Waits until the {@code number}-th connection (1-based) has subscribed
     * {@code channelCount} channels.
     */
    public FakeListenConnection awaitSubscribed(int number, int channelCount, Duration timeout)
            throws InterruptedException {
        boolean ready = waitFor(() -> connections.size() >= number
                && connections.get(number - 1).channels().size() >= channelCount, timeout);
        if (!ready) {
            throw new AssertionError("Connection #" + number + " did not subscribe " + channelCount
                    + " channel(s) within " + timeout);
        }
        return connections.get(number - 1);
    }

    public static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    public static final class FakeListenConnection implements ListenConnection {
        private final Map<String, NotificationCallback> callbacks = new ConcurrentHashMap<>();
        private final List<Consumer<Throwable>> terminationListeners = new CopyOnWriteArrayList<>();
        private final AtomicInteger executed = new AtomicInteger();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile SQLException executeFailure;
        private volatile SQLException terminatedBy;

        @Override
        public void listen(String channel, NotificationCallback callback) throws SQLException {
            if (closed.get()) {
                throw new SQLException("Connection is closed");
            }
            callbacks.put(channel, callback);
        }

        @Override
        public void execute(String sql, Duration timeout) throws SQLException {
            executed.incrementAndGet();
            if (closed.get()) {
                throw new SQLException("Connection is closed");
            }
            SQLException failure = executeFailure;
            if (failure != null) {
                throw failure;
            }
        }

        @Override
        public void onTermination(Consumer<Throwable> listener) {
            terminationListeners.add(listener);
            if (terminatedBy != null) {
                listener.accept(terminatedBy);
            }
        }

        @Override
        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            closed.set(true);
        }

        public boolean notify(String channel, String payload) {
            NotificationCallback callback = callbacks.get(channel);
            if (callback == null || closed.get()) {
                return false;
            }
            callback.onNotification(new Notification(channel, payload));
            return true;
        }

        /** Simulates the server side dropping the connection. */
        public void drop() {
            SQLException cause = new SQLException("Connection reset by peer");
            terminatedBy = cause;
            closed.set(true);
            terminationListeners.forEach(listener -> listener.accept(cause));
        }

        public void failExecuteWith(SQLException failure) {
            this.executeFailure = failure;
        }

        public java.util.Set<String> channels() {
            return callbacks.keySet();
        }

        public int executed() {
            return executed.get();
        }
    }
}
