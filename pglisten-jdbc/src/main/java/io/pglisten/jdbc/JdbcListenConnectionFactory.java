package io.pglisten.jdbc;

import io.pglisten.spi.ListenConnection;
import io.pglisten.spi.ListenConnectionFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link ListenConnectionFactory} that opens a fresh JDBC connection per call and wraps
 * it in a {@link PgListenConnection}.
 *
 * <p>The connection is held for the whole lifetime of a listen session. When it comes
 * from a pool, closing it returns it to the pool, which is fine as long as the pool
 * discards broken connections. A direct {@link #of(String, String, String) URL} avoids
 * occupying a pool slot.
 *
 * <p>Interrupting a thread does not abort a TCP connect or authentication in progress,
 * so a listen session can only shut down promptly if {@link #connect()} is bounded.
 * URL factories pass {@code connectTimeout} and {@code loginTimeout} (3 s by default) to
 * the driver; parameters in the URL itself take precedence. For a {@link DataSource},
 * configure the equivalent timeouts on the data source (for example
 * {@code PGSimpleDataSource#setConnectTimeout}) below the listener's shutdown timeout.
 *
 * <pre>{@code
 * ListenConnectionFactory factory = JdbcListenConnectionFactory.of(dataSource)
 *     .withPollTimeout(Duration.ofMillis(250));
 * }</pre>
 */
public final class JdbcListenConnectionFactory implements ListenConnectionFactory {
    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private final ConnectionSource source;
    private final Duration pollTimeout;

    private JdbcListenConnectionFactory(ConnectionSource source, Duration pollTimeout) {
        this.source = source;
        this.pollTimeout = pollTimeout;
    }

    /**
     * @param dataSource data source of PostgreSQL connections
     * @return a factory with a 500 ms poll timeout
     */
    public static JdbcListenConnectionFactory of(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        return new JdbcListenConnectionFactory(dataSource::getConnection, DEFAULT_POLL_TIMEOUT);
    }

    /**
     * @param url      a {@code jdbc:postgresql:} URL
     * @param user     the user, may be null
     * @param password the password, may be null
     * @return a factory with a 500 ms poll timeout and a 3 s connect timeout
     */
    public static JdbcListenConnectionFactory of(String url, String user, String password) {
        return of(url, user, password, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * @param url            a {@code jdbc:postgresql:} URL
     * @param user           the user, may be null
     * @param password       the password, may be null
     * @param connectTimeout bound on socket connect and on authentication; must be &gt; 0,
     *                       rounded up to whole seconds
     * @return a factory with a 500 ms poll timeout
     */
    public static JdbcListenConnectionFactory of(String url, String user, String password, Duration connectTimeout) {
        Objects.requireNonNull(url, "url");
        Properties info = connectionProperties(user, password, connectTimeout);
        return new JdbcListenConnectionFactory(() -> DriverManager.getConnection(url, info), DEFAULT_POLL_TIMEOUT);
    }

    static Properties connectionProperties(String user, String password, Duration connectTimeout) {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        Properties info = new Properties();
        if (user != null) {
            info.setProperty("user", user);
        }
        if (password != null) {
            info.setProperty("password", password);
        }
        String seconds = String.valueOf(PgListenConnection.queryTimeoutSeconds(connectTimeout));
        info.setProperty("connectTimeout", seconds);
        info.setProperty("loginTimeout", seconds);
        return info;
    }

    /**
     * Returns a copy of this factory whose connections block at most {@code pollTimeout}
     * per notification poll. Lower values make {@link ListenConnection#close()} and
     * heartbeats react faster at the cost of more wake-ups.
     *
     * @param pollTimeout the poll timeout; must be &gt; 0
     * @return a new factory
     */
    public JdbcListenConnectionFactory withPollTimeout(Duration pollTimeout) {
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be > 0");
        }
        return new JdbcListenConnectionFactory(source, pollTimeout);
    }

    Duration pollTimeout() {
        return pollTimeout;
    }

    @Override
    public ListenConnection connect() throws SQLException {
        Connection connection = source.getConnection();
        try {
            return new PgListenConnection(connection, pollTimeout);
        } catch (SQLException | RuntimeException e) {
            try {
                connection.close();
            } catch (SQLException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    @FunctionalInterface
    private interface ConnectionSource {
        Connection getConnection() throws SQLException;
    }
}
