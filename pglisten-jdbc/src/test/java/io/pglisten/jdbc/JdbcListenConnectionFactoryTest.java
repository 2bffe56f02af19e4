package io.pglisten.jdbc;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcListenConnectionFactoryTest {

    @Test
    void nullDataSourceThrows() {
        assertThrows(NullPointerException.class, () ->
                JdbcListenConnectionFactory.of((DataSource) null));
    }

    @Test
    void nullUrlThrows() {
        assertThrows(NullPointerException.class, () ->
                JdbcListenConnectionFactory.of(null, "user", "password"));
    }

    @Test
    void defaultPollTimeout() {
        JdbcListenConnectionFactory factory = JdbcListenConnectionFactory.of("jdbc:postgresql://localhost/db", null, null);

        assertEquals(Duration.ofMillis(500), factory.pollTimeout());
    }

    @Test
    void withPollTimeoutReturnsCopy() {
        JdbcListenConnectionFactory factory = JdbcListenConnectionFactory.of("jdbc:postgresql://localhost/db", null, null);

        JdbcListenConnectionFactory changed = factory.withPollTimeout(Duration.ofMillis(100));

        assertNotSame(factory, changed);
        assertEquals(Duration.ofMillis(100), changed.pollTimeout());
        assertEquals(Duration.ofMillis(500), factory.pollTimeout());
    }

    @Test
    void nonPositivePollTimeoutThrows() {
        JdbcListenConnectionFactory factory = JdbcListenConnectionFactory.of("jdbc:postgresql://localhost/db", null, null);

        assertThrows(IllegalArgumentException.class, () -> factory.withPollTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> factory.withPollTimeout(Duration.ofMillis(-1)));
    }

    @Test
    void urlConnectionsBoundConnectAndLogin() {
        Properties info = JdbcListenConnectionFactory.connectionProperties(
                "app", "secret", JdbcListenConnectionFactory.DEFAULT_CONNECT_TIMEOUT);

        assertEquals("app", info.getProperty("user"));
        assertEquals("secret", info.getProperty("password"));
        assertEquals("3", info.getProperty("connectTimeout"));
        assertEquals("3", info.getProperty("loginTimeout"));
    }

    @Test
    void connectTimeoutRoundsUpAndOmitsMissingCredentials() {
        Properties info = JdbcListenConnectionFactory.connectionProperties(null, null, Duration.ofMillis(1500));

        assertFalse(info.containsKey("user"));
        assertFalse(info.containsKey("password"));
        assertEquals("2", info.getProperty("connectTimeout"));
    }

    @Test
    void nonPositiveConnectTimeoutThrows() {
        assertThrows(IllegalArgumentException.class, () ->
                JdbcListenConnectionFactory.of("jdbc:postgresql://localhost/db", null, null, Duration.ZERO));
        assertThrows(NullPointerException.class, () ->
                JdbcListenConnectionFactory.of("jdbc:postgresql://localhost/db", null, null, null));
    }

    @Test
    void dataSourceFailurePropagates() {
        SQLException failure = new SQLException("Connection refused");
        JdbcListenConnectionFactory factory = JdbcListenConnectionFactory.of(dataSource(() -> {
            throw failure;
        }));

        SQLException thrown = assertThrows(SQLException.class, factory::connect);
        assertEquals(failure, thrown);
    }

    @Test
    void nonPostgresConnectionIsClosedAndRejected() {
        AtomicBoolean closed = new AtomicBoolean();
        Connection connection = (Connection) Proxy.newProxyInstance(
                getClass().getClassLoader(), new Class<?>[]{Connection.class}, (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "unwrap":
                            throw new SQLException("Not a PGConnection");
                        case "close":
                            closed.set(true);
                            return null;
                        default:
                            return null;
                    }
                });
        JdbcListenConnectionFactory factory = JdbcListenConnectionFactory.of(dataSource(() -> connection));

        assertThrows(SQLException.class, factory::connect);
        assertTrue(closed.get());
    }

    private static DataSource dataSource(ConnectionSupplier supplier) {
        return (DataSource) Proxy.newProxyInstance(
                JdbcListenConnectionFactoryTest.class.getClassLoader(), new Class<?>[]{DataSource.class},
                (proxy, method, args) -> {
                    if (method.getName().equals("getConnection")) {
                        return supplier.get();
                    }
                    throw new UnsupportedOperationException(method.getName());
                });
    }

    @FunctionalInterface
    private interface ConnectionSupplier {
        Connection get() throws SQLException;
    }
}
