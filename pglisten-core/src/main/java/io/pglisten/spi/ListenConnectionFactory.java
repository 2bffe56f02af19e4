package io.pglisten.spi;

import java.sql.SQLException;

/**
 * Opens new {@link ListenConnection}s. Called by the connection supervisor for the
 * initial connect and for every reconnect.
 *
 * @see io.pglisten.jdbc.JdbcListenConnectionFactory
 */
@FunctionalInterface
public interface ListenConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return an open connection; the caller closes it
     * @throws SQLException if the connection cannot be established
     */
    ListenConnection connect() throws SQLException;
}
