package io.pglisten.connection;

import java.sql.SQLException;

/**
 * Signals that an established connection reported its own termination.
 */
public final class ConnectionLostException extends SQLException {
    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
