package io.pglisten.connection;

/** Lifecycle state of a {@link ConnectionSupervisor}. */
enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    LISTENING
}
