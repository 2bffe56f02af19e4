/**
 * Connection lifecycle: supervision, heartbeat and reconnect backoff.
 *
 * @see io.pglisten.connection.ConnectionSupervisor
 * @see io.pglisten.connection.ReconnectPolicy
 */
package io.pglisten.connection;
