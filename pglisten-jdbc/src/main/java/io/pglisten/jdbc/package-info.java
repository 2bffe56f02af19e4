/**
 * PostgreSQL binding of the listen connection capability, built on pgjdbc.
 *
 * <p>{@link io.pglisten.jdbc.JdbcListenConnectionFactory} opens connections from a
 * {@link javax.sql.DataSource} or a JDBC URL; {@link io.pglisten.jdbc.PgListenConnection}
 * issues {@code LISTEN} statements and polls for notifications on a reader thread.
 *
 * @see io.pglisten.spi.ListenConnectionFactory
 */
package io.pglisten.jdbc;
