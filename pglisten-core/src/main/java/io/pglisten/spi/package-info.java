/**
 * Service provider interfaces implemented outside the core.
 *
 * <p>{@link io.pglisten.spi.ListenConnectionFactory} and {@link io.pglisten.spi.ListenConnection}
 * abstract the database driver; {@link io.pglisten.spi.MetricsExporter} abstracts the
 * metrics backend.
 */
package io.pglisten.spi;
