/**
 * Spring Boot auto-configuration for the LISTEN/NOTIFY listener.
 *
 * <p>{@link io.pglisten.spring.boot.PgListenAutoConfiguration} wires a
 * {@link io.pglisten.NotificationListener} and starts it for beans annotated with
 * {@link io.pglisten.spring.boot.NotificationChannel}.
 * {@link io.pglisten.spring.boot.PgListenMicrometerAutoConfiguration} adds a Micrometer
 * metrics exporter when a meter registry is available.
 *
 * @see io.pglisten.spring.boot.PgListenProperties
 */
package io.pglisten.spring.boot;
