/**
 * Root API of pglisten, a resilient listener for database LISTEN/NOTIFY channels.
 *
 * <h2>Core Design</h2>
 * <p>A {@link io.pglisten.NotificationListener} session keeps one connection open through
 * a {@linkplain io.pglisten.connection.ConnectionSupervisor supervisor} and subscribes
 * every channel on it. Each notification is pushed into its channel's
 * {@linkplain io.pglisten.dispatch.Mailbox mailbox}; a dedicated
 * {@linkplain io.pglisten.dispatch.ChannelWorker worker} per channel drains the mailbox
 * and invokes the channel's {@link io.pglisten.NotificationHandler}. Reconnects are
 * invisible to workers: mailboxes survive them.
 *
 * <p>Under {@link io.pglisten.ListenPolicy#ALL} every notification is delivered in
 * order; under {@link io.pglisten.ListenPolicy#LAST} a burst collapses into its freshest
 * notification. Silent channels receive {@link io.pglisten.Timeout} events. Delivery
 * is at-most-once across a reconnect: notifications sent while disconnected are lost.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>pglisten-core</b>: listener, mailboxes, workers, supervisor (zero external deps)</li>
 *   <li><b>pglisten-jdbc</b>: PostgreSQL connection capability on pgjdbc</li>
 *   <li><b>pglisten-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>pglisten-spring-boot-starter</b>: auto-configuration and annotated handlers</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * NotificationListener listener = NotificationListener.builder()
 *     .connectionFactory(JdbcListenConnectionFactory.of(url, user, password))
 *     .build();
 *
 * listener.run(Map.of(
 *         "orders", event -> {
 *             if (event instanceof Notification n) {
 *                 System.out.println("Order changed: " + n.payload());
 *             }
 *         }),
 *     ListenPolicy.LAST,
 *     Duration.ofSeconds(30));   // blocks until the thread is interrupted
 * }</pre>
 *
 * @see io.pglisten.NotificationListener
 * @see io.pglisten.ListenSession
 * @see io.pglisten.NotificationHandler
 */
package io.pglisten;
