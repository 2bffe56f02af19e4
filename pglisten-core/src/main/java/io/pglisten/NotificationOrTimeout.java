package io.pglisten;

/**
 * Event passed to a {@link NotificationHandler}: either a {@link Notification}
 * received from the server or a locally synthesized {@link Timeout}.
 *
 * <pre>{@code
 * NotificationHandler handler = event -> {
 *     if (event instanceof Notification n) {
 *         cache.invalidate(n.payload());
 *     } else {
 *         cache.refreshAll();
 *     }
 * };
 * }</pre>
 */
public sealed interface NotificationOrTimeout permits Notification, Timeout {

    /**
     * Returns the channel this event belongs to.
     *
     * @return the channel name
     */
    String channel();
}
