package io.pglisten.spi;

import io.pglisten.Notification;

/**
 * Receives notifications pushed by a {@link ListenConnection}.
 *
 * <p>Invoked on the connection's own delivery thread. Implementations must return
 * quickly and never block.
 */
@FunctionalInterface
public interface NotificationCallback {

    /**
     * Called once per notification received on the subscribed channel.
     *
     * @param notification the received notification
     */
    void onNotification(Notification notification);
}
