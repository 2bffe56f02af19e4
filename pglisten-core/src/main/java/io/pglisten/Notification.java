package io.pglisten;

import java.util.Objects;

/**
 * A notification received on a subscribed channel, one per server-side {@code NOTIFY}.
 *
 * @param channel the channel the notification was sent to
 * @param payload the payload; empty when the sender supplied none
 */
public record Notification(String channel, String payload) implements NotificationOrTimeout {

    public Notification {
        Objects.requireNonNull(channel, "channel");
        payload = payload == null ? "" : payload;
    }
}
