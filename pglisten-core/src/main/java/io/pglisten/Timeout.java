package io.pglisten;

import java.util.Objects;

/**
 * Synthetic event delivered when no notification arrived on a channel for the
 * configured notification timeout. Never produced by the connection.
 *
 * @param channel the silent channel
 */
public record Timeout(String channel) implements NotificationOrTimeout {

    public Timeout {
        Objects.requireNonNull(channel, "channel");
    }
}
