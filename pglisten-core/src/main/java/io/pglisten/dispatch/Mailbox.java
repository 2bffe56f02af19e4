package io.pglisten.dispatch;

import io.pglisten.ListenPolicy;
import io.pglisten.Notification;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-channel buffer between the connection's delivery thread and the channel's
 * {@link ChannelWorker}.
 *
 * <p>A mailbox has exactly one producer (the connection callback) and one consumer
 * (the worker). {@link #offer} never blocks, so it is safe to call from the
 * connection's delivery thread.
 *
 * @see FifoMailbox
 * @see LatestMailbox
 */
public interface Mailbox {

    /**
     * Creates the mailbox implementing the given policy.
     *
     * @param policy the delivery policy
     * @return a {@link FifoMailbox} for {@link ListenPolicy#ALL}, a {@link LatestMailbox}
     *     for {@link ListenPolicy#LAST}
     */
    static Mailbox forPolicy(ListenPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return switch (policy) {
            case ALL -> new FifoMailbox();
            case LAST -> new LatestMailbox();
        };
    }

    /**
     * Stores a notification without blocking.
     *
     * @param notification the notification to store
     * @return {@code true} if the notification was stored
     */
    boolean offer(Notification notification);

    /**
     * Takes the next notification, waiting up to {@code timeout} for one to arrive.
     *
     * @param timeout maximum time to wait
     * @return the next notification, or {@code null} if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    Notification poll(Duration timeout) throws InterruptedException;

    /**
     * Takes the next notification, waiting as long as necessary.
     *
     * @return the next notification
     * @throws InterruptedException if interrupted while waiting
     */
    Notification take() throws InterruptedException;

    /**
     * @return number of notifications currently waiting
     */
    int size();
}
