package io.pglisten.dispatch;

import io.pglisten.Notification;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded first-in first-out mailbox used by {@link io.pglisten.ListenPolicy#ALL}.
 * Every offered notification is delivered exactly once, in offer order.
 */
public final class FifoMailbox implements Mailbox {
    private final BlockingQueue<Notification> queue = new LinkedBlockingQueue<>();

    @Override
    public boolean offer(Notification notification) {
        return queue.offer(Objects.requireNonNull(notification, "notification"));
    }

    @Override
    public Notification poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public Notification take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
