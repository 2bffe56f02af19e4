package io.pglisten.dispatch;

import io.pglisten.Notification;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot mailbox used by {@link io.pglisten.ListenPolicy#LAST}.
 *
 * <p>{@link #offer} overwrites whatever the slot holds; the consumer takes the value
 * and leaves the slot empty. A burst arriving while the consumer is busy collapses
 * into its last notification.
 */
public final class LatestMailbox implements Mailbox {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition filled = lock.newCondition();
    private Notification slot;

    @Override
    public boolean offer(Notification notification) {
        Objects.requireNonNull(notification, "notification");
        lock.lock();
        try {
            slot = notification;
            filled.signal();
        } finally {
            lock.unlock();
        }
        return true;
    }

    @Override
    public Notification poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (slot == null) {
                if (remainingNanos <= 0L) {
                    return null;
                }
                remainingNanos = filled.awaitNanos(remainingNanos);
            }
            return takeSlot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Notification take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (slot == null) {
                filled.await();
            }
            return takeSlot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return slot == null ? 0 : 1;
        } finally {
            lock.unlock();
        }
    }

    private Notification takeSlot() {
        Notification taken = slot;
        slot = null;
        return taken;
    }
}
