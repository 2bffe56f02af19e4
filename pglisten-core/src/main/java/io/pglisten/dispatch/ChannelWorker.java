package io.pglisten.dispatch;

import io.pglisten.Notification;
import io.pglisten.NotificationHandler;
import io.pglisten.NotificationOrTimeout;
import io.pglisten.Timeout;
import io.pglisten.spi.MetricsExporter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-lived task that drains one channel's {@link Mailbox} and invokes the channel's
 * {@link NotificationHandler}.
 *
 * <p>When no notification arrives within the notification timeout the handler receives
 * a {@link Timeout} instead; the wait window restarts after every delivered event.
 * Handler failures are logged and do not stop the loop. The worker runs until
 * {@link #stop()} is called or its thread is interrupted, and never sees the connection
 * itself.
 */
public final class ChannelWorker implements Runnable {
    private static final Logger logger = Logger.getLogger(ChannelWorker.class.getName());

    private final String channel;
    private final Mailbox mailbox;
    private final NotificationHandler handler;
    private final Duration notificationTimeout;
    private final MetricsExporter metrics;
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * @param channel             the channel this worker serves
     * @param mailbox             the channel's mailbox
     * @param handler             the channel's handler
     * @param notificationTimeout silence after which a {@link Timeout} is delivered,
     *                            or {@code null} to never deliver timeouts
     * @param metrics             the metrics exporter
     */
    public ChannelWorker(String channel, Mailbox mailbox, NotificationHandler handler,
                         Duration notificationTimeout, MetricsExporter metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (notificationTimeout != null && (notificationTimeout.isNegative() || notificationTimeout.isZero())) {
            throw new IllegalArgumentException("notificationTimeout must be > 0");
        }
        this.notificationTimeout = notificationTimeout;
    }

    public String channel() {
        return channel;
    }

    /**
     * Asks the loop to exit before its next event, even when a handler has cleared the
     * thread's interrupt flag.
     */
    public void stop() {
        running.set(false);
    }

    @Override
    public void run() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                NotificationOrTimeout event = next();
                if (!running.get() || !deliver(event)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Worker loop error on channel " + channel, t);
            }
        }
        logger.fine(() -> "Worker for channel " + channel + " stopped");
    }

    private NotificationOrTimeout next() throws InterruptedException {
        if (notificationTimeout == null) {
            return mailbox.take();
        }
        Notification notification = mailbox.poll(notificationTimeout);
        if (notification == null) {
            metrics.incrementTimeout(channel);
            return new Timeout(channel);
        }
        return notification;
    }

    /**
     * Returns {@code false} when the handler was interrupted and the worker must stop.
     */
    private boolean deliver(NotificationOrTimeout event) {
        long startNanos = System.nanoTime();
        try {
            handler.handle(event);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            metrics.incrementHandlerFailure(channel);
            logger.log(Level.SEVERE, "Failed to handle " + event, e);
            return true;
        } finally {
            metrics.recordHandlerDurationMs(channel,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            metrics.recordMailboxDepth(channel, mailbox.size());
        }
    }
}
