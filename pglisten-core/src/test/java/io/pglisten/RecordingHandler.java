package io.pglisten;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Handler collecting every event it receives, optionally sleeping per call. */
public final class RecordingHandler implements NotificationHandler {
    private final long delayMs;
    private final List<NotificationOrTimeout> events = new CopyOnWriteArrayList<>();

    public RecordingHandler() {
        this(0);
    }

    public RecordingHandler(long delayMs) {
        this.delayMs = delayMs;
    }

    @Override
    public void handle(NotificationOrTimeout event) throws Exception {
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
        events.add(event);
    }

    public List<NotificationOrTimeout> events() {
        return events;
    }

    public boolean awaitCount(int count, Duration timeout) throws InterruptedException {
        return FakeListenConnectionFactory.waitFor(() -> events.size() >= count, timeout);
    }
}
