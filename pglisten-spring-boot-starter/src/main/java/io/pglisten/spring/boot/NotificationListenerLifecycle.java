package io.pglisten.spring.boot;

import io.pglisten.ListenSession;
import io.pglisten.NotificationHandler;
import io.pglisten.NotificationListener;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Starts a {@link ListenSession} for the registered handlers when the application
 * context starts, and closes it when the context stops.
 *
 * <p>No session is started when no {@link NotificationChannel} handler is registered.
 */
public class NotificationListenerLifecycle implements SmartLifecycle {
    private static final Logger logger = Logger.getLogger(NotificationListenerLifecycle.class.getName());

    private final NotificationListener listener;
    private final NotificationHandlerRegistrar registrar;
    private final PgListenProperties props;
    private volatile ListenSession session;

    public NotificationListenerLifecycle(NotificationListener listener, NotificationHandlerRegistrar registrar,
                                         PgListenProperties props) {
        this.listener = listener;
        this.registrar = registrar;
        this.props = props;
    }

    @Override
    public synchronized void start() {
        if (session != null) {
            return;
        }
        Map<String, NotificationHandler> handlers = registrar.handlers();
        if (handlers.isEmpty()) {
            logger.info("No @NotificationChannel handlers registered; listener not started");
            return;
        }
        Duration timeout = props.getNotificationTimeout();
        if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
            session = listener.start(handlers, props.getPolicy(), timeout);
        } else {
            session = listener.start(handlers, props.getPolicy());
        }
        logger.info("Started listening on channels " + handlers.keySet());
    }

    @Override
    public synchronized void stop() {
        ListenSession current = session;
        session = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public boolean isRunning() {
        return session != null;
    }

    /**
     * @return the active session, or {@code null} when not running
     */
    public ListenSession session() {
        return session;
    }
}
