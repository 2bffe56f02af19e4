package io.pglisten;

/**
 * Handles the events of one channel.
 *
 * <h2>Execution Model</h2>
 * <p>Each channel has its own dispatch worker thread. Invocations for one channel
 * are strictly sequential; a slow handler delays only its own channel.
 *
 * <h2>Error Handling</h2>
 * <p>Exceptions thrown by a handler are logged and discarded. The next event of the
 * channel is delivered as usual. Throwing {@link InterruptedException} stops the
 * worker and should only happen when the session is shutting down.
 *
 * @see NotificationListener
 */
@FunctionalInterface
public interface NotificationHandler {

    /**
     * Processes a notification or a timeout event.
     *
     * @param event the event to handle
     * @throws Exception if processing fails; the failure is logged and isolated
     */
    void handle(NotificationOrTimeout event) throws Exception;
}
