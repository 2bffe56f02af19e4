package io.pglisten;

import io.pglisten.connection.ConnectionSupervisor;
import io.pglisten.dispatch.ChannelWorker;
import io.pglisten.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A running listen session: one connection supervisor thread plus one dispatch worker
 * thread per channel.
 *
 * <p>Obtained from {@link NotificationListener#start}. {@link #close()} cancels every
 * task and waits for all of them to terminate, bounded by the listener's shutdown
 * timeout. Cancellation is idempotent: only the first {@link #cancel()} has an effect.
 *
 * <p>This class is thread-safe.
 */
public final class ListenSession implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ListenSession.class.getName());

    private final Set<String> channels;
    private final List<ChannelWorker> workers;
    private final ExecutorService supervisorExecutor;
    private final ExecutorService workerExecutor;
    private final long shutdownTimeoutMs;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ListenSession(ConnectionSupervisor supervisor, List<ChannelWorker> workers, Duration shutdownTimeout) {
        Set<String> names = new LinkedHashSet<>();
        for (ChannelWorker worker : workers) {
            names.add(worker.channel());
        }
        this.channels = Collections.unmodifiableSet(names);
        this.workers = workers;
        this.shutdownTimeoutMs = shutdownTimeout.toMillis();

        this.workerExecutor = Executors.newFixedThreadPool(workers.size(), new DaemonThreadFactory("pglisten-worker-"));
        for (ChannelWorker worker : workers) {
            workerExecutor.execute(worker);
        }
        this.supervisorExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("pglisten-supervisor-"));
        supervisorExecutor.execute(supervisor);
    }

    static ListenSession start(ConnectionSupervisor supervisor, List<ChannelWorker> workers, Duration shutdownTimeout) {
        return new ListenSession(supervisor, new ArrayList<>(workers), shutdownTimeout);
    }

    /**
     * @return the subscribed channel names, in handler-map iteration order
     */
    public Set<String> channels() {
        return channels;
    }

    /**
     * @return {@code true} until the supervisor and every worker have terminated
     */
    public boolean isRunning() {
        return !(supervisorExecutor.isTerminated() && workerExecutor.isTerminated());
    }

    /**
     * @return {@code true} once {@link #cancel()} or {@link #close()} was called
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Requests cancellation of the supervisor and every worker without waiting.
     * Backoff sleeps and mailbox waits are aborted immediately; an in-flight handler is
     * interrupted. Subsequent calls are no-ops.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        logger.fine(() -> "Cancelling listen session for channels " + channels);
        for (ChannelWorker worker : workers) {
            worker.stop();
        }
        supervisorExecutor.shutdownNow();
        workerExecutor.shutdownNow();
    }

    /**
     * Blocks until every task of this session has terminated. Tasks only terminate
     * after cancellation, so this returns once another thread cancelled the session.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws InterruptedException {
        supervisorExecutor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        workerExecutor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    }

    /**
     * Blocks until every task of this session has terminated or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if every task terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!supervisorExecutor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        return workerExecutor.awaitTermination(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    /**
     * Cancels the session and waits up to the shutdown timeout for every task to
     * terminate. A handler that ignores interruption past the timeout is abandoned on
     * its daemon thread and reported.
     */
    @Override
    public void close() {
        cancel();
        try {
            if (!await(Duration.ofMillis(shutdownTimeoutMs))) {
                logger.log(Level.WARNING, "Shutdown timeout of " + shutdownTimeoutMs
                        + " ms exceeded; some tasks of channels " + channels + " are still running");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
