package io.lightchain.core.task;

import io.lightchain.core.metrics.SpvMetrics;
import io.lightchain.core.rpc.ChainServer;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A job bound to one server connection. {@link #start} runs the job's tasks in a fresh {@link TaskGroup};
 * a failing task cancels the group, stops the job and is handed to the failure listener (which
 * typically drops the connection on a {@link GracefulDisconnectException}).
 */
public abstract class NetworkJob {
    private static final Logger LOG = Logger.getLogger(NetworkJob.class.getName());

    @FunctionalInterface
    public interface ServerCall<T> {
        T call(ChainServer server) throws InterruptedException;
    }

    private final String name;
    private final Semaphore requestSlots;
    private final AtomicInteger requestsSent = new AtomicInteger();
    private final AtomicInteger requestsAnswered = new AtomicInteger();
    private volatile Consumer<Throwable> failureListener = t -> {};
    private volatile ChainServer server;
    private volatile TaskGroup group;

    protected NetworkJob(String name, Semaphore requestSlots) {
        this.name = Objects.requireNonNull(name, "name");
        this.requestSlots = Objects.requireNonNull(requestSlots, "requestSlots");
    }

    public String name() {
        return name;
    }

    public void setFailureListener(Consumer<Throwable> listener) {
        this.failureListener = listener == null ? t -> {} : listener;
    }

    public synchronized void start(ChainServer server) {
        if (group != null) {
            throw new IllegalStateException(name + " already running");
        }
        this.server = Objects.requireNonNull(server, "server");
        resetRequestCounters();
        TaskGroup g = new TaskGroup(name, this::onGroupFailure);
        this.group = g;
        runTasks(g);
        LOG.fine(() -> name + " started");
    }

    public synchronized void stop() {
        TaskGroup g = group;
        group = null;
        if (g != null) {
            g.cancel();
            LOG.fine(() -> name + " stopped");
        }
    }

    public synchronized void restart(ChainServer server) {
        stop();
        reset();
        start(server);
    }

    public boolean isRunning() {
        TaskGroup g = group;
        return g != null && !g.isCancelled();
    }

    protected TaskGroup group() {
        TaskGroup g = group;
        if (g == null) {
            throw new IllegalStateException(name + " is not running");
        }
        return g;
    }

    protected ChainServer server() {
        return server;
    }

    /** Spawns the job's long-running tasks. */
    protected abstract void runTasks(TaskGroup group);

    /** Clears per-connection state before a restart. */
    protected abstract void reset();

    /** One request against the server, bounded by the shared request slots and counted. */
    protected <T> T request(ServerCall<T> call) throws InterruptedException {
        requestSlots.acquire();
        try {
            requestsSent.incrementAndGet();
            SpvMetrics.incrementRequestsSent();
            return call.call(server);
        } finally {
            requestsAnswered.incrementAndGet();
            SpvMetrics.incrementRequestsAnswered();
            requestSlots.release();
        }
    }

    public int requestsSent() {
        return requestsSent.get();
    }

    public int requestsAnswered() {
        return requestsAnswered.get();
    }

    public void resetRequestCounters() {
        requestsSent.set(0);
        requestsAnswered.set(0);
    }

    private void onGroupFailure(Throwable t) {
        if (t instanceof GracefulDisconnectException) {
            LOG.log(Level.WARNING, name + ": disconnecting from server", t);
        } else {
            LOG.log(Level.WARNING, name + " failed", t);
        }
        synchronized (this) {
            group = null;
        }
        failureListener.accept(t);
    }
}
