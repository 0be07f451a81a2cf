package io.lightchain.core.task;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tasks that live and die together. The first task to fail cancels every other task of the group and
 * reports the failure once; later failures are dropped. A task that is interrupted counts as cancelled,
 * not failed, so a single task can be stopped through its future.
 */
public final class TaskGroup implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TaskGroup.class.getName());

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private final String name;
    private final ExecutorService executor;
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final Consumer<Throwable> onFailure;
    private volatile boolean cancelled;

    public TaskGroup(String name) {
        this(name, null);
    }

    public TaskGroup(String name, Consumer<Throwable> onFailure) {
        this.name = name;
        this.onFailure = onFailure;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String name() {
        return name;
    }

    public Future<?> spawn(Task task) {
        if (cancelled) {
            throw new IllegalStateException("task group " + name + " is cancelled");
        }
        Future<?> future;
        try {
            future = executor.submit(() -> {
                try {
                    task.run();
                } catch (InterruptedException e) {
                    // interruption is cancellation, of the group or of this one task
                    Thread.currentThread().interrupt();
                } catch (Throwable t) {
                    fail(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("task group " + name + " is cancelled", e);
        }
        tasks.add(future);
        return future;
    }

    private void fail(Throwable t) {
        if (cancelled || !failure.compareAndSet(null, t)) {
            LOG.log(Level.FINE, "[" + name + "] further task failure after cancellation", t);
            return;
        }
        LOG.log(Level.FINE, "[" + name + "] task failed, cancelling group", t);
        cancel();
        if (onFailure != null) {
            onFailure.accept(t);
        }
    }

    public void cancel() {
        cancelled = true;
        for (Future<?> f : tasks) {
            f.cancel(true);
        }
        executor.shutdownNow();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure.get());
    }

    /** Waits for every task spawned so far, then rethrows the first failure if there was one. */
    public void join() throws InterruptedException {
        for (Future<?> f : tasks) {
            try {
                f.get();
            } catch (CancellationException e) {
                LOG.finest(() -> "[" + name + "] joined a cancelled task");
            } catch (ExecutionException e) {
                // task bodies catch everything; only an executor fault lands here
                failure.compareAndSet(null, e.getCause());
            }
        }
        Throwable t = failure.get();
        if (t instanceof RuntimeException re) {
            throw re;
        }
        if (t instanceof Error err) {
            throw err;
        }
        if (t != null) {
            throw new IllegalStateException("task in group " + name + " failed", t);
        }
    }

    @Override
    public void close() {
        cancel();
    }
}
