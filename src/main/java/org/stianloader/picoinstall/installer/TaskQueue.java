package org.stianloader.picoinstall.installer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoinstall.internal.ConcurrencyUtil;

/**
 * An asynchronous queue that runs at most one task at a time. Tasks run in the order in which they
 * were queued. Waiting for a turn does not block a thread.
 */
public final class TaskQueue {

    /**
     * The right to run. Must be closed once the task is done, after which the next queued task is started.
     */
    public final class Permit implements AutoCloseable {
        @NotNull
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (this.released.compareAndSet(false, true)) {
                TaskQueue.this.release();
            }
        }
    }

    @NotNull
    private final Deque<CompletableFuture<Permit>> waiting = new ArrayDeque<>();
    private boolean taken;

    /**
     * Waits for the permit.
     *
     * @return A future completing with the permit once every previously queued task is done
     */
    @NotNull
    public CompletableFuture<Permit> acquire() {
        synchronized (this) {
            if (!this.taken) {
                this.taken = true;
                return CompletableFuture.completedFuture(new Permit());
            }
            CompletableFuture<Permit> future = new CompletableFuture<>();
            this.waiting.add(future);
            return future;
        }
    }

    private void release() {
        while (true) {
            CompletableFuture<Permit> next;
            synchronized (this) {
                next = this.waiting.poll();
                if (next == null) {
                    this.taken = false;
                    return;
                }
            }
            // A waiter that was cancelled never gets to see the permit
            if (next.complete(new Permit())) {
                return;
            }
        }
    }

    /**
     * Queues a task. The task is started once the permit was acquired, and the permit is released once the future
     * returned by the task completes.
     *
     * @param <T> The result type of the task
     * @param task The task to run
     * @return A future completing with the result of the task
     */
    @NotNull
    public <T> CompletableFuture<T> run(@NotNull Supplier<CompletableFuture<T>> task) {
        return this.acquire().thenCompose((permit) -> {
            CompletableFuture<T> result;
            try {
                result = task.get();
            } catch (Throwable t) {
                permit.close();
                ConcurrencyUtil.sneakyThrow(t);
                throw new InternalError();
            }
            return result.whenComplete((ignored, ex) -> permit.close());
        });
    }
}
