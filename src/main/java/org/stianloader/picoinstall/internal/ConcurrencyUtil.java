package org.stianloader.picoinstall.internal;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void sneakyThrow(Throwable t) throws T {
        throw (T) t;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers
     * {@link CompletableFuture} likes to put around exceptions.
     *
     * @param t The throwable to unwrap
     * @return The innermost cause that is not a wrapper
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Creates a future that completes once all futures of the collection completed. Unlike
     * {@link CompletableFuture#allOf(CompletableFuture...)}, the first exception is reported
     * directly (not wrapped) and further exceptions are attached to it as suppressed exceptions.
     *
     * @param futures The futures to wait for
     * @return A future that completes once all sources completed
     */
    @NotNull
    public static CompletableFuture<Void> allOf(@NotNull Collection<? extends CompletableFuture<?>> futures) {
        CompletableFuture<?>[] array = futures.toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(array).handle((ignored, ex) -> {
            if (ex == null) {
                return null;
            }
            Throwable first = null;
            for (CompletableFuture<?> future : array) {
                if (!future.isCompletedExceptionally()) {
                    continue;
                }
                Throwable cause;
                try {
                    future.join();
                    continue;
                } catch (CompletionException | CancellationException e) {
                    cause = ConcurrencyUtil.unwrap(e);
                }
                if (first == null) {
                    first = cause;
                } else if (first != cause) {
                    first.addSuppressed(cause);
                }
            }
            ConcurrencyUtil.sneakyThrow(first == null ? ConcurrencyUtil.unwrap(ex) : first);
            throw new InternalError();
        });
    }
}
