package org.stianloader.picoinstall.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;
import org.stianloader.picoinstall.installer.TaskQueue;

public class TaskQueueTest {

    @Test
    public void testRunsInOrderOneAtATime() throws Exception {
        TaskQueue queue = new TaskQueue();
        List<String> events = new ArrayList<>();
        CompletableFuture<Void> firstBody = new CompletableFuture<>();

        CompletableFuture<String> first = queue.run(() -> {
            events.add("first started");
            return firstBody.thenApply((ignored) -> "first");
        });
        CompletableFuture<String> second = queue.run(() -> {
            events.add("second started");
            return CompletableFuture.completedFuture("second");
        });

        assertEquals(List.of("first started"), events);
        assertFalse(second.isDone());
        firstBody.complete(null);
        assertEquals("first", first.get());
        assertEquals("second", second.get());
        assertEquals(List.of("first started", "second started"), events);
    }

    @Test
    public void testFailureReleasesPermit() throws Exception {
        TaskQueue queue = new TaskQueue();
        CompletableFuture<Object> failing = queue.run(() -> {
            throw new IllegalStateException("broken task");
        });
        ExecutionException e = assertThrows(ExecutionException.class, failing::get);
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals("ok", queue.run(() -> CompletableFuture.completedFuture("ok")).get());
    }

    @Test
    public void testCancelledWaiterIsSkipped() throws Exception {
        TaskQueue queue = new TaskQueue();
        TaskQueue.Permit permit = queue.acquire().get();
        CompletableFuture<TaskQueue.Permit> cancelled = queue.acquire();
        CompletableFuture<TaskQueue.Permit> waiting = queue.acquire();
        cancelled.cancel(false);
        permit.close();
        // Closing twice does not release twice
        permit.close();
        assertTrue(waiting.isDone());
        CompletableFuture<TaskQueue.Permit> next = queue.acquire();
        assertFalse(next.isDone());
        waiting.get().close();
        assertTrue(next.isDone());
    }
}
