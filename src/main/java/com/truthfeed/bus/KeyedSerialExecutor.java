package com.truthfeed.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs tasks on a shared executor while keeping tasks that share a key
 * strictly ordered and non-overlapping. Tasks under different keys run
 * concurrently.
 */
public class KeyedSerialExecutor {

    private static final Logger log = LoggerFactory.getLogger(KeyedSerialExecutor.class);

    private final Executor delegate;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    /**
     * Queues {@code task} behind every earlier task submitted with {@code key}.
     * A failing task is logged and does not block later ones.
     */
    public CompletableFuture<Void> submit(String key, Runnable task) {
        CompletableFuture<Void> trigger = new CompletableFuture<>();
        CompletableFuture<Void> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<Void> previous = tail != null
                ? tail.handle((ignored, ex) -> null)
                : CompletableFuture.completedFuture(null);
            return trigger
                .thenCompose(ignored -> previous)
                .thenRunAsync(() -> runLogged(k, task), delegate);
        });
        next.whenComplete((ignored, ex) -> tails.remove(key, next));
        // Started outside compute() so a synchronous delegate never runs the task under the map's bin lock.
        trigger.complete(null);
        return next;
    }

    private void runLogged(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            log.warn("Serial task failed for key={}: {}", key, ex.getMessage());
            throw ex;
        }
    }
}
