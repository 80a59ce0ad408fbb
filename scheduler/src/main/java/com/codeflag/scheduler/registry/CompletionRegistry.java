package com.codeflag.scheduler.registry;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Correlates a waiter with a value that arrives later on another thread.
 *
 * <ul>
 *   <li>{@link #register} creates the handle a caller blocks on.</li>
 *   <li>{@link #resolve} removes the handle and completes it, waking exactly one waiter.</li>
 *   <li>{@link #cancel} removes the handle without completing it (the waiter gave up).</li>
 * </ul>
 *
 * Every operation is a single atomic map operation on its key, so a resolve
 * racing a cancel sees the handle at most once: either the value is delivered
 * or it is dropped, never both. Nothing here knows about queues or HTTP.
 */
public class CompletionRegistry<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> pending = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a handle for {@code key} is already outstanding
     */
    public CompletableFuture<V> register(K key) {
        CompletableFuture<V> handle = new CompletableFuture<>();
        if (pending.putIfAbsent(key, handle) != null) {
            throw new IllegalStateException("A handle is already registered for " + key);
        }
        return handle;
    }

    /** @return false if nobody is waiting for {@code key} (unknown, already resolved, or cancelled) */
    public boolean resolve(K key, V value) {
        CompletableFuture<V> handle = pending.remove(key);
        return handle != null && handle.complete(value);
    }

    /** @return true if a handle was outstanding and has now been discarded */
    public boolean cancel(K key) {
        return pending.remove(key) != null;
    }

    public boolean isPending(K key) {
        return pending.containsKey(key);
    }

    /** Fail every outstanding handle, e.g. on shutdown, so no thread stays blocked. */
    public void cancelAll() {
        pending.keySet().forEach(key -> {
            CompletableFuture<V> handle = pending.remove(key);
            if (handle != null) {
                handle.completeExceptionally(new CancellationException("Registry shut down"));
            }
        });
    }
}
