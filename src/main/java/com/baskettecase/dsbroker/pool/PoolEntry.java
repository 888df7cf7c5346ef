package com.baskettecase.dsbroker.pool;

import java.util.concurrent.CompletableFuture;

/**
 * One pooled client. Building while the future is pending, Ready once it has completed normally.
 */
final class PoolEntry<C> {

    private final PoolKey key;
    private final CompletableFuture<C> future = new CompletableFuture<>();
    private final long revision;
    private final long createdAt;
    private volatile long lastUsed;

    PoolEntry(PoolKey key, long revision, long now) {
        this.key = key;
        this.revision = revision;
        this.createdAt = now;
        this.lastUsed = now;
    }

    PoolKey key() {
        return key;
    }

    CompletableFuture<C> future() {
        return future;
    }

    long revision() {
        return revision;
    }

    long createdAt() {
        return createdAt;
    }

    long lastUsed() {
        return lastUsed;
    }

    void touch(long now) {
        lastUsed = now;
    }

    boolean isReady() {
        return future.isDone() && !future.isCompletedExceptionally();
    }
}
