package com.baskettecase.dsbroker.pool;

import com.baskettecase.dsbroker.config.BrokerProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client Pool
 *
 * Caches one network client per (data source id, connection fingerprint). Each key moves
 * through {@code Absent -> Building -> Ready}; concurrent requests for a key that is
 * Building wait on the same construction, so exactly one client is built per key.
 * A failed construction removes the key again, so the next request retries.
 *
 * Entries are never mutated in place: a changed credential produces a new fingerprint and
 * therefore a new entry. Superseded, idle and over-capacity entries are retired, i.e. removed
 * from the map and closed after a grace period so that in-flight users can finish.
 */
@Slf4j
public class ClientPool<C extends Closeable> {

    private final String name;
    private final ClientFactory<C> factory;
    private final BrokerProperties.Pool settings;
    private final Clock clock;

    private final ConcurrentMap<PoolKey, PoolEntry<C>> entries = new ConcurrentHashMap<>();
    private final Set<C> retired = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final ExecutorService constructionExecutor;
    private final ScheduledExecutorService housekeeper;

    private final Counter constructionCounter;
    private final Counter constructionFailureCounter;
    private final Counter evictionCounter;

    public ClientPool(String name, ClientFactory<C> factory, BrokerProperties.Pool settings,
                      MeterRegistry meterRegistry) {
        this(name, factory, settings, meterRegistry, Clock.systemUTC());
    }

    public ClientPool(String name, ClientFactory<C> factory, BrokerProperties.Pool settings,
                      MeterRegistry meterRegistry, Clock clock) {
        this.name = name;
        this.factory = factory;
        this.settings = settings;
        this.clock = clock;

        this.constructionExecutor = Executors.newCachedThreadPool(daemonThreads(name + "-build"));
        this.housekeeper = Executors.newSingleThreadScheduledExecutor(daemonThreads(name + "-housekeeper"));

        Gauge.builder("dsbroker.pool.entries", entries, Map::size)
            .description("Number of pooled clients, building or ready")
            .tag("pool", name)
            .register(meterRegistry);
        this.constructionCounter = Counter.builder("dsbroker.pool.constructions")
            .description("Client construction attempts")
            .tag("pool", name)
            .register(meterRegistry);
        this.constructionFailureCounter = Counter.builder("dsbroker.pool.construction.failures")
            .description("Failed client constructions")
            .tag("pool", name)
            .register(meterRegistry);
        this.evictionCounter = Counter.builder("dsbroker.pool.evictions")
            .description("Clients retired from the pool")
            .tag("pool", name)
            .register(meterRegistry);

        long sweepMillis = Math.max(1000L, Math.min(settings.getIdleTimeout().toMillis(), 60_000L));
        housekeeper.scheduleAtFixedRate(this::evictIdle, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);

        log.info("Client pool '{}': max={}, idle={}, acquireTimeout={}",
            name, settings.getMaxSize(), settings.getIdleTimeout(), settings.getAcquireTimeout());
    }

    /**
     * Get the client for a data source, building it if necessary.
     * Blocks only while this key is being built, bounded by the acquire timeout.
     *
     * @throws PoolConstructionException if construction fails or the wait times out
     * @throws IllegalStateException if the pool has been shut down
     */
    public C getOrCreate(String dataSourceId, ConnectionParams params) {
        CompletableFuture<C> future = getOrCreateAsync(dataSourceId, params);
        Duration timeout = settings.getAcquireTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PoolConstructionException poolException) {
                throw poolException;
            }
            throw new PoolConstructionException(dataSourceId, cause);
        } catch (TimeoutException e) {
            // Only this caller gives up; the shared construction carries on
            throw new PoolConstructionException(dataSourceId,
                "Timed out after " + timeout + " waiting for client of data source " + dataSourceId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolConstructionException(dataSourceId,
                "Interrupted while waiting for client of data source " + dataSourceId);
        }
    }

    /**
     * Asynchronous variant of {@link #getOrCreate}.
     *
     * Each caller gets its own dependent future; cancelling it does not cancel the shared
     * construction other callers are waiting on.
     */
    public CompletableFuture<C> getOrCreateAsync(String dataSourceId, ConnectionParams params) {
        ensureOpen();

        PoolKey key = new PoolKey(dataSourceId, params.fingerprint());
        PoolEntry<C> entry = entries.get(key);
        boolean owner = false;
        if (entry == null) {
            PoolEntry<C> candidate = new PoolEntry<>(key, params.revision(), clock.millis());
            entry = entries.putIfAbsent(key, candidate);
            if (entry == null) {
                entry = candidate;
                owner = true;
            }
        }
        entry.touch(clock.millis());

        if (owner) {
            if (closed.get()) {
                // Lost a race with shutdown
                entries.remove(key, entry);
                entry.future().completeExceptionally(new IllegalStateException("Client pool '" + name + "' is shut down"));
            } else {
                build(entry, params);
                retireSuperseded(entry);
                enforceCapacity();
            }
        } else {
            log.debug("Reusing pooled client {}", key);
        }

        return entry.future().copy();
    }

    /**
     * Retire every pooled client of a data source
     *
     * @return Number of entries retired
     */
    public int invalidate(String dataSourceId) {
        int count = 0;
        for (PoolEntry<C> entry : new ArrayList<>(entries.values())) {
            if (entry.key().dataSourceId().equals(dataSourceId) && entries.remove(entry.key(), entry)) {
                retire(entry, "invalidated");
                count++;
            }
        }
        return count;
    }

    /**
     * Retire ready entries that have not been used within the idle timeout
     */
    public void evictIdle() {
        long cutoff = clock.millis() - settings.getIdleTimeout().toMillis();
        for (PoolEntry<C> entry : new ArrayList<>(entries.values())) {
            if (entry.isReady() && entry.lastUsed() < cutoff && entries.remove(entry.key(), entry)) {
                retire(entry, "idle");
            }
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * State of each entry keyed by {@code id@fingerprint}, for diagnostics
     */
    public Map<String, String> getEntryStates() {
        Map<String, String> states = new LinkedHashMap<>();
        entries.forEach((key, entry) -> states.put(key.toString(), entry.isReady() ? "READY" : "BUILDING"));
        return states;
    }

    public boolean isShutdown() {
        return closed.get();
    }

    /**
     * Close every pooled client. Waits (bounded by the shutdown timeout) for in-flight
     * constructions first. Safe to call more than once.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            log.debug("Client pool '{}' already shut down", name);
            return;
        }

        List<PoolEntry<C>> snapshot = new ArrayList<>(entries.values());
        log.info("Shutting down client pool '{}' with {} entries", name, snapshot.size());

        CompletableFuture<?>[] pending = snapshot.stream()
            .map(entry -> entry.future().handle((client, error) -> null))
            .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(pending).get(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Client pool '{}': in-flight constructions still running after {}; they will be closed on completion",
                name, settings.getShutdownTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Client pool '{}': interrupted while waiting for in-flight constructions", name);
        } catch (ExecutionException e) {
            // handle() above never completes exceptionally
            throw new IllegalStateException(e);
        }

        for (PoolEntry<C> entry : snapshot) {
            entries.remove(entry.key(), entry);
            entry.future().thenAccept(this::closeClient);
        }

        housekeeper.shutdownNow();
        for (C client : new ArrayList<>(retired)) {
            if (retired.remove(client)) {
                closeClient(client);
            }
        }
        constructionExecutor.shutdown();
        log.info("Client pool '{}' shut down", name);
    }

    private void build(PoolEntry<C> entry, ConnectionParams params) {
        PoolKey key = entry.key();
        constructionCounter.increment();
        log.info("Creating client for {} ({})", key, params.endpoint());
        try {
            constructionExecutor.execute(() -> {
                try {
                    C client = factory.create(params);
                    entry.future().complete(client);
                    log.info("Client ready for {}", key);
                } catch (Exception e) {
                    fail(entry, e);
                }
            });
        } catch (RejectedExecutionException e) {
            fail(entry, e);
        }
    }

    private void fail(PoolEntry<C> entry, Exception cause) {
        constructionFailureCounter.increment();
        // Back to Absent before waiters are released, so a retry starts from scratch
        entries.remove(entry.key(), entry);
        log.error("Failed to create client for {}: {}", entry.key(), cause.getMessage());
        entry.future().completeExceptionally(new PoolConstructionException(entry.key().dataSourceId(), cause));
    }

    // Of two entries for one data source the lower revision goes, so a stale caller cannot evict a newer client
    private void retireSuperseded(PoolEntry<C> current) {
        PoolKey currentKey = current.key();
        for (PoolEntry<C> entry : new ArrayList<>(entries.values())) {
            PoolKey key = entry.key();
            if (!key.dataSourceId().equals(currentKey.dataSourceId()) || key.equals(currentKey)) {
                continue;
            }
            if (entry.revision() <= current.revision()) {
                if (entries.remove(key, entry)) {
                    retire(entry, "superseded by " + currentKey.fingerprint());
                }
            } else if (entries.remove(currentKey, current)) {
                retire(current, "stale, revision " + current.revision() + " < " + entry.revision());
                return;
            }
        }
    }

    private void enforceCapacity() {
        while (entries.size() > settings.getMaxSize()) {
            Optional<PoolEntry<C>> eldest = entries.values().stream()
                .filter(PoolEntry::isReady)
                .min(Comparator.comparingLong(PoolEntry::lastUsed));
            if (eldest.isEmpty()) {
                return;
            }
            PoolEntry<C> entry = eldest.get();
            if (entries.remove(entry.key(), entry)) {
                retire(entry, "capacity");
            }
        }
    }

    private void retire(PoolEntry<C> entry, String reason) {
        evictionCounter.increment();
        log.info("Retiring pooled client {} ({}, age {})", entry.key(), reason,
            Duration.ofMillis(clock.millis() - entry.createdAt()));
        entry.future().thenAccept(client -> scheduleClose(client));
    }

    private void scheduleClose(C client) {
        retired.add(client);
        try {
            housekeeper.schedule(() -> {
                if (retired.remove(client)) {
                    closeClient(client);
                }
            }, settings.getRetireGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (retired.remove(client)) {
                closeClient(client);
            }
        }
    }

    private void closeClient(C client) {
        try {
            client.close();
        } catch (IOException e) {
            log.warn("Error closing pooled client: {}", e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Client pool '" + name + "' is shut down");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
