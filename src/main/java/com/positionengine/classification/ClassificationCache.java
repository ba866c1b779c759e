package com.positionengine.classification;

import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.ClassificationCacheEntry;
import com.positionengine.domain.model.ClassificationResult;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.SecurityProfile;
import com.positionengine.exception.BaseException;
import com.positionengine.lookup.SecurityLookupClient;
import com.positionengine.repository.ClassificationStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Resolves tickers to security types through four tiers, stopping at the first fresh answer:
 * <ol>
 *   <li><b>Memory</b>: {@link MemoryClassificationTier}.</li>
 *   <li><b>Persistent</b>: {@link ClassificationStore}. A hit is copied into memory. The first
 *       store failure in a batch disables the tier for the rest of that batch.</li>
 *   <li><b>Authoritative</b>: {@link SecurityLookupClient} on the bounded lookup executor,
 *       with the retry policy. Concurrent requests for the same ticker share one in-flight
 *       call. A success is written to the store, then to memory.</li>
 *   <li><b>Heuristic</b>: {@link HeuristicClassifier}. Always answers. Kept in memory only,
 *       for the short heuristic ttl, and never persisted. A cached heuristic answer is still
 *       reported as {@link SourceTier#HEURISTIC} and never replaces a fresh confirmed entry.</li>
 * </ol>
 *
 * <p>{@link #resolve} never throws for tier problems; every degradation becomes a warning in
 * the result.
 *
 * <p>The call timeout starts when a worker picks the lookup up, so time spent queued behind
 * the concurrency limit only counts against the batch timeout. The batch timeout bounds the
 * total wait, after which the remaining tickers go to the heuristic tier. A lookup that
 * exceeds its call timeout is discarded. A lookup still running when the batch gives up is
 * not cancelled: if it succeeds, its entry is written through and serves later batches.
 */
@Service
public class ClassificationCache {

    private static final Logger log = LoggerFactory.getLogger(ClassificationCache.class);

    private final MemoryClassificationTier memoryTier;
    private final ClassificationStore classificationStore;
    private final SecurityLookupClient securityLookupClient;
    private final AuthoritativeRetryPolicy retryPolicy;
    private final HeuristicClassifier heuristicClassifier;
    private final Executor lookupExecutor;
    private final Clock clock;

    private final Duration authoritativeTtl;
    private final Duration heuristicTtl;
    private final Duration callTimeout;
    private final Duration batchTimeout;

    /** One future per ticker being looked up right now; removed when the lookup settles. */
    private final ConcurrentHashMap<String, CompletableFuture<ClassificationCacheEntry>> inFlight =
            new ConcurrentHashMap<>();

    public ClassificationCache(
            MemoryClassificationTier memoryTier,
            ClassificationStore classificationStore,
            SecurityLookupClient securityLookupClient,
            AuthoritativeRetryPolicy retryPolicy,
            HeuristicClassifier heuristicClassifier,
            @Qualifier("classificationLookupExecutor") Executor lookupExecutor,
            ClassificationConfig classificationConfig,
            Clock clock) {
        this.memoryTier = memoryTier;
        this.classificationStore = classificationStore;
        this.securityLookupClient = securityLookupClient;
        this.retryPolicy = retryPolicy;
        this.heuristicClassifier = heuristicClassifier;
        this.lookupExecutor = lookupExecutor;
        this.clock = clock;
        this.authoritativeTtl = classificationConfig.getAuthoritative().getTtl();
        this.heuristicTtl = classificationConfig.getMemory().getHeuristicTtl();
        this.callTimeout = classificationConfig.getAuthoritative().getCallTimeout();
        this.batchTimeout = classificationConfig.getAuthoritative().getBatchTimeout();
    }

    public ClassificationResult resolve(Collection<String> tickers) {
        return resolve(tickers, Map.of());
    }

    /**
     * Resolves every distinct ticker. {@code hints} maps ticker to provider type hint and is
     * consulted by the heuristic tier only.
     */
    public ClassificationResult resolve(Collection<String> tickers, Map<String, String> hints) {
        return resolveInternal(tickers, hints, false);
    }

    /**
     * Skips the memory and persistent tiers and asks the authoritative source again. Tickers
     * the source cannot answer still get a heuristic type, but existing memory and persisted
     * entries are left untouched.
     */
    public ClassificationResult refresh(Collection<String> tickers) {
        return resolveInternal(tickers, Map.of(), true);
    }

    /** Drops a ticker from the memory tier only. */
    public void invalidateMemory(String ticker) {
        memoryTier.invalidate(ticker);
    }

    private ClassificationResult resolveInternal(
            Collection<String> tickers, Map<String, String> hints, boolean bypassCachedTiers) {
        long deadlineNanos = System.nanoTime() + batchTimeout.toNanos();
        BatchState batch = new BatchState();

        Set<String> distinct = new LinkedHashSet<>();
        if (tickers != null) {
            for (String ticker : tickers) {
                if (ticker != null && !ticker.isBlank()) {
                    distinct.add(ticker.trim());
                }
            }
        }

        List<String> pending = new ArrayList<>();
        for (String ticker : distinct) {
            if (bypassCachedTiers || !resolveFromCachedTiers(ticker, batch)) {
                pending.add(ticker);
            }
        }

        if (!pending.isEmpty()) {
            resolveAuthoritatively(pending, hints == null ? Map.of() : hints, deadlineNanos, !bypassCachedTiers, batch);
        }

        return new ClassificationResult(
                Collections.unmodifiableMap(batch.types),
                Collections.unmodifiableMap(batch.tiers),
                Collections.unmodifiableList(batch.warnings));
    }

    /** Memory, then persistent. Returns true when one of them answered. */
    private boolean resolveFromCachedTiers(String ticker, BatchState batch) {
        Optional<ClassificationCacheEntry> memoryHit = memoryTier.getFresh(ticker);
        if (memoryHit.isPresent()) {
            ClassificationCacheEntry entry = memoryHit.get();
            log.debug("Classification memory hit: {} -> {} ({})", ticker, entry.getSecurityType(), entry.getSourceTier());
            batch.record(ticker, entry.getSecurityType(),
                    entry.getSourceTier() == SourceTier.HEURISTIC ? SourceTier.HEURISTIC : SourceTier.MEMORY);
            return true;
        }

        if (!batch.storeAvailable) {
            return false;
        }

        Optional<ClassificationCacheEntry> stored;
        try {
            stored = classificationStore.get(ticker);
        } catch (RuntimeException e) {
            markStoreUnavailable(batch, e);
            return false;
        }

        if (stored.isPresent() && !stored.get().isStaleAt(clock.instant())) {
            ClassificationCacheEntry entry = stored.get();
            memoryTier.put(entry);
            log.debug("Classification persistent hit: {} -> {}", ticker, entry.getSecurityType());
            batch.record(ticker, entry.getSecurityType(), SourceTier.PERSISTENT);
            return true;
        }
        return false;
    }

    private void resolveAuthoritatively(
            List<String> pending,
            Map<String, String> hints,
            long deadlineNanos,
            boolean cacheHeuristics,
            BatchState batch) {
        Map<String, CompletableFuture<ClassificationCacheEntry>> lookups = new LinkedHashMap<>();
        for (String ticker : pending) {
            lookups.put(ticker, lookupOnce(ticker));
        }

        long remainingNanos = deadlineNanos - System.nanoTime();
        try {
            CompletableFuture.allOf(lookups.values().toArray(new CompletableFuture<?>[0]))
                    .get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Classification batch timeout after {}; unresolved tickers fall back to heuristics",
                    batchTimeout);
        } catch (ExecutionException e) {
            // Individual failures are examined per ticker below
            log.debug("At least one authoritative lookup failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for authoritative lookups");
        }

        for (Map.Entry<String, CompletableFuture<ClassificationCacheEntry>> lookup : lookups.entrySet()) {
            String ticker = lookup.getKey();
            CompletableFuture<ClassificationCacheEntry> future = lookup.getValue();

            if (future.isDone() && !future.isCompletedExceptionally()) {
                ClassificationCacheEntry entry = future.join();
                batch.record(ticker, entry.getSecurityType(), SourceTier.AUTHORITATIVE);
                continue;
            }

            Throwable cause = future.isDone() ? failureOf(future) : null;
            if (cause == null || cause instanceof TimeoutException) {
                batch.warnings.add(ConsolidationWarning.of(
                        WarningType.AUTHORITATIVE_LOOKUP_TIMEOUT,
                        ticker,
                        null,
                        cause == null
                                ? "Batch timeout reached before lookup finished"
                                : "Lookup exceeded " + callTimeout));
            } else {
                log.warn("Authoritative lookup failed for {}: {}", ticker, describe(cause));
                batch.warnings.add(ConsolidationWarning.of(
                        WarningType.AUTHORITATIVE_LOOKUP_FAILURE, ticker, null, describe(cause)));
            }
            resolveHeuristically(ticker, hints.get(ticker), cacheHeuristics, batch);
        }
    }

    /**
     * Returns the in-flight lookup for the ticker, starting one if none is running. The
     * future completes only after the result has been written through.
     */
    private CompletableFuture<ClassificationCacheEntry> lookupOnce(String ticker) {
        CompletableFuture<ClassificationCacheEntry> created = new CompletableFuture<>();
        CompletableFuture<ClassificationCacheEntry> existing = inFlight.putIfAbsent(ticker, created);
        if (existing != null) {
            log.debug("Joining in-flight lookup for {}", ticker);
            return existing;
        }

        CompletableFuture<SecurityProfile> call = new CompletableFuture<>();
        call.thenApply(profile -> commitAuthoritative(ticker, profile))
                .whenComplete((entry, error) -> {
                    inFlight.remove(ticker, created);
                    if (error != null) {
                        created.completeExceptionally(unwrap(error));
                    } else {
                        created.complete(entry);
                    }
                });
        try {
            lookupExecutor.execute(() -> runLookup(ticker, call));
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        return created;
    }

    /**
     * Runs on a lookup worker. Arming the timeout here rather than at submission keeps queue
     * time out of the per-call budget. Once the timeout fires, a late profile is ignored.
     */
    private void runLookup(String ticker, CompletableFuture<SecurityProfile> call) {
        call.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            call.complete(retryPolicy.execute(() -> securityLookupClient.lookup(ticker)));
        } catch (RuntimeException e) {
            call.completeExceptionally(e);
        }
    }

    private ClassificationCacheEntry commitAuthoritative(String ticker, SecurityProfile profile) {
        ClassificationCacheEntry entry = ClassificationCacheEntry.builder()
                .ticker(ticker)
                .securityType(profile.toSecurityType())
                .sourceTier(SourceTier.AUTHORITATIVE)
                .resolvedAt(clock.instant())
                .ttl(authoritativeTtl)
                .build();
        try {
            classificationStore.put(entry);
        } catch (RuntimeException e) {
            log.warn("Could not persist classification for {}: {}", ticker, describe(e));
        }
        memoryTier.put(entry);
        log.debug("Authoritative classification {} -> {}", ticker, entry.getSecurityType());
        return entry;
    }

    private void resolveHeuristically(String ticker, String hint, boolean cache, BatchState batch) {
        SecurityType type = heuristicClassifier.classify(ticker, hint);
        if (cache) {
            ClassificationCacheEntry held = memoryTier.putProvisional(ClassificationCacheEntry.builder()
                    .ticker(ticker)
                    .securityType(type)
                    .sourceTier(SourceTier.HEURISTIC)
                    .resolvedAt(clock.instant())
                    .ttl(heuristicTtl)
                    .build());
            if (held.getSourceTier() != SourceTier.HEURISTIC) {
                // A late lookup committed after the batch gave up on it
                log.debug("Keeping confirmed classification {} -> {} over heuristic {}",
                        ticker, held.getSecurityType(), type);
                batch.record(ticker, held.getSecurityType(), SourceTier.MEMORY);
                return;
            }
        }
        batch.record(ticker, type, SourceTier.HEURISTIC);
    }

    private void markStoreUnavailable(BatchState batch, RuntimeException e) {
        batch.storeAvailable = false;
        log.warn("Persistent classification store unavailable, skipping it for this batch: {}", describe(e));
        batch.warnings.add(ConsolidationWarning.of(
                WarningType.PERSISTENT_STORE_UNAVAILABLE, null, null, describe(e)));
    }

    /** Prefixes engine exceptions with their error code and appends any details. */
    private static String describe(Throwable error) {
        if (error instanceof BaseException) {
            BaseException base = (BaseException) error;
            String message = "[" + base.getErrorCode().getCode() + "] " + base.getMessage();
            return base.getDetails().isEmpty() ? message : message + " " + base.getDetails();
        }
        return error.getMessage();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return unwrap(e);
        } catch (RuntimeException e) {
            return e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class BatchState {
        private final Map<String, SecurityType> types = new LinkedHashMap<>();
        private final Map<String, SourceTier> tiers = new LinkedHashMap<>();
        private final List<ConsolidationWarning> warnings = new ArrayList<>();
        private boolean storeAvailable = true;

        private void record(String ticker, SecurityType type, SourceTier tier) {
            types.put(ticker, type);
            tiers.put(ticker, tier);
        }
    }
}
