package com.positionengine.classification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.enums.SourceTier;
import com.positionengine.domain.model.ClassificationCacheEntry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * In-process tier: a size-bounded Caffeine cache. Caffeine's W-TinyLFU admission keeps the
 * frequently requested tickers once the bound is reached.
 *
 * <p>Each entry expires after its own remaining ttl, so heuristic answers leave after minutes
 * while authoritative ones stay for weeks. Staleness is also rechecked on read against the
 * injected clock.
 */
@Component
public class MemoryClassificationTier {

    private final Cache<String, ClassificationCacheEntry> cache;
    private final Clock clock;

    public MemoryClassificationTier(ClassificationConfig classificationConfig, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(classificationConfig.getMemory().getMaximumSize())
                .expireAfter(new RemainingTtlExpiry(clock))
                .build();
    }

    /** Fresh entry for the ticker, or empty on miss. A stale entry is dropped. */
    public Optional<ClassificationCacheEntry> getFresh(String ticker) {
        ClassificationCacheEntry entry = cache.getIfPresent(ticker);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isStaleAt(clock.instant())) {
            cache.asMap().remove(ticker, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(ClassificationCacheEntry entry) {
        cache.put(entry.getTicker(), entry);
    }

    /**
     * Stores a heuristic entry unless a fresh confirmed entry is already cached. Returns
     * whichever entry the tier holds afterwards.
     */
    public ClassificationCacheEntry putProvisional(ClassificationCacheEntry entry) {
        Instant now = clock.instant();
        return cache.asMap().compute(entry.getTicker(), (ticker, existing) ->
                existing != null && existing.getSourceTier() != SourceTier.HEURISTIC && !existing.isStaleAt(now)
                        ? existing
                        : entry);
    }

    public void invalidate(String ticker) {
        cache.invalidate(ticker);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class RemainingTtlExpiry implements Expiry<String, ClassificationCacheEntry> {

        private final Clock clock;

        private RemainingTtlExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, ClassificationCacheEntry value, long currentTime) {
            Duration remaining = value.remainingAt(clock.instant());
            return remaining.isNegative() ? 0L : remaining.toNanos();
        }

        @Override
        public long expireAfterUpdate(
                String key, ClassificationCacheEntry value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(
                String key, ClassificationCacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
