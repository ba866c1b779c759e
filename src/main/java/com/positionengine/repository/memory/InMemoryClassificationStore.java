package com.positionengine.repository.memory;

import com.positionengine.domain.model.ClassificationCacheEntry;
import com.positionengine.repository.ClassificationStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local stand-in for the persistent tier, for runs without Redis
 * ({@code classification.store.type=memory}). Contents are lost on restart.
 */
@Repository
@ConditionalOnProperty(name = "classification.store.type", havingValue = "memory")
public class InMemoryClassificationStore implements ClassificationStore {

    private final Map<String, ClassificationCacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryClassificationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ClassificationCacheEntry> get(String ticker) {
        return Optional.ofNullable(entries.get(ticker));
    }

    @Override
    public void put(ClassificationCacheEntry entry) {
        entries.put(entry.getTicker(), entry);
    }

    @Override
    public List<String> listStale(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return entries.values().stream()
                .filter(entry -> !entry.getResolvedAt().isAfter(cutoff))
                .map(ClassificationCacheEntry::getTicker)
                .sorted()
                .toList();
    }

    @Override
    public void delete(String ticker) {
        entries.remove(ticker);
    }
}
