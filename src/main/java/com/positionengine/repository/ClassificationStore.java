package com.positionengine.repository;

import com.positionengine.domain.model.ClassificationCacheEntry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable key-value tier for ticker classifications.
 *
 * <p>Implementations translate backend failures into {@code ClassificationStoreException};
 * the classification cache turns those into a PERSISTENT_STORE_UNAVAILABLE warning and
 * carries on without the tier.
 */
public interface ClassificationStore {

    Optional<ClassificationCacheEntry> get(String ticker);

    /** Replaces the whole entry for its ticker atomically. */
    void put(ClassificationCacheEntry entry);

    /** Tickers resolved longer ago than {@code maxAge}. */
    List<String> listStale(Duration maxAge);

    void delete(String ticker);
}
