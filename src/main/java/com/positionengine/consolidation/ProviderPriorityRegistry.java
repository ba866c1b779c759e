package com.positionengine.consolidation;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the live provider priority table.
 *
 * <p>Each run takes one {@link #current()} snapshot at its start and uses it throughout, so a
 * {@link #reload(Map)} during a run never changes priorities half-way through. The swap is a
 * single atomic reference write.
 */
public class ProviderPriorityRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderPriorityRegistry.class);

    private final AtomicReference<ProviderPriorityConfig> current;

    public ProviderPriorityRegistry(Map<String, Integer> initialPriorities) {
        this.current = new AtomicReference<>(ProviderPriorityConfig.of(initialPriorities));
        log.info("Provider priorities loaded: {}", current.get().asMap());
    }

    public ProviderPriorityConfig current() {
        return current.get();
    }

    /** Replaces the table for runs that start after this call. Returns the previous snapshot. */
    public ProviderPriorityConfig reload(Map<String, Integer> priorities) {
        ProviderPriorityConfig next = ProviderPriorityConfig.of(priorities);
        ProviderPriorityConfig previous = current.getAndSet(next);
        log.info("Provider priorities reloaded: {} -> {}", previous.asMap(), next.asMap());
        return previous;
    }
}
