package com.positionengine.consolidation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable snapshot of provider priorities used for one consolidation run.
 *
 * <p>Higher integers win. Provider ids are matched case-insensitively and unknown providers
 * rank 0. A re-fed record carrying a comma-joined provider list ranks as its best provider.
 */
public final class ProviderPriorityConfig {

    public static final int UNKNOWN_PROVIDER_PRIORITY = 0;

    private static final ProviderPriorityConfig EMPTY = new ProviderPriorityConfig(Map.of());

    private final Map<String, Integer> priorities;

    private ProviderPriorityConfig(Map<String, Integer> priorities) {
        this.priorities = priorities;
    }

    public static ProviderPriorityConfig of(Map<String, Integer> priorities) {
        if (priorities == null || priorities.isEmpty()) {
            return EMPTY;
        }
        Map<String, Integer> copy = new LinkedHashMap<>();
        priorities.forEach((providerId, priority) -> {
            if (providerId != null && priority != null) {
                copy.put(normalize(providerId), priority);
            }
        });
        return new ProviderPriorityConfig(Collections.unmodifiableMap(copy));
    }

    public static ProviderPriorityConfig empty() {
        return EMPTY;
    }

    public int priorityOf(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return UNKNOWN_PROVIDER_PRIORITY;
        }
        int best = Integer.MIN_VALUE;
        for (String part : providerId.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            best = Math.max(best, priorities.getOrDefault(normalize(part), UNKNOWN_PROVIDER_PRIORITY));
        }
        return best == Integer.MIN_VALUE ? UNKNOWN_PROVIDER_PRIORITY : best;
    }

    public Map<String, Integer> asMap() {
        return priorities;
    }

    private static String normalize(String providerId) {
        return providerId.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "ProviderPriorityConfig" + priorities;
    }
}
