package com.positionengine.domain.model;

import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A resolved ticker classification held by the memory and persistent tiers.
 *
 * <p>Entries are immutable: a refresh replaces the whole entry, so a reader never observes a
 * half-written classification. An entry is stale once {@code now - resolvedAt > ttl}.
 *
 * <p>Serialized as JSON in Redis under {@code pce:classification:{ticker}}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ClassificationCacheEntry {

    String ticker;
    SecurityType securityType;
    SourceTier sourceTier;
    Instant resolvedAt;
    Duration ttl;

    public boolean isStaleAt(Instant now) {
        return Duration.between(resolvedAt, now).compareTo(ttl) > 0;
    }

    /** Time left before the entry goes stale; zero or negative once stale. */
    public Duration remainingAt(Instant now) {
        return ttl.minus(Duration.between(resolvedAt, now));
    }
}
