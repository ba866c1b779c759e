package com.positionengine.domain.enums;

/**
 * The classification tier that produced a security type.
 *
 * <p>Tiers are consulted in declaration order: MEMORY first, HEURISTIC last. Only
 * AUTHORITATIVE answers are written to the persistent tier; HEURISTIC answers are provisional
 * and live in memory only.
 */
public enum SourceTier {
    MEMORY,
    PERSISTENT,
    AUTHORITATIVE,
    HEURISTIC
}
