package com.positionengine.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical security types resolved by the classification cache.
 *
 * <p>Wire names are lower-case ("mutual_fund", "etf") and are what the persistent tier
 * and the downstream risk engine see. Provider-reported types never land here directly;
 * they are only hints to the heuristic tier.
 */
public enum SecurityType {
    EQUITY("equity", "equity", false),
    ETF("etf", "mixed", true),
    MUTUAL_FUND("mutual_fund", "mixed", true),
    FUND("fund", "mixed", true),
    BOND("bond", "bond", false),
    CASH("cash", "cash", false),
    CRYPTO("crypto", "crypto", false),
    COMMODITY("commodity", "commodity", false),
    DERIVATIVE("derivative", "derivative", false),
    WARRANT("warrant", "derivative", false);

    private final String wireName;
    private final String assetClass;
    private final boolean diversified;

    SecurityType(String wireName, String assetClass, boolean diversified) {
        this.wireName = wireName;
        this.assetClass = assetClass;
        this.diversified = diversified;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Asset class bucket; baskets (ETFs, funds) map to "mixed". */
    public String getAssetClass() {
        return assetClass;
    }

    /** True for baskets exempt from single-issuer concentration checks. */
    public boolean isDiversified() {
        return diversified;
    }

    /**
     * Parses a wire name, case-insensitive. Returns empty for unknown names instead of throwing,
     * since config tables and stored entries may carry types this build does not know.
     */
    public static Optional<SecurityType> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (SecurityType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static SecurityType fromJson(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown security type: " + value));
    }
}
