package com.positionengine.domain.model;

import java.math.BigDecimal;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * A single holding as reported by one upstream provider, after normalization.
 *
 * <p>Immutable and request-scoped: produced by a {@code ProviderNormalizer}, consumed by the
 * consolidator, then discarded. Quantity is signed (negative = short) and may be fractional.
 *
 * <p>Cash holdings use the synthetic ticker {@code CUR:<currency>}. The security type hint is
 * whatever the provider claimed and is advisory only; the classification cache decides.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    public static final String CASH_PREFIX = "CUR:";

    String ticker;

    /** Signed quantity: positive = long, negative = short. */
    BigDecimal quantity;

    String currency;

    /** Provider-reported type ("etf", "mutual fund", "cs"). Advisory only. */
    String securityTypeHint;

    String accountId;

    /** Total cost basis in {@link #currency}; null when the provider does not report it. */
    BigDecimal costBasis;

    /**
     * Provider that reported this record. May be a comma-delimited list when the record
     * is a re-fed consolidation output ("plaid,snaptrade").
     */
    String providerId;

    public boolean isCash() {
        if (ticker != null && ticker.toUpperCase(Locale.ROOT).startsWith(CASH_PREFIX)) {
            return true;
        }
        return securityTypeHint != null && "cash".equals(securityTypeHint.trim().toLowerCase(Locale.ROOT));
    }

    public static String cashTicker(String currency) {
        return CASH_PREFIX + currency.toUpperCase(Locale.ROOT);
    }
}
