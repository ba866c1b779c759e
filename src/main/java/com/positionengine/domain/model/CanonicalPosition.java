package com.positionengine.domain.model;

import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * The single, provider-agnostic representation of a holding after consolidation.
 *
 * <p>Quantity is always the exact arithmetic sum of every input that was legally merged into
 * this position. Metadata (account, cost basis, hint, currency) comes from the highest-priority
 * contributing provider.
 *
 * <p>The consolidator leaves {@code securityType}, {@code sourceTier} and {@code crashScenario}
 * null; the pipeline fills them in via {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalPosition {

    /** Separates ticker and currency in the key of a currency-conflicting position. */
    public static final String CURRENCY_KEY_SEPARATOR = "__";

    /** Plain ticker, {@code CUR:<ccy>} for cash, or {@code ticker__CCY} for a currency-conflicting record. */
    String ticker;

    BigDecimal quantity;
    String currency;

    /** Resolved type, never the provider hint. */
    SecurityType securityType;

    /** Tier that answered the classification; null for cash, which is never looked up. */
    SourceTier sourceTier;

    String securityTypeHint;
    BigDecimal costBasis;
    String accountId;

    /** Providers whose records were merged, in first-seen order. */
    Set<String> contributingProviders;

    CrashScenario crashScenario;

    public boolean isCash() {
        return ticker != null && ticker.startsWith(Position.CASH_PREFIX);
    }

    /**
     * Symbol to classify: the ticker without the {@code __CCY} suffix the consolidator adds to
     * keep a conflicting currency apart.
     */
    public String getClassificationTicker() {
        String suffix = CURRENCY_KEY_SEPARATOR + currency;
        if (ticker != null && currency != null && ticker.endsWith(suffix) && ticker.length() > suffix.length()) {
            return ticker.substring(0, ticker.length() - suffix.length());
        }
        return ticker;
    }

    public String getAssetClass() {
        return securityType != null ? securityType.getAssetClass() : null;
    }

    public boolean isDiversified() {
        return securityType != null && securityType.isDiversified();
    }

    /**
     * Converts back into a single-provider input record. Contributing providers are joined
     * with commas so that re-consolidation recovers the same provider set.
     */
    public Position toPosition() {
        return Position.builder()
                .ticker(ticker)
                .quantity(quantity)
                .currency(currency)
                .securityTypeHint(securityTypeHint)
                .accountId(accountId)
                .costBasis(costBasis)
                .providerId(String.join(",", contributingProviders))
                .build();
    }
}
