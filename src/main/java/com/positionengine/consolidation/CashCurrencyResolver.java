package com.positionengine.consolidation;

import com.positionengine.domain.model.Position;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides which currency bucket a cash record belongs to.
 *
 * <p>Resolution order: an explicit {@code CUR:<ccy>} ticker, then a configured alias for the
 * provider's cash symbol (sweep funds, "CASH"), then the record's own currency, then the
 * configured default.
 */
public class CashCurrencyResolver {

    private final Map<String, String> aliases;
    private final String defaultCurrency;

    public CashCurrencyResolver(Map<String, String> aliases, String defaultCurrency) {
        this.aliases = aliases == null
                ? Map.of()
                : aliases.entrySet().stream()
                        .filter(e -> e.getKey() != null && e.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(
                                e -> upper(e.getKey()), e -> upper(e.getValue()), (a, b) -> a));
        this.defaultCurrency = defaultCurrency == null || defaultCurrency.isBlank() ? "USD" : upper(defaultCurrency);
    }

    public String resolve(Position position) {
        String ticker = position.getTicker() == null ? "" : upper(position.getTicker());
        if (ticker.startsWith(Position.CASH_PREFIX) && ticker.length() > Position.CASH_PREFIX.length()) {
            return ticker.substring(Position.CASH_PREFIX.length());
        }
        String alias = aliases.get(ticker);
        if (alias != null) {
            return alias;
        }
        return normalizeCurrency(position.getCurrency());
    }

    /** Upper-cased currency code, or the default when missing. */
    public String normalizeCurrency(String currency) {
        return currency == null || currency.isBlank() ? defaultCurrency : upper(currency);
    }

    public String getDefaultCurrency() {
        return defaultCurrency;
    }

    private static String upper(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
