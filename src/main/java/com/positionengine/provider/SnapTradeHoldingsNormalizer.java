package com.positionengine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.NormalizationResult;
import com.positionengine.domain.model.Position;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes a SnapTrade account holdings document.
 *
 * <p>SnapTrade nests the instrument under {@code symbol.symbol}; older payloads flatten it to
 * {@code symbol}. Both are accepted. Cash balances become {@code CUR:<ccy>} positions and
 * cost basis is units times average purchase price.
 */
@Component
public class SnapTradeHoldingsNormalizer extends AbstractJsonNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SnapTradeHoldingsNormalizer.class);

    public static final String PROVIDER_ID = "snaptrade";

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public NormalizationResult normalize(JsonNode rawPayload, String providerId) {
        List<Position> positions = new ArrayList<>();
        List<ConsolidationWarning> warnings = new ArrayList<>();

        if (rawPayload == null || !rawPayload.isObject()) {
            malformed(warnings, null, providerId, "SnapTrade payload is not an object");
            return new NormalizationResult(positions, warnings);
        }

        String accountId = text(rawPayload.path("account"), "id", "number");

        JsonNode holdings = rawPayload.get("positions");
        if (holdings != null && holdings.isArray()) {
            for (JsonNode holding : holdings) {
                JsonNode instrument = instrument(holding);
                String ticker = upper(instrument == null ? null : text(instrument, "symbol", "raw_symbol"));
                BigDecimal units = decimal(holding, "units");
                if (ticker == null || units == null) {
                    malformed(warnings, ticker, providerId, "SnapTrade position has no symbol or units");
                    continue;
                }
                String currency = currencyOrDefault(firstNonNull(
                        text(instrument.path("currency"), "code"), text(holding.path("currency"), "code")));

                positions.add(Position.builder()
                        .ticker(ticker)
                        .quantity(units)
                        .currency(currency)
                        .securityTypeHint(text(instrument.path("type"), "code"))
                        .accountId(accountId)
                        .costBasis(multiply(units, decimal(holding, "average_purchase_price")))
                        .providerId(providerId)
                        .build());
            }
        }

        JsonNode balances = rawPayload.get("balances");
        if (balances != null && balances.isArray()) {
            for (JsonNode balance : balances) {
                String currency = currencyOrDefault(text(balance.path("currency"), "code"));
                BigDecimal cash = decimal(balance, "cash");
                if (cash == null) {
                    malformed(warnings, Position.cashTicker(currency), providerId, "SnapTrade balance has no cash amount");
                    continue;
                }
                positions.add(Position.builder()
                        .ticker(Position.cashTicker(currency))
                        .quantity(cash)
                        .currency(currency)
                        .securityTypeHint("cash")
                        .accountId(accountId)
                        .providerId(providerId)
                        .build());
            }
        }

        log.debug("SnapTrade normalized {} records, {} dropped", positions.size(), warnings.size());
        return new NormalizationResult(positions, warnings);
    }

    /** Descends through nested {@code symbol} objects to the one that carries the ticker text. */
    private static JsonNode instrument(JsonNode holding) {
        JsonNode parent = holding;
        JsonNode current = holding.get("symbol");
        while (current != null && current.isObject()) {
            parent = current;
            current = current.get("symbol");
        }
        return current != null && current.isTextual() ? parent : null;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
