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
 * Normalizes an Interactive Brokers portfolio positions response: a bare array, or an object
 * wrapping it under {@code positions}.
 *
 * <p>Cash lines ({@code assetClass=CASH}) become {@code CUR:<ccy>}. Cost basis is position
 * times average cost.
 */
@Component
public class IbkrPositionsNormalizer extends AbstractJsonNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IbkrPositionsNormalizer.class);

    public static final String PROVIDER_ID = "ibkr";

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public NormalizationResult normalize(JsonNode rawPayload, String providerId) {
        List<Position> positions = new ArrayList<>();
        List<ConsolidationWarning> warnings = new ArrayList<>();

        JsonNode rows = rawPayload != null && rawPayload.isObject() ? rawPayload.get("positions") : rawPayload;
        if (rows == null || !rows.isArray()) {
            malformed(warnings, null, providerId, "IBKR payload has no positions array");
            return new NormalizationResult(positions, warnings);
        }

        for (JsonNode row : rows) {
            String assetClass = text(row, "assetClass");
            String currency = currencyOrDefault(text(row, "currency"));
            String ticker = "CASH".equalsIgnoreCase(assetClass)
                    ? Position.cashTicker(currency)
                    : upper(text(row, "ticker", "contractDesc"));

            BigDecimal quantity = decimal(row, "position");
            if (ticker == null || quantity == null) {
                malformed(warnings, ticker, providerId, "IBKR row has no ticker or position");
                continue;
            }

            positions.add(Position.builder()
                    .ticker(ticker)
                    .quantity(quantity)
                    .currency(currency)
                    .securityTypeHint(assetClass)
                    .accountId(text(row, "acctId"))
                    .costBasis(multiply(quantity, decimal(row, "avgCost")))
                    .providerId(providerId)
                    .build());
        }

        log.debug("IBKR normalized {} rows, {} dropped", positions.size(), warnings.size());
        return new NormalizationResult(positions, warnings);
    }
}
