package com.positionengine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.NormalizationResult;
import com.positionengine.domain.model.Position;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes a Plaid {@code /investments/holdings/get} response.
 *
 * <p>Holdings reference securities by {@code security_id}; the ticker, type and currency
 * come from the joined security. Plaid reports cash as a security of type "cash",
 * sometimes without a ticker; those records become {@code CUR:<ccy>}.
 */
@Component
public class PlaidHoldingsNormalizer extends AbstractJsonNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PlaidHoldingsNormalizer.class);

    public static final String PROVIDER_ID = "plaid";

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public NormalizationResult normalize(JsonNode rawPayload, String providerId) {
        List<Position> positions = new ArrayList<>();
        List<ConsolidationWarning> warnings = new ArrayList<>();

        JsonNode holdings = rawPayload != null ? rawPayload.get("holdings") : null;
        if (holdings == null || !holdings.isArray()) {
            malformed(warnings, null, providerId, "Plaid payload has no holdings array");
            return new NormalizationResult(positions, warnings);
        }

        Map<String, JsonNode> securitiesById = new HashMap<>();
        JsonNode securities = rawPayload.get("securities");
        if (securities != null && securities.isArray()) {
            for (JsonNode security : securities) {
                String securityId = text(security, "security_id");
                if (securityId != null) {
                    securitiesById.put(securityId, security);
                }
            }
        }

        for (JsonNode holding : holdings) {
            JsonNode security = securitiesById.get(text(holding, "security_id"));
            String type = text(security, "type");
            String currency = currencyOrDefault(
                    firstNonNull(text(holding, "iso_currency_code"), text(security, "iso_currency_code")));

            String ticker = upper(text(security, "ticker_symbol"));
            if (ticker == null && "cash".equalsIgnoreCase(type)) {
                ticker = Position.cashTicker(currency);
            }

            BigDecimal quantity = decimal(holding, "quantity");
            if (ticker == null || quantity == null) {
                malformed(warnings, ticker, providerId,
                        "Plaid holding " + text(holding, "security_id") + " has no ticker or quantity");
                continue;
            }

            positions.add(Position.builder()
                    .ticker(ticker)
                    .quantity(quantity)
                    .currency(currency)
                    .securityTypeHint(type)
                    .accountId(text(holding, "account_id"))
                    .costBasis(decimal(holding, "cost_basis"))
                    .providerId(providerId)
                    .build());
        }

        log.debug("Plaid normalized {} holdings, {} dropped", positions.size(), warnings.size());
        return new NormalizationResult(positions, warnings);
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
