package com.positionengine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.ConsolidationWarning;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Field-access helpers shared by the JSON provider normalizers.
 */
abstract class AbstractJsonNormalizer implements ProviderNormalizer {

    static final String DEFAULT_CURRENCY = "USD";

    /** First non-blank text value among the given fields, trimmed; null if none. */
    static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * Reads a decimal from a JSON number or a numeric string. Returns null when the field is
     * absent, null, or not numeric.
     */
    static BigDecimal decimal(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim().replace(",", "");
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static String upper(String value) {
        return value == null ? null : value.trim().toUpperCase(Locale.ROOT);
    }

    static String currencyOrDefault(String currency) {
        return currency == null || currency.isBlank() ? DEFAULT_CURRENCY : upper(currency);
    }

    static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return left == null || right == null ? null : left.multiply(right);
    }

    static void malformed(List<ConsolidationWarning> warnings, String ticker, String providerId, String message) {
        warnings.add(ConsolidationWarning.of(WarningType.MALFORMED_RECORD, ticker, providerId, message));
    }
}
