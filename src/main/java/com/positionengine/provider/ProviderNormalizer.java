package com.positionengine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.positionengine.domain.model.NormalizationResult;

/**
 * Maps one provider's raw holdings document into normalized {@code Position} records.
 *
 * <p>Implementations are stateless and never throw for bad records: a record without a ticker
 * or a quantity is dropped with a MALFORMED_RECORD warning and the rest of the payload is
 * still mapped.
 */
public interface ProviderNormalizer {

    /** Lower-case provider id this normalizer is registered under ("plaid", "ibkr"). */
    String providerId();

    NormalizationResult normalize(JsonNode rawPayload, String providerId);
}
