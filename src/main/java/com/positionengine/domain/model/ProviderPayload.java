package com.positionengine.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * One raw holdings document from an upstream provider, as received.
 *
 * <p>The body shape is owned by the provider integration; only the matching
 * {@code ProviderNormalizer} looks inside it.
 */
@Value
public class ProviderPayload {

    String providerId;
    JsonNode body;
}
