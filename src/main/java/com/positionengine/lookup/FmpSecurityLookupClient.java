package com.positionengine.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.model.SecurityProfile;
import com.positionengine.exception.SecurityLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Looks up security profiles from Financial Modeling Prep ({@code GET /stable/profile}).
 *
 * <p>The endpoint returns an array with zero or one profile. An empty array means FMP does not
 * know the symbol, which no retry will change. Transport errors, 429 and 5xx responses are
 * retryable. FMP has no cash flag, so profiles from here never carry the cash marker.
 */
@Component
public class FmpSecurityLookupClient implements SecurityLookupClient {

    private static final Logger log = LoggerFactory.getLogger(FmpSecurityLookupClient.class);

    private static final String PROFILE_PATH = "/stable/profile";

    private final RestClient fmpRestClient;
    private final String apiKey;

    public FmpSecurityLookupClient(
            @Qualifier("fmpRestClient") RestClient fmpRestClient, ClassificationConfig classificationConfig) {
        this.fmpRestClient = fmpRestClient;
        this.apiKey = classificationConfig.getFmp().getApiKey();
    }

    @Override
    public SecurityProfile lookup(String ticker) {
        JsonNode body;
        try {
            body = fmpRestClient
                    .get()
                    .uri(uriBuilder -> uriBuilder
                            .path(PROFILE_PATH)
                            .queryParam("symbol", ticker)
                            .queryParam("apikey", apiKey)
                            .build())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            log.warn("FMP profile lookup for {} returned HTTP {}", ticker, status);
            throw new SecurityLookupException(ticker, "FMP returned HTTP " + status + " for " + ticker, retryable, e);
        } catch (ResourceAccessException e) {
            log.warn("FMP profile lookup for {} failed: {}", ticker, e.getMessage());
            throw new SecurityLookupException(ticker, "FMP unreachable for " + ticker, true, e);
        } catch (RestClientException e) {
            throw new SecurityLookupException(ticker, "FMP response unreadable for " + ticker, false, e);
        }

        JsonNode profile = body != null && body.isArray() ? body.path(0) : body;
        if (profile == null || !profile.isObject() || profile.isEmpty()) {
            throw new SecurityLookupException(ticker, "FMP has no profile for " + ticker, false);
        }

        SecurityProfile securityProfile = SecurityProfile.builder()
                .ticker(ticker)
                .etf(profile.path("isEtf").asBoolean(false))
                .fund(profile.path("isFund").asBoolean(false))
                .cashMarker(false)
                .exchange(profile.path("exchange").asText(null))
                .companyName(profile.path("companyName").asText(null))
                .build();
        log.debug("FMP profile {}: etf={}, fund={}, exchange={}",
                ticker, securityProfile.isEtf(), securityProfile.isFund(), securityProfile.getExchange());
        return securityProfile;
    }
}
