package com.positionengine.domain.model;

import com.positionengine.domain.enums.WarningType;
import lombok.Builder;
import lombok.Value;

/**
 * A structured, non-fatal condition collected during a pipeline run.
 *
 * <p>Warnings travel alongside the successful result instead of being thrown, so one bad record
 * or one unavailable tier never aborts the rest of the batch.
 */
@Value
@Builder
public class ConsolidationWarning {

    WarningType type;

    /** Affected ticker, or null for batch-level conditions (store outage, empty input). */
    String ticker;

    /** Provider the condition originated from, when known. */
    String providerId;

    String message;

    public static ConsolidationWarning of(WarningType type, String ticker, String providerId, String message) {
        return ConsolidationWarning.builder()
                .type(type)
                .ticker(ticker)
                .providerId(providerId)
                .message(message)
                .build();
    }
}
