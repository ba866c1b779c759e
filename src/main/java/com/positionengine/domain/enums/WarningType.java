package com.positionengine.domain.enums;

/**
 * Non-fatal conditions surfaced alongside a successful consolidation result.
 *
 * <p>MALFORMED_RECORD = a provider record lacked a ticker or quantity and was dropped.
 * MIXED_CURRENCY_SAME_TICKER = same ticker reported in two currencies; kept under separate keys.
 * AUTHORITATIVE_LOOKUP_TIMEOUT / AUTHORITATIVE_LOOKUP_FAILURE = the ticker fell through to the heuristic tier.
 * PERSISTENT_STORE_UNAVAILABLE = the persistent tier was skipped for the rest of the batch.
 * EMPTY_INPUT = nothing to consolidate; the result is empty, not an error.
 * UNKNOWN_PROVIDER = no normalizer registered for the payload's provider id.
 * UNMAPPED_SECURITY_TYPE = no crash scenario for the type; the equity scenario was applied.
 */
public enum WarningType {
    MALFORMED_RECORD,
    MIXED_CURRENCY_SAME_TICKER,
    AUTHORITATIVE_LOOKUP_TIMEOUT,
    AUTHORITATIVE_LOOKUP_FAILURE,
    PERSISTENT_STORE_UNAVAILABLE,
    EMPTY_INPUT,
    UNKNOWN_PROVIDER,
    UNMAPPED_SECURITY_TYPE
}
