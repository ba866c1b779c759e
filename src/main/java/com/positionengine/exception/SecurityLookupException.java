package com.positionengine.exception;

import lombok.Getter;

/**
 * The authoritative classification lookup failed for one ticker.
 *
 * <p>{@code retryable} tells the retry policy whether another attempt can help: transport
 * errors and 5xx/429 responses are retryable, an empty profile for an unknown symbol is not.
 */
@Getter
public class SecurityLookupException extends BaseException {

    private final String ticker;
    private final boolean retryable;

    public SecurityLookupException(String ticker, String message, boolean retryable) {
        super(ErrorCode.LOOKUP_ERROR, message);
        this.ticker = ticker;
        this.retryable = retryable;
    }

    public SecurityLookupException(String ticker, String message, boolean retryable, Throwable cause) {
        super(ErrorCode.LOOKUP_ERROR, message, cause);
        this.ticker = ticker;
        this.retryable = retryable;
    }
}
