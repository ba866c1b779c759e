package com.positionengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes for the engine's exception hierarchy.
 *
 * <p>CONFIGURATION_ERROR stops startup. The lookup and store codes are raised inside their tier
 * and become the prefix of the warning that replaces them.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR("CONFIGURATION_ERROR"),
    LOOKUP_ERROR("LOOKUP_ERROR"),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE");

    private final String code;
}
