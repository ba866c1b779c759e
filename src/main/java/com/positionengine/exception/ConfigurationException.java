package com.positionengine.exception;

import java.util.Map;

/**
 * Malformed pipeline configuration detected while wiring beans. Prevents the application from
 * starting rather than failing every request later.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
