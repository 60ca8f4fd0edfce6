package com.optionsbacktester.exception;

import java.util.Map;

/**
 * Invalid strategy thresholds or engine settings. Raised at construction time,
 * before any bar is processed, so a misconfigured run never starts.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
