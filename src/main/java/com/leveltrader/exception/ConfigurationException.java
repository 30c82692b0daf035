package com.leveltrader.exception;

import java.util.Map;

/** Invalid or missing engine configuration, raised at startup. */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String property, String message) {
        super(ErrorCode.CONFIGURATION_ERROR, property + ": " + message, Map.of("property", property));
    }

    public ConfigurationException(String property, String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, property + ": " + message, cause);
    }
}
