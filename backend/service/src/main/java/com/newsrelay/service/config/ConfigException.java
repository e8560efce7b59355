package com.newsrelay.service.config;

/**
 * Invalid or missing startup configuration. Raised before any network activity.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
