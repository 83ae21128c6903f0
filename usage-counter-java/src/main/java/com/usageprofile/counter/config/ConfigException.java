package com.usageprofile.counter.config;

/**
 * Fatal configuration problem: bad corpus, output or checkpoint paths, unreadable
 * configuration or API description. Raised before any file is processed.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) { super(message); }
    public ConfigException(String message, Throwable cause) { super(message, cause); }
}
