package com.trademind.common.exception;

/** Boot configuration is missing or malformed. Fatal: the coordinator does not start. */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
