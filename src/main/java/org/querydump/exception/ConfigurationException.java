package org.querydump.exception;

public class ConfigurationException extends QueryDumpException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
