package org.cloudfoundry.logcache.exception;

/** Thrown when the process environment does not describe a usable configuration. */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
