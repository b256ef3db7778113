package org.cloudfoundry.logcache.exception;

/**
 * Base type for failures while assembling a mutual TLS configuration from PEM files.
 *
 * <p>These failures are configuration errors: retrying without fixing the file reproduces them.
 */
public class TlsConfigurationException extends Exception {
    private final String path;

    public TlsConfigurationException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** The file that could not be used. */
    public String getPath() {
        return path;
    }
}
