package org.cloudfoundry.logcache.exception;

/** The CA bundle file could not be read. */
public class CaReadException extends TlsConfigurationException {
    public CaReadException(String path, Throwable cause) {
        super("cannot read CA bundle " + path + ": " + cause.getMessage(), path, cause);
    }
}
