package org.cloudfoundry.logcache.exception;

/** The CA bundle was read but holds no parseable certificate. */
public class CaParseException extends TlsConfigurationException {
    public CaParseException(String path, Throwable cause) {
        super("cannot parse CA certificate in " + path, path, cause);
    }

    public CaParseException(String path) {
        this(path, null);
    }
}
