package org.cloudfoundry.logcache.exception;

/** The certificate or private key is unreadable, malformed, or the two do not belong together. */
public class CertificateLoadException extends TlsConfigurationException {
    public CertificateLoadException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
