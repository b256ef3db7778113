package org.cloudfoundry.logcache.core.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import org.cloudfoundry.logcache.core.grpc.StartupCredentials;
import org.cloudfoundry.logcache.core.grpc.TransportCredentials;
import org.cloudfoundry.logcache.exception.TlsConfigurationException;

/** Locations of the PEM files used for mutual TLS. */
@Value
@Builder
public class TlsPaths {
    /** Trusted CA bundle (PEM). */
    @NonNull String caPath;

    /** Certificate chain (PEM), leaf first. */
    @NonNull String certPath;

    /** Private key (PEM) matching the certificate. */
    @NonNull String keyPath;

    public TransportCredentials transportCredentials(String serverName)
            throws TlsConfigurationException {
        return TransportCredentials.create(caPath, certPath, keyPath, serverName);
    }

    /** Like {@link #transportCredentials} but exits the process when the material is unusable. */
    public TransportCredentials credentials(String serverName) {
        return StartupCredentials.getOrDie(caPath, certPath, keyPath, serverName);
    }
}
