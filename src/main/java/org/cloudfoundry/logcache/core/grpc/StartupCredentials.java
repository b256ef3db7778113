package org.cloudfoundry.logcache.core.grpc;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import org.cloudfoundry.logcache.exception.TlsConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-startup adapter around {@link TransportCredentials#create}: a process cannot serve
 * secure traffic without its TLS material, so a failure here ends the process.
 *
 * <p>This is the only place where a TLS configuration error becomes a process exit.
 */
public final class StartupCredentials {
    private static final Logger LOGGER = LoggerFactory.getLogger(StartupCredentials.class);
    static final int EXIT_STATUS = 1;

    /** Terminates the process. */
    @FunctionalInterface
    public interface ExitHandler {
        void exit(int status);
    }

    private static final ExitHandler SYSTEM_EXIT = System::exit;

    private final ExitHandler exitHandler;

    @VisibleForTesting
    StartupCredentials(ExitHandler exitHandler) {
        this.exitHandler = Preconditions.checkNotNull(exitHandler, "exitHandler");
    }

    /** Returns the credentials, or logs the failure and exits the JVM with status 1. */
    public static TransportCredentials getOrDie(
            String caPath, String certPath, String keyPath, String serverName) {
        return new StartupCredentials(SYSTEM_EXIT).load(caPath, certPath, keyPath, serverName);
    }

    TransportCredentials load(String caPath, String certPath, String keyPath, String serverName) {
        try {
            return TransportCredentials.create(caPath, certPath, keyPath, serverName);
        } catch (TlsConfigurationException e) {
            LOGGER.error("failed to load TLS config: {}", e.getMessage(), e);
            exitHandler.exit(EXIT_STATUS);
            // only reached when the handler does not halt the JVM
            throw new IllegalStateException("failed to load TLS config: " + e.getMessage(), e);
        }
    }
}
