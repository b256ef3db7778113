package org.cloudfoundry.logcache.core.grpc;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import io.grpc.ChannelCredentials;
import io.grpc.ServerCredentials;
import io.grpc.netty.shaded.io.grpc.netty.NettySslContextChannelCredentials;
import io.grpc.netty.shaded.io.grpc.netty.NettySslContextServerCredentials;

import org.cloudfoundry.logcache.core.tls.MutualTlsConfig;
import org.cloudfoundry.logcache.core.tls.TlsConfigBuilder;
import org.cloudfoundry.logcache.exception.TlsConfigurationException;

import javax.net.ssl.SSLException;

/**
 * Mutual TLS credentials for gRPC channels and servers.
 *
 * <p>Immutable and safe to share between any number of connections. The gRPC credential objects
 * are created on first use and then reused.
 */
public final class TransportCredentials {
    private final MutualTlsConfig config;
    private final Supplier<ChannelCredentials> channelCredentials;
    private final Supplier<ServerCredentials> serverCredentials;

    private TransportCredentials(MutualTlsConfig config) {
        this.config = config;
        this.channelCredentials =
                Suppliers.memoize(
                        () -> {
                            try {
                                return NettySslContextChannelCredentials.create(
                                        SslContexts.forClient(config));
                            } catch (SSLException e) {
                                throw new IllegalStateException(
                                        "Error in create client TLS context", e);
                            }
                        });
        this.serverCredentials =
                Suppliers.memoize(
                        () -> {
                            try {
                                return NettySslContextServerCredentials.create(
                                        SslContexts.forServer(config));
                            } catch (SSLException e) {
                                throw new IllegalStateException(
                                        "Error in create server TLS context", e);
                            }
                        });
    }

    /**
     * Builds the mutual TLS configuration with the default policy and wraps it. Errors from the
     * configuration builder are propagated unchanged.
     */
    public static TransportCredentials create(
            String caPath, String certPath, String keyPath, String serverName)
            throws TlsConfigurationException {
        return of(new TlsConfigBuilder().buildMutualTlsConfig(caPath, certPath, keyPath, serverName));
    }

    public static TransportCredentials of(MutualTlsConfig config) {
        return new TransportCredentials(Preconditions.checkNotNull(config, "config"));
    }

    public MutualTlsConfig getConfig() {
        return config;
    }

    public String getServerName() {
        return config.getServerName();
    }

    /** Client side: presents our certificate and verifies the server against the CA pool. */
    public ChannelCredentials channelCredentials() {
        return channelCredentials.get();
    }

    /** Server side: presents our certificate and requires a client certificate from the CA pool. */
    public ServerCredentials serverCredentials() {
        return serverCredentials.get();
    }

    @Override
    public String toString() {
        return "TransportCredentials{serverName='"
                + config.getServerName()
                + "', minimumVersion="
                + config.getMinimumVersion()
                + ", cipherSuites="
                + config.getCipherSuites()
                + ", rootCas="
                + config.getRootCas().size()
                + '}';
    }
}
