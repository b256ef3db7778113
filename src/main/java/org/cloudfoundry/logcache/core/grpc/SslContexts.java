package org.cloudfoundry.logcache.core.grpc;

import io.grpc.netty.shaded.io.grpc.netty.GrpcSslContexts;
import io.grpc.netty.shaded.io.netty.handler.ssl.ClientAuth;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContext;
import io.grpc.netty.shaded.io.netty.handler.ssl.SslContextBuilder;

import org.cloudfoundry.logcache.core.tls.CertificateKeyPair;
import org.cloudfoundry.logcache.core.tls.MutualTlsConfig;

import java.security.cert.X509Certificate;

import javax.net.ssl.SSLException;

/** Translates a {@link MutualTlsConfig} into Netty SSL contexts for either side of a connection. */
final class SslContexts {
    private SslContexts() {}

    static SslContext forClient(MutualTlsConfig config) throws SSLException {
        CertificateKeyPair identity = identity(config);
        SslContextBuilder builder =
                GrpcSslContexts.forClient()
                        .keyManager(identity.getPrivateKey(), chain(identity))
                        .trustManager(trustRoots(config));
        return applyPolicy(builder, config).build();
    }

    static SslContext forServer(MutualTlsConfig config) throws SSLException {
        CertificateKeyPair identity = identity(config);
        SslContextBuilder builder =
                GrpcSslContexts.configure(
                                SslContextBuilder.forServer(
                                        identity.getPrivateKey(), chain(identity)))
                        .trustManager(trustRoots(config))
                        .clientAuth(ClientAuth.REQUIRE);
        return applyPolicy(builder, config).build();
    }

    // Replaces the HTTP/2 default cipher list installed by GrpcSslContexts.
    private static SslContextBuilder applyPolicy(SslContextBuilder builder, MutualTlsConfig config) {
        return builder.protocols(config.getEnabledProtocols()).ciphers(config.getCipherSuites());
    }

    private static CertificateKeyPair identity(MutualTlsConfig config) {
        return config.getCertificates().get(0);
    }

    private static X509Certificate[] chain(CertificateKeyPair identity) {
        return identity.getChain().toArray(new X509Certificate[0]);
    }

    private static X509Certificate[] trustRoots(MutualTlsConfig config) {
        return config.getRootCas().getCertificates().toArray(new X509Certificate[0]);
    }
}
