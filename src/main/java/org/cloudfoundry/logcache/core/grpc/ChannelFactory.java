package org.cloudfoundry.logcache.core.grpc;

import com.google.common.net.HostAndPort;

import io.grpc.Grpc;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.ServerBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Knows how to construct mutual TLS grpc channels and servers using the Credentials API. */
public class ChannelFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelFactory.class);

    public static ChannelFactory create() {
        return new ChannelFactory();
    }

    private ChannelFactory() {}

    /**
     * Creates a channel to {@code endpoint}. The credentials' server name is used as the channel
     * authority, so SNI and hostname verification check it rather than the dialed host.
     */
    public ManagedChannel createChannel(
            HostAndPort endpoint,
            TransportCredentials credentials,
            int maxInboundMessageSize,
            int maxInboundMetadataSize) {
        ManagedChannelBuilder<?> builder =
                Grpc.newChannelBuilderForAddress(
                                endpoint.getHost(),
                                endpoint.getPort(),
                                credentials.channelCredentials())
                        .overrideAuthority(credentials.getServerName());
        builder.maxInboundMessageSize(maxInboundMessageSize);
        builder.maxInboundMetadataSize(maxInboundMetadataSize);
        LOGGER.debug(
                "Creating mTLS channel to {} with authority {}",
                endpoint,
                credentials.getServerName());
        return builder.build();
    }

    /** Returns a server builder on {@code port} that requires mutual TLS. Port 0 picks a free port. */
    public ServerBuilder<?> createServerBuilder(int port, TransportCredentials credentials) {
        LOGGER.debug("Creating mTLS server builder on port {}", port);
        return Grpc.newServerBuilderForPort(port, credentials.serverCredentials());
    }
}
