package org.cloudfoundry.logcache.core.tls;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Protocol floor and cipher suite allow-list shared by every mutual TLS configuration.
 *
 * <p>Immutable. {@link #DEFAULT} is the process-wide baseline; tests may build their own through
 * {@link #of(String, List)}.
 */
@EqualsAndHashCode
@Getter
@ToString
public final class TlsPolicy {
    public static final String TLS_V1_2 = "TLSv1.2";
    public static final String TLS_V1_3 = "TLSv1.3";

    /** Supported versions, newest first. */
    private static final ImmutableList<String> KNOWN_PROTOCOLS = ImmutableList.of(TLS_V1_3, TLS_V1_2);

    public static final TlsPolicy DEFAULT =
            of(
                    TLS_V1_2,
                    ImmutableList.of(
                            "TLS_ECDHE_RSA_WITH_AES_128_GCM_SHA256",
                            "TLS_ECDHE_RSA_WITH_AES_256_GCM_SHA384"));

    private final String minimumVersion;
    private final ImmutableList<String> cipherSuites;

    private TlsPolicy(String minimumVersion, ImmutableList<String> cipherSuites) {
        this.minimumVersion = minimumVersion;
        this.cipherSuites = cipherSuites;
    }

    public static TlsPolicy of(String minimumVersion, List<String> cipherSuites) {
        Preconditions.checkArgument(
                KNOWN_PROTOCOLS.contains(minimumVersion),
                "Unsupported minimum TLS version: %s",
                minimumVersion);
        Preconditions.checkArgument(
                cipherSuites != null && !cipherSuites.isEmpty(),
                "At least one cipher suite must be configured");
        return new TlsPolicy(minimumVersion, ImmutableList.copyOf(cipherSuites));
    }

    /** Every known protocol version at or above the minimum, newest first. */
    public ImmutableList<String> getEnabledProtocols() {
        int floor = KNOWN_PROTOCOLS.indexOf(minimumVersion);
        return KNOWN_PROTOCOLS.subList(0, floor + 1);
    }
}
