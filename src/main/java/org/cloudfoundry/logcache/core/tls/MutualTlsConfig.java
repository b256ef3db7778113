package org.cloudfoundry.logcache.core.tls;

import com.google.common.collect.ImmutableList;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A fully populated mutual TLS configuration: policy, identity, expected peer name and trust
 * roots.
 *
 * <p>Peer verification cannot be switched off; {@link #isInsecureSkipVerify()} is always {@code
 * false}.
 */
@Value
@Builder
public class MutualTlsConfig {
    @NonNull TlsPolicy policy;

    /** Name used for SNI and for verifying the peer certificate. */
    @NonNull String serverName;

    @Singular ImmutableList<CertificateKeyPair> certificates;

    @NonNull CertificatePool rootCas;

    public boolean isInsecureSkipVerify() {
        return false;
    }

    public String getMinimumVersion() {
        return policy.getMinimumVersion();
    }

    public ImmutableList<String> getCipherSuites() {
        return policy.getCipherSuites();
    }

    public ImmutableList<String> getEnabledProtocols() {
        return policy.getEnabledProtocols();
    }
}
