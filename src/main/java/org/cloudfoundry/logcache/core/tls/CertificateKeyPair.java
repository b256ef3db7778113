package org.cloudfoundry.logcache.core.tls;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.ToString;
import lombok.Value;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/** A private key and the certificate chain it was verified against, leaf first. */
@Value
public class CertificateKeyPair {
    @ToString.Exclude PrivateKey privateKey;
    ImmutableList<X509Certificate> chain;

    public CertificateKeyPair(PrivateKey privateKey, List<X509Certificate> chain) {
        Preconditions.checkNotNull(privateKey, "privateKey");
        Preconditions.checkArgument(
                chain != null && !chain.isEmpty(), "certificate chain must not be empty");
        this.privateKey = privateKey;
        this.chain = ImmutableList.copyOf(chain);
    }

    public X509Certificate getLeaf() {
        return chain.get(0);
    }
}
