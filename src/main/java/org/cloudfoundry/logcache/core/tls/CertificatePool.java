package org.cloudfoundry.logcache.core.tls;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * Trusted root and intermediate certificates. Duplicates in the source bundle collapse into one
 * entry; two pools are equal when they hold the same certificates.
 */
@EqualsAndHashCode
@ToString(onlyExplicitlyIncluded = true)
public final class CertificatePool {
    @Getter private final ImmutableSet<X509Certificate> certificates;

    private CertificatePool(ImmutableSet<X509Certificate> certificates) {
        this.certificates = certificates;
    }

    public static CertificatePool of(Collection<X509Certificate> certificates) {
        return new CertificatePool(ImmutableSet.copyOf(certificates));
    }

    public boolean contains(X509Certificate certificate) {
        return certificates.contains(certificate);
    }

    public int size() {
        return certificates.size();
    }

    public boolean isEmpty() {
        return certificates.isEmpty();
    }

    @ToString.Include(name = "subjects")
    private ImmutableList<String> subjects() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (X509Certificate c : certificates) {
            names.add(c.getSubjectX500Principal().getName());
        }
        return names.build();
    }
}
