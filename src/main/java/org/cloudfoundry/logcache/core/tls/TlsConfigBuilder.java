package org.cloudfoundry.logcache.core.tls;

import com.google.common.base.Preconditions;

import org.cloudfoundry.logcache.exception.CaParseException;
import org.cloudfoundry.logcache.exception.CaReadException;
import org.cloudfoundry.logcache.exception.CertificateLoadException;
import org.cloudfoundry.logcache.exception.TlsConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Builds {@link MutualTlsConfig} instances from PEM files on disk.
 *
 * <p>Stateless apart from the policy it was created with: every call reads its files again and
 * returns a new, independent configuration. Failures are reported as exceptions and never logged
 * here, so callers decide how fatal they are.
 */
public final class TlsConfigBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TlsConfigBuilder.class);

    private final TlsPolicy policy;

    public TlsConfigBuilder() {
        this(TlsPolicy.DEFAULT);
    }

    public TlsConfigBuilder(TlsPolicy policy) {
        this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    public TlsPolicy getPolicy() {
        return policy;
    }

    /**
     * Loads the identity and trust material and combines it with the policy.
     *
     * @param caPath PEM bundle of trusted root and intermediate certificates
     * @param certPath PEM certificate chain, leaf first
     * @param keyPath PEM private key matching the leaf certificate
     * @param serverName expected peer name; must not be blank
     * @throws CertificateLoadException if the certificate or key cannot be loaded or do not match
     * @throws CaReadException if the CA bundle cannot be read
     * @throws CaParseException if the CA bundle holds no certificate
     */
    public MutualTlsConfig buildMutualTlsConfig(
            String caPath, String certPath, String keyPath, String serverName)
            throws TlsConfigurationException {
        Preconditions.checkNotNull(caPath, "caPath");
        Preconditions.checkNotNull(certPath, "certPath");
        Preconditions.checkNotNull(keyPath, "keyPath");
        // a blank name would silently disable hostname verification
        Preconditions.checkArgument(!PemUtils.isBlank(serverName), "serverName must not be empty");

        CertificateKeyPair keyPair = loadKeyPair(certPath, keyPath);

        MutualTlsConfig.MutualTlsConfigBuilder config =
                MutualTlsConfig.builder()
                        .policy(policy)
                        .serverName(serverName)
                        .certificate(keyPair);

        byte[] caBytes;
        try {
            caBytes = PemUtils.readAllBytes(caPath);
        } catch (IOException e) {
            throw new CaReadException(caPath, e);
        }

        List<X509Certificate> cas;
        try {
            cas = PemUtils.readCertificates(caBytes);
        } catch (IOException e) {
            throw new CaParseException(caPath, e);
        }
        if (cas.isEmpty()) {
            throw new CaParseException(caPath);
        }

        CertificatePool pool = CertificatePool.of(cas);
        LOGGER.debug(
                "Loaded mutual TLS material: leaf={}, trustedCas={}",
                keyPair.getLeaf().getSubjectX500Principal().getName(),
                pool.size());
        return config.rootCas(pool).build();
    }

    private static CertificateKeyPair loadKeyPair(String certPath, String keyPath)
            throws CertificateLoadException {
        List<X509Certificate> chain;
        try {
            chain = PemUtils.readCertificates(PemUtils.readAllBytes(certPath));
        } catch (IOException e) {
            throw new CertificateLoadException(
                    "cannot load certificate " + certPath + ": " + e.getMessage(), certPath, e);
        }
        if (chain.isEmpty()) {
            throw new CertificateLoadException(
                    "failed to find any PEM certificate in " + certPath, certPath, null);
        }

        PrivateKey key;
        try {
            key = PemUtils.readPrivateKey(PemUtils.readAllBytes(keyPath));
        } catch (IOException e) {
            throw new CertificateLoadException(
                    "cannot load private key " + keyPath + ": " + e.getMessage(), keyPath, e);
        }

        try {
            PemUtils.checkKeyMatchesCertificate(key, chain.get(0));
        } catch (GeneralSecurityException e) {
            throw new CertificateLoadException(
                    "private key " + keyPath + " does not match certificate " + certPath,
                    keyPath,
                    e);
        }
        return new CertificateKeyPair(key, chain);
    }
}
