package org.cloudfoundry.logcache.core.tls;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PEM utilities for loading TLS identity and trust material.
 *
 * <p>Supported inputs:
 * - Private keys in PKCS#1 ("BEGIN RSA PRIVATE KEY"), SEC1 ("BEGIN EC PRIVATE KEY") or
 *   unencrypted PKCS#8 ("BEGIN PRIVATE KEY").
 * - Any number of "BEGIN CERTIFICATE" blocks.
 * Blocks of other types, and blocks with a corrupt body, are skipped.
 */
public final class PemUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PemUtils.class);
    private static final String CERTIFICATE_TYPE = "CERTIFICATE";
    private static final String PRIVATE_KEY_SUFFIX = "PRIVATE KEY";
    private static final byte[] KEY_CHECK_CHALLENGE =
            "logcache key pair check".getBytes(StandardCharsets.US_ASCII);

    private PemUtils() {}

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static byte[] readAllBytes(String path) throws IOException {
        return Files.readAllBytes(Paths.get(path));
    }

    /**
     * Decodes every certificate block in {@code pemBytes}, in file order. Blocks whose base64 body
     * or content is not a valid X.509 certificate are skipped, as are other block types.
     *
     * @throws IOException if the input cannot be scanned
     */
    public static List<X509Certificate> readCertificates(byte[] pemBytes) throws IOException {
        CertificateFactory factory;
        try {
            factory = CertificateFactory.getInstance("X.509");
        } catch (CertificateException e) {
            throw new IllegalStateException("X.509 certificate factory unavailable", e);
        }

        List<X509Certificate> certificates = new ArrayList<>();
        for (PemObject block : readBlocks(pemBytes)) {
            if (!CERTIFICATE_TYPE.equals(block.getType())) {
                continue;
            }
            try {
                certificates.add(
                        (X509Certificate)
                                factory.generateCertificate(
                                        new ByteArrayInputStream(block.getContent())));
            } catch (CertificateException e) {
                LOGGER.debug("Skipping unparseable certificate block: {}", e.getMessage());
            }
        }
        return certificates;
    }

    /**
     * Returns the first private key found in {@code keyPemBytes}.
     *
     * @throws IOException if no readable key block is present, the key is encrypted, or it
     *     cannot be decoded
     */
    public static PrivateKey readPrivateKey(byte[] keyPemBytes) throws IOException {
        PemObject keyBlock = null;
        for (PemObject block : readBlocks(keyPemBytes)) {
            if (block.getType().endsWith(PRIVATE_KEY_SUFFIX)) {
                keyBlock = block;
                break;
            }
        }
        if (keyBlock == null) {
            throw new IOException("Failed to find PEM block with type ending in PRIVATE KEY");
        }

        Object parsed = parseKeyBlock(keyBlock);
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try {
            if (parsed instanceof PKCS8EncryptedPrivateKeyInfo
                    || parsed instanceof PEMEncryptedKeyPair) {
                throw new IOException("Encrypted private keys are not supported");
            } else if (parsed instanceof PEMKeyPair) {
                return converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
            } else if (parsed instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) parsed);
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Malformed private key: " + e.getMessage(), e);
        }
        throw new IOException("Unsupported private key block: " + keyBlock.getType());
    }

    /**
     * Proves that {@code key} is the private half of the certificate's public key by signing a
     * fixed challenge and verifying it with the certificate.
     */
    public static void checkKeyMatchesCertificate(PrivateKey key, X509Certificate certificate)
            throws GeneralSecurityException {
        PublicKey publicKey = certificate.getPublicKey();
        if (!publicKey.getAlgorithm().equals(key.getAlgorithm())) {
            throw new InvalidKeyException(
                    "Private key type "
                            + key.getAlgorithm()
                            + " does not match public key type "
                            + publicKey.getAlgorithm());
        }
        String algorithm = signatureAlgorithm(key.getAlgorithm());

        Signature signer = Signature.getInstance(algorithm);
        signer.initSign(key);
        signer.update(KEY_CHECK_CHALLENGE);
        byte[] signature = signer.sign();

        Signature verifier = Signature.getInstance(algorithm);
        verifier.initVerify(publicKey);
        verifier.update(KEY_CHECK_CHALLENGE);
        if (!verifier.verify(signature)) {
            throw new InvalidKeyException("Private key does not match public key");
        }
    }

    private static String signatureAlgorithm(String keyAlgorithm) throws NoSuchAlgorithmException {
        switch (keyAlgorithm) {
            case "RSA":
                return "SHA256withRSA";
            case "EC":
                return "SHA256withECDSA";
            case "EdDSA":
            case "Ed25519":
                return "Ed25519";
            default:
                throw new NoSuchAlgorithmException("Unsupported private key type: " + keyAlgorithm);
        }
    }

    /**
     * Splits {@code pemBytes} into PEM blocks. Text outside blocks is ignored; a block whose body
     * is not valid base64 is skipped and scanning resumes after its END line.
     */
    private static List<PemObject> readBlocks(byte[] pemBytes) throws IOException {
        List<PemObject> blocks = new ArrayList<>();
        try (PemReader reader =
                new PemReader(new StringReader(new String(pemBytes, StandardCharsets.US_ASCII)))) {
            while (true) {
                PemObject block;
                try {
                    block = reader.readPemObject();
                } catch (DecoderException e) {
                    LOGGER.debug("Skipping PEM block with malformed body: {}", e.getMessage());
                    continue;
                }
                if (block == null) {
                    return blocks;
                }
                blocks.add(block);
            }
        }
    }

    /** Hands a single key block to {@link PEMParser}, which knows the key encodings. */
    private static Object parseKeyBlock(PemObject block) throws IOException {
        StringWriter pem = new StringWriter();
        try (PemWriter writer = new PemWriter(pem)) {
            writer.writeObject(block);
        }
        try (PEMParser parser = new PEMParser(new StringReader(pem.toString()))) {
            return parser.readObject();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Malformed private key: " + e.getMessage(), e);
        }
    }
}
