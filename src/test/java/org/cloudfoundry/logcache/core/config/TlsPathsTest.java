package org.cloudfoundry.logcache.core.config;

import org.cloudfoundry.logcache.core.BaseTest;
import org.cloudfoundry.logcache.core.grpc.TransportCredentials;
import org.cloudfoundry.logcache.exception.CertificateLoadException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TlsPathsTest extends BaseTest {
    @Test
    public void buildsCredentialsFromConfiguredPaths() throws Exception {
        TlsPaths paths = TlsPaths.builder().caPath(caPath).certPath(certPath).keyPath(keyPath).build();

        TransportCredentials creds = paths.transportCredentials(SERVER_NAME);
        Assert.assertEquals(creds.getServerName(), SERVER_NAME);
        Assert.assertTrue(creds.getConfig().getRootCas().contains(caCert));
    }

    @Test(expectedExceptions = CertificateLoadException.class)
    public void surfacesConfigurationErrors() throws Exception {
        TlsPaths paths =
                TlsPaths.builder().caPath(caPath).certPath(certPath).keyPath(otherKeyPath).build();
        paths.transportCredentials(SERVER_NAME);
    }
}
