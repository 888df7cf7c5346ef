package com.baskettecase.dsbroker.pool;

import com.baskettecase.dsbroker.credential.AuthMaterial;
import com.baskettecase.dsbroker.credential.AuthScheme;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionParams
 */
class ConnectionParamsTest {

    private static ConnectionParams params(String endpoint, AuthScheme scheme, String secret, String version) {
        return new ConnectionParams(endpoint, new AuthMaterial(scheme, secret.getBytes(StandardCharsets.UTF_8)), version);
    }

    @Test
    void testFingerprintIsStable() {
        String first = params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1:abc").fingerprint();
        String second = params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1:abc").fingerprint();

        assertEquals(first, second);
        assertEquals(32, first.length());
    }

    @Test
    void testFingerprintTracksConnectionChanges() {
        String base = params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1:abc").fingerprint();

        assertNotEquals(base, params("http://localhost:9201", AuthScheme.API_KEY, "hunter2", "1:abc").fingerprint());
        assertNotEquals(base, params("http://localhost:9200", AuthScheme.USERNAME_PASSWORD, "hunter2", "1:abc").fingerprint());
        assertNotEquals(base, params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "2:def").fingerprint());
    }

    @Test
    void testFingerprintIgnoresSecretBytes() {
        // Secrets only change together with the credential version
        assertEquals(
            params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1:abc").fingerprint(),
            params("http://localhost:9200", AuthScheme.API_KEY, "other", "1:abc").fingerprint());
    }

    @Test
    void testCloseScrubsSecret() {
        ConnectionParams params = params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1");

        params.close();

        assertNotEquals("hunter2", params.auth().secretText());
        assertFalse(params.auth().secretText().contains("hunter"));
    }

    @Test
    void testToStringOmitsSecret() {
        ConnectionParams params = params("http://localhost:9200", AuthScheme.API_KEY, "hunter2", "1");

        assertFalse(params.toString().contains("hunter2"));
        assertFalse(params.auth().toString().contains("hunter2"));
    }
}
