package com.baskettecase.dsbroker.pool;

import com.baskettecase.dsbroker.credential.AuthMaterial;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Everything needed to build a client for one data source.
 *
 * Holds decrypted auth material; {@link #close()} scrubs it. The fingerprint covers the
 * endpoint, the auth scheme and the credential version, never the secret itself. The
 * revision orders parameter sets for the same data source, so a caller holding stale
 * parameters cannot displace a newer pooled client.
 */
public final class ConnectionParams implements AutoCloseable {

    private final String endpoint;
    private final AuthMaterial auth;
    private final String credentialVersion;
    private final long revision;

    public ConnectionParams(String endpoint, AuthMaterial auth, String credentialVersion) {
        this(endpoint, auth, credentialVersion, 0L);
    }

    public ConnectionParams(String endpoint, AuthMaterial auth, String credentialVersion, long revision) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.credentialVersion = credentialVersion == null ? "" : credentialVersion;
        this.revision = revision;
    }

    public String endpoint() {
        return endpoint;
    }

    public AuthMaterial auth() {
        return auth;
    }

    public String credentialVersion() {
        return credentialVersion;
    }

    public long revision() {
        return revision;
    }

    /**
     * Stable digest of the connection parameters, used in the pool's cache key
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(endpoint.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(auth.scheme().name().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(credentialVersion.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest(), 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    @Override
    public void close() {
        auth.close();
    }

    @Override
    public String toString() {
        return "ConnectionParams[endpoint=" + endpoint + ", scheme=" + auth.scheme() + "]";
    }
}
