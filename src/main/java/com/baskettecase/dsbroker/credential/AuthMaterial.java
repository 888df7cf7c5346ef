package com.baskettecase.dsbroker.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decrypted authentication material.
 *
 * Exists only while a client is being built. Never log or persist this object;
 * {@link #close()} zeroes the secret bytes.
 */
public final class AuthMaterial implements AutoCloseable {

    static final String SCHEME_FIELD = "authScheme";
    static final String SECRET_FIELD = "secret";

    private final AuthScheme scheme;
    private final byte[] secret;

    public AuthMaterial(AuthScheme scheme, byte[] secret) {
        this.scheme = scheme;
        this.secret = secret == null ? new byte[0] : secret;
    }

    public AuthScheme scheme() {
        return scheme;
    }

    /**
     * The secret as text, e.g. {@code {"user":"admin","pass":"..."}}
     */
    public String secretText() {
        return new String(secret, StandardCharsets.UTF_8);
    }

    /**
     * A field of a JSON-object secret, trying each name in turn; null if the secret is not an object.
     */
    public String secretField(ObjectMapper objectMapper, String... names) {
        try {
            JsonNode node = objectMapper.readTree(secret);
            if (node == null || !node.isObject()) {
                return null;
            }
            for (String name : names) {
                JsonNode value = node.get(name);
                if (value != null && !value.isNull()) {
                    return value.asText();
                }
            }
            return null;
        } catch (IOException e) {
            // Plain-text secret
            return null;
        }
    }

    /**
     * Serialize scheme and secret into the payload handed to the vault.
     */
    public static byte[] toPayload(ObjectMapper objectMapper, AuthScheme scheme, String secret) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SCHEME_FIELD, scheme.name());
        payload.put(SECRET_FIELD, secret == null ? "" : secret);
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize credential payload", e);
        }
    }

    /**
     * Parse a decrypted vault payload.
     */
    public static AuthMaterial fromPayload(ObjectMapper objectMapper, byte[] payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            AuthScheme scheme = AuthScheme.fromValue(node.path(SCHEME_FIELD).asText(null));
            String secret = node.path(SECRET_FIELD).asText("");
            return new AuthMaterial(scheme, secret.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Malformed credential payload", e);
        }
    }

    @Override
    public void close() {
        Arrays.fill(secret, (byte) 0);
    }

    @Override
    public String toString() {
        return "AuthMaterial[scheme=" + scheme + "]";
    }
}
