package com.baskettecase.dsbroker.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.spec.SecretKeySpec;
import java.util.Base64;

/**
 * Holds the single process-wide wrapping key.
 *
 * The key is supplied once at startup and is immutable for the lifetime of the process.
 * Rotating it requires re-encrypting every stored credential, which is not done here.
 */
@Slf4j
public class WrappingKeyStore {

    private static final int KEY_LENGTH_BYTES = 32;

    private final WrappingKey wrappingKey;

    public WrappingKeyStore(WrappingKey wrappingKey) {
        this.wrappingKey = wrappingKey;
    }

    /**
     * Build a key store from a base64-encoded 256-bit key.
     *
     * @throws IllegalStateException if the material is missing or not 32 bytes
     */
    public static WrappingKeyStore fromBase64(String name, String namespace, String material) {
        if (material == null || material.trim().isEmpty()) {
            throw new IllegalStateException(
                "Wrapping key not configured. Set DSBROKER_WRAPPING_KEY environment variable " +
                "to a 32-byte base64-encoded string. Generate one with: " +
                "openssl rand -base64 32"
            );
        }

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(material.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid wrapping key format: " + e.getMessage(), e);
        }
        if (keyBytes.length != KEY_LENGTH_BYTES) {
            throw new IllegalStateException(
                "Wrapping key must be 32 bytes (256 bits). Current length: " + keyBytes.length
            );
        }

        WrappingKey key = new WrappingKey(name, namespace, new SecretKeySpec(keyBytes, "AES"));
        log.info("Loaded wrapping key {}/{}", namespace, name);
        return new WrappingKeyStore(key);
    }

    /**
     * The currently loaded wrapping key
     */
    public WrappingKey current() {
        return wrappingKey;
    }

    /**
     * Resolve the wrapping key a stored record was encrypted under.
     *
     * @throws KeyUnavailableException if the record names a key that is not loaded
     */
    public WrappingKey resolve(String keyName, String keyNamespace) {
        if (!wrappingKey.matches(keyName, keyNamespace)) {
            throw new KeyUnavailableException(keyName, keyNamespace);
        }
        return wrappingKey;
    }
}
