package com.baskettecase.dsbroker.credential;

import java.util.Locale;

/**
 * How a pooled client authenticates against its cluster.
 */
public enum AuthScheme {
    NO_AUTH,
    USERNAME_PASSWORD,
    API_KEY;

    /**
     * Parse a scheme name; accepts "username_password" as well as "USERNAME_PASSWORD".
     *
     * @throws IllegalArgumentException for unknown schemes
     */
    public static AuthScheme fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Auth scheme is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported auth scheme: " + value);
        }
    }
}
