package com.baskettecase.dsbroker.crypto;

import lombok.Getter;
import lombok.ToString;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * The master key used only to wrap and unwrap per-record data keys.
 * Never log or persist the key material.
 */
@Getter
@ToString
public final class WrappingKey {

    private final String name;
    private final String namespace;

    @ToString.Exclude
    private final SecretKey key;

    public WrappingKey(String name, String namespace, SecretKey key) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.key = Objects.requireNonNull(key, "key");
    }

    /**
     * Whether this key is the one identified by the given name and namespace
     */
    public boolean matches(String keyName, String keyNamespace) {
        return name.equals(keyName) && namespace.equals(keyNamespace);
    }
}
