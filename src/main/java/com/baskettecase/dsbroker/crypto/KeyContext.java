package com.baskettecase.dsbroker.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Identity of the record a ciphertext belongs to, bound into the encryption as AAD.
 */
public record KeyContext(String name, String namespace) {

    public KeyContext {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * Length-prefixed encoding so that ("ab", "c") and ("a", "bc") never collide.
     */
    public byte[] toAad() {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] namespaceBytes = namespace.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(8 + nameBytes.length + namespaceBytes.length)
            .putInt(namespaceBytes.length)
            .put(namespaceBytes)
            .putInt(nameBytes.length)
            .put(nameBytes)
            .array();
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
