package com.baskettecase.dsbroker.crypto;

/**
 * Base class for credential vault failures.
 * Messages never carry plaintext, ciphertext or key material.
 */
public class VaultException extends RuntimeException {

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
