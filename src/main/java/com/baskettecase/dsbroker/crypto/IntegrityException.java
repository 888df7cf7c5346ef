package com.baskettecase.dsbroker.crypto;

/**
 * The authentication tag, AAD binding or wrapped data key failed verification.
 */
public class IntegrityException extends VaultException {

    public IntegrityException(KeyContext context) {
        super("Credential integrity check failed for " + context);
    }

    public IntegrityException(KeyContext context, Throwable cause) {
        super("Credential integrity check failed for " + context, cause);
    }
}
