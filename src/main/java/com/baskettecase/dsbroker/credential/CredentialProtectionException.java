package com.baskettecase.dsbroker.credential;

/**
 * A credential could not be encrypted on the write path; nothing was persisted.
 */
public class CredentialProtectionException extends RuntimeException {

    public CredentialProtectionException(String message) {
        super(message);
    }

    public CredentialProtectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
