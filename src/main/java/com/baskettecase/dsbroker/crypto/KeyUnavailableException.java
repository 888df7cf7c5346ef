package com.baskettecase.dsbroker.crypto;

/**
 * A stored record names a wrapping key that is not the one currently loaded.
 */
public class KeyUnavailableException extends VaultException {

    public KeyUnavailableException(String keyName, String keyNamespace) {
        super("Wrapping key " + keyNamespace + "/" + keyName + " is not available");
    }
}
