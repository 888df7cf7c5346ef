package com.baskettecase.dsbroker.crypto;

/**
 * Output of an envelope encryption.
 *
 * @param ciphertext data encrypted under the data key (without the GCM tag)
 * @param wrappedDataKey data key wrapped under the wrapping key
 * @param iv GCM nonce used for the data encryption
 * @param tag GCM authentication tag
 * @param wrappingKeyName name of the wrapping key used
 * @param wrappingKeyNamespace namespace of the wrapping key used
 */
public record CipherRecord(
    byte[] ciphertext,
    byte[] wrappedDataKey,
    byte[] iv,
    byte[] tag,
    String wrappingKeyName,
    String wrappingKeyNamespace
) {

    // Never render the binary fields
    @Override
    public String toString() {
        return "CipherRecord[wrappingKey=" + wrappingKeyNamespace + "/" + wrappingKeyName + "]";
    }
}
