package com.baskettecase.dsbroker.crypto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Envelope encryption of credential material.
 *
 * Each call generates a fresh 256-bit data key, encrypts the payload with AES-256-GCM under it and
 * wraps the data key under the process wrapping key (AES key wrap, RFC 3394). The record's
 * {@link KeyContext} is bound as additional authenticated data, so a ciphertext copied onto another
 * record fails to decrypt.
 *
 * Instances are safe for concurrent use; the only shared state is the read-only wrapping key.
 */
@Slf4j
@Service
public class CredentialVault {

    private static final String DATA_ALGORITHM = "AES/GCM/NoPadding";
    private static final String WRAP_ALGORITHM = "AESWrap";
    private static final int DATA_KEY_LENGTH = 32; // 256 bits
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 16; // 128 bits

    private final WrappingKeyStore keyStore;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialVault(WrappingKeyStore keyStore) {
        this.keyStore = keyStore;
        log.info("Credential vault initialized with AES-256-GCM envelope encryption");
    }

    /**
     * Encrypt a credential payload for the record identified by {@code context}.
     *
     * @param plaintext The payload to encrypt (never null); the caller owns and scrubs it
     * @param context Identity of the owning record, bound as AAD
     * @return The cipher record to persist
     */
    public CipherRecord encrypt(byte[] plaintext, KeyContext context) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Cannot encrypt null value");
        }

        WrappingKey wrappingKey = keyStore.current();
        byte[] dataKeyBytes = new byte[DATA_KEY_LENGTH];
        try {
            secureRandom.nextBytes(dataKeyBytes);
            SecretKey dataKey = new SecretKeySpec(dataKeyBytes, "AES");

            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(DATA_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, dataKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            cipher.updateAAD(context.toAad());
            byte[] sealed = cipher.doFinal(plaintext);

            // GCM appends the tag to the ciphertext; store them separately
            int ciphertextLength = sealed.length - GCM_TAG_LENGTH;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ciphertextLength);
            byte[] tag = Arrays.copyOfRange(sealed, ciphertextLength, sealed.length);

            Cipher wrapper = Cipher.getInstance(WRAP_ALGORITHM);
            wrapper.init(Cipher.WRAP_MODE, wrappingKey.getKey());
            byte[] wrappedDataKey = wrapper.wrap(dataKey);

            return new CipherRecord(ciphertext, wrappedDataKey, iv, tag,
                wrappingKey.getName(), wrappingKey.getNamespace());

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed for {}", context, e);
            throw new VaultException("Failed to encrypt credential for " + context, e);
        } finally {
            Arrays.fill(dataKeyBytes, (byte) 0);
        }
    }

    /**
     * Decrypt a cipher record produced by {@link #encrypt(byte[], KeyContext)}.
     *
     * The returned array holds plaintext; callers must zero it once the client has been built.
     *
     * @throws KeyUnavailableException if the record was wrapped under a key that is not loaded
     * @throws IntegrityException if any part of the record, or the context, does not verify
     */
    public byte[] decrypt(CipherRecord record, KeyContext context) {
        if (record == null) {
            throw new IllegalArgumentException("Cannot decrypt null record");
        }

        WrappingKey wrappingKey = keyStore.resolve(record.wrappingKeyName(), record.wrappingKeyNamespace());

        if (record.ciphertext() == null || record.wrappedDataKey() == null
            || record.iv() == null || record.iv().length != GCM_IV_LENGTH
            || record.tag() == null || record.tag().length != GCM_TAG_LENGTH) {
            log.error("Malformed cipher record for {}", context);
            throw new IntegrityException(context);
        }

        try {
            Key dataKey = unwrap(wrappingKey, record.wrappedDataKey(), context);

            byte[] sealed = new byte[record.ciphertext().length + GCM_TAG_LENGTH];
            System.arraycopy(record.ciphertext(), 0, sealed, 0, record.ciphertext().length);
            System.arraycopy(record.tag(), 0, sealed, record.ciphertext().length, GCM_TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(DATA_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, dataKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, record.iv()));
            cipher.updateAAD(context.toAad());
            return cipher.doFinal(sealed);

        } catch (AEADBadTagException e) {
            log.error("Authentication tag mismatch for {}", context);
            throw new IntegrityException(context, e);
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed for {}", context, e);
            throw new VaultException("Failed to decrypt credential for " + context, e);
        }
    }

    /**
     * Convenience for string payloads; the intermediate byte array is scrubbed.
     */
    public CipherRecord encrypt(String plaintext, KeyContext context) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Cannot encrypt null value");
        }
        byte[] bytes = plaintext.getBytes(StandardCharsets.UTF_8);
        try {
            return encrypt(bytes, context);
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    private Key unwrap(WrappingKey wrappingKey, byte[] wrappedDataKey, KeyContext context)
            throws GeneralSecurityException {
        Cipher unwrapper = Cipher.getInstance(WRAP_ALGORITHM);
        try {
            unwrapper.init(Cipher.UNWRAP_MODE, wrappingKey.getKey());
            return unwrapper.unwrap(wrappedDataKey, "AES", Cipher.SECRET_KEY);
        } catch (InvalidKeyException e) {
            // RFC 3394 integrity check failure
            log.error("Wrapped data key failed verification for {}", context);
            throw new IntegrityException(context, e);
        }
    }
}
