package com.baskettecase.dsbroker.credential;

import com.baskettecase.dsbroker.crypto.CipherRecord;
import com.baskettecase.dsbroker.crypto.KeyContext;
import com.baskettecase.dsbroker.metadata.MetadataRecord;
import lombok.Data;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encrypted credential as it is stored.
 *
 * Binary fields are kept Base64-encoded in the record attributes. The wrapping key
 * name/namespace are stored so records can be located for re-encryption.
 */
@Data
public class CredentialRecord {

    public static final String TYPE = "credential";

    static final String CIPHERTEXT = "ciphertext";
    static final String WRAPPED_DATA_KEY = "wrappedDataKey";
    static final String IV = "iv";
    static final String TAG = "tag";
    static final String WRAPPING_KEY_NAME = "wrappingKeyName";
    static final String WRAPPING_KEY_NAMESPACE = "wrappingKeyNamespace";

    private String id;
    private String namespace;
    private CipherRecord cipherRecord;
    private long version;

    /**
     * The AAD this record's ciphertext is bound to
     */
    public KeyContext keyContext() {
        return new KeyContext(id, namespace);
    }

    /**
     * Changes on every re-encryption, even when the store version does not.
     */
    public String credentialVersion() {
        return version + ":" + Base64.getEncoder().encodeToString(cipherRecord.tag());
    }

    /**
     * Whether the attributes already hold a complete cipher record
     */
    public static boolean isEncrypted(Map<String, Object> attributes) {
        return attributes != null
            && attributes.get(CIPHERTEXT) != null
            && attributes.get(WRAPPED_DATA_KEY) != null
            && attributes.get(IV) != null
            && attributes.get(TAG) != null
            && attributes.get(WRAPPING_KEY_NAME) != null
            && attributes.get(WRAPPING_KEY_NAMESPACE) != null;
    }

    public static Map<String, Object> toAttributes(CipherRecord cipherRecord) {
        Base64.Encoder encoder = Base64.getEncoder();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(CIPHERTEXT, encoder.encodeToString(cipherRecord.ciphertext()));
        attributes.put(WRAPPED_DATA_KEY, encoder.encodeToString(cipherRecord.wrappedDataKey()));
        attributes.put(IV, encoder.encodeToString(cipherRecord.iv()));
        attributes.put(TAG, encoder.encodeToString(cipherRecord.tag()));
        attributes.put(WRAPPING_KEY_NAME, cipherRecord.wrappingKeyName());
        attributes.put(WRAPPING_KEY_NAMESPACE, cipherRecord.wrappingKeyNamespace());
        return attributes;
    }

    /**
     * Typed view of a stored credential.
     *
     * @throws IllegalStateException if the record is not a complete encrypted credential
     */
    public static CredentialRecord fromMetadata(MetadataRecord record) {
        if (!TYPE.equals(record.getType()) || !isEncrypted(record.getAttributes())) {
            throw new IllegalStateException(
                "Record " + record.getType() + "/" + record.getId() + " is not an encrypted credential");
        }

        Base64.Decoder decoder = Base64.getDecoder();
        CipherRecord cipherRecord = new CipherRecord(
            decoder.decode(record.getAttribute(CIPHERTEXT)),
            decoder.decode(record.getAttribute(WRAPPED_DATA_KEY)),
            decoder.decode(record.getAttribute(IV)),
            decoder.decode(record.getAttribute(TAG)),
            record.getAttribute(WRAPPING_KEY_NAME),
            record.getAttribute(WRAPPING_KEY_NAMESPACE)
        );

        CredentialRecord credential = new CredentialRecord();
        credential.setId(record.getId());
        credential.setNamespace(record.getNamespace());
        credential.setCipherRecord(cipherRecord);
        credential.setVersion(record.getVersion());
        return credential;
    }
}
