package com.baskettecase.dsbroker.credential;

import com.baskettecase.dsbroker.crypto.CipherRecord;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.crypto.KeyContext;
import com.baskettecase.dsbroker.metadata.MetadataRecord;
import com.baskettecase.dsbroker.metadata.WriteFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Encrypts credential records on their way into the metadata store.
 *
 * Incoming credential records carry the plaintext as {@code authScheme} and {@code secret}
 * attributes. Both are replaced by the vault's cipher record before the delegate store sees
 * the record. Reads are never intercepted: stored credentials stay encrypted until the broker
 * decrypts one at the point of use.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialWriteInterceptor implements WriteFilter {

    private final CredentialVault vault;
    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(String type) {
        return CredentialRecord.TYPE.equals(type);
    }

    @Override
    public MetadataRecord beforeWrite(MetadataRecord record) {
        return protect(record);
    }

    /**
     * Replace the plaintext credential payload with its encrypted form.
     *
     * @param record Credential record carrying plaintext, or an already-encrypted record
     * @return A copy safe to persist
     * @throws CredentialProtectionException if the payload is missing, invalid or cannot be encrypted
     */
    public MetadataRecord protect(MetadataRecord record) {
        Map<String, Object> attributes = record.getAttributes() == null ? Map.of() : record.getAttributes();
        boolean carriesPlaintext = attributes.containsKey(AuthMaterial.SCHEME_FIELD)
            || attributes.containsKey(AuthMaterial.SECRET_FIELD);

        if (!carriesPlaintext) {
            if (CredentialRecord.isEncrypted(attributes)) {
                return record;
            }
            throw new CredentialProtectionException("Credential record carries no credential payload");
        }

        AuthScheme scheme;
        try {
            scheme = AuthScheme.fromValue(stringValue(attributes.get(AuthMaterial.SCHEME_FIELD)));
        } catch (IllegalArgumentException e) {
            throw new CredentialProtectionException(e.getMessage(), e);
        }

        String secret = secretText(attributes.get(AuthMaterial.SECRET_FIELD));
        if (scheme != AuthScheme.NO_AUTH && (secret == null || secret.isBlank())) {
            throw new CredentialProtectionException("A secret is required for auth scheme " + scheme);
        }

        String id = record.getId() != null ? record.getId() : UUID.randomUUID().toString();
        String namespace = record.getNamespace() != null ? record.getNamespace() : "default";
        KeyContext context = new KeyContext(id, namespace);

        byte[] payload = AuthMaterial.toPayload(objectMapper, scheme, secret);
        CipherRecord cipherRecord;
        try {
            cipherRecord = vault.encrypt(payload, context);
        } catch (RuntimeException e) {
            log.error("Refusing to persist credential {}: encryption failed", context);
            throw new CredentialProtectionException("Failed to protect credential " + context, e);
        } finally {
            Arrays.fill(payload, (byte) 0);
        }

        Map<String, Object> protectedAttributes = new LinkedHashMap<>(attributes);
        protectedAttributes.remove(AuthMaterial.SCHEME_FIELD);
        protectedAttributes.remove(AuthMaterial.SECRET_FIELD);
        protectedAttributes.putAll(CredentialRecord.toAttributes(cipherRecord));

        log.debug("Encrypted credential {} under wrapping key {}/{}",
            context, cipherRecord.wrappingKeyNamespace(), cipherRecord.wrappingKeyName());

        return record.toBuilder()
            .id(id)
            .namespace(namespace)
            .attributes(protectedAttributes)
            .build();
    }

    private String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    // Secrets may arrive as a JSON object, e.g. {"user":"admin","pass":"..."}
    private String secretText(Object secret) {
        if (secret == null || secret instanceof String) {
            return (String) secret;
        }
        try {
            return objectMapper.writeValueAsString(secret);
        } catch (JsonProcessingException e) {
            throw new CredentialProtectionException("Credential secret is not serializable", e);
        }
    }
}
