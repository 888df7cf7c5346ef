package com.baskettecase.dsbroker.credential;

import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.crypto.KeyContext;
import com.baskettecase.dsbroker.crypto.VaultException;
import com.baskettecase.dsbroker.crypto.WrappingKeyStore;
import com.baskettecase.dsbroker.metadata.FilteringMetadataStore;
import com.baskettecase.dsbroker.metadata.MetadataRecord;
import com.baskettecase.dsbroker.metadata.MetadataStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CredentialWriteInterceptor
 */
@ExtendWith(MockitoExtension.class)
class CredentialWriteInterceptorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private MetadataStore delegate;

    private CredentialVault vault;
    private CredentialWriteInterceptor interceptor;

    @BeforeEach
    void setUp() {
        String key = Base64.getEncoder().encodeToString(new byte[32]);
        vault = new CredentialVault(WrappingKeyStore.fromBase64("default", "default", key));
        interceptor = new CredentialWriteInterceptor(vault, objectMapper);
    }

    private MetadataRecord credential(String id, Object authScheme, Object secret) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("authScheme", authScheme);
        attributes.put("secret", secret);
        return MetadataRecord.builder()
            .type(CredentialRecord.TYPE)
            .id(id)
            .attributes(attributes)
            .build();
    }

    @Test
    void testPlaintextReplacedByCipherRecord() {
        MetadataRecord result = interceptor.protect(credential("cred-1", "API_KEY", "hunter2"));

        assertEquals("cred-1", result.getId());
        assertFalse(result.getAttributes().containsKey("authScheme"));
        assertFalse(result.getAttributes().containsKey("secret"));
        assertTrue(CredentialRecord.isEncrypted(result.getAttributes()));
        for (Object value : result.getAttributes().values()) {
            assertFalse(String.valueOf(value).contains("hunter2"));
        }
    }

    @Test
    void testStoredCredentialDecryptsToOriginal() throws Exception {
        MetadataRecord result = interceptor.protect(credential("cred-1", "api_key", "hunter2"));
        CredentialRecord stored = CredentialRecord.fromMetadata(result);

        byte[] payload = vault.decrypt(stored.getCipherRecord(), new KeyContext("cred-1", "default"));

        try (AuthMaterial auth = AuthMaterial.fromPayload(objectMapper, payload)) {
            assertEquals(AuthScheme.API_KEY, auth.scheme());
            assertEquals("hunter2", auth.secretText());
        }
    }

    @Test
    void testObjectSecretSerialized() {
        Map<String, Object> secret = Map.of("username", "admin", "password", "hunter2");
        CredentialRecord stored = CredentialRecord.fromMetadata(
            interceptor.protect(credential("cred-1", "USERNAME_PASSWORD", secret)));

        byte[] payload = vault.decrypt(stored.getCipherRecord(), stored.keyContext());

        try (AuthMaterial auth = AuthMaterial.fromPayload(objectMapper, payload)) {
            assertEquals("admin", auth.secretField(objectMapper, "username"));
            assertEquals("hunter2", auth.secretField(objectMapper, "password"));
        }
    }

    @Test
    void testIdAssignedWhenAbsent() {
        MetadataRecord result = interceptor.protect(credential(null, "API_KEY", "hunter2"));

        assertNotNull(result.getId());
        CredentialRecord stored = CredentialRecord.fromMetadata(result);
        // The generated id is the one bound into the ciphertext
        assertNotNull(vault.decrypt(stored.getCipherRecord(), stored.keyContext()));
    }

    @Test
    void testOtherAttributesPreserved() {
        MetadataRecord record = credential("cred-1", "API_KEY", "hunter2");
        record.getAttributes().put("description", "prod cluster");

        MetadataRecord result = interceptor.protect(record);

        assertEquals("prod cluster", result.getAttribute("description"));
    }

    @Test
    void testNoAuthWithoutSecretAccepted() {
        MetadataRecord result = interceptor.protect(credential("cred-1", "NO_AUTH", null));

        assertTrue(CredentialRecord.isEncrypted(result.getAttributes()));
    }

    @Test
    void testMissingSecretRejected() {
        assertThrows(CredentialProtectionException.class,
            () -> interceptor.protect(credential("cred-1", "USERNAME_PASSWORD", null)));
        assertThrows(CredentialProtectionException.class,
            () -> interceptor.protect(credential("cred-1", "API_KEY", " ")));
    }

    @Test
    void testUnknownSchemeRejected() {
        CredentialProtectionException e = assertThrows(CredentialProtectionException.class,
            () -> interceptor.protect(credential("cred-1", "KERBEROS", "hunter2")));
        assertTrue(e.getMessage().contains("KERBEROS"));
    }

    @Test
    void testAlreadyEncryptedPassesThrough() {
        MetadataRecord encrypted = interceptor.protect(credential("cred-1", "API_KEY", "hunter2"));

        assertSame(encrypted, interceptor.protect(encrypted));
    }

    @Test
    void testRecordWithoutPayloadRejected() {
        MetadataRecord empty = MetadataRecord.builder().type(CredentialRecord.TYPE).id("cred-1").build();

        assertThrows(CredentialProtectionException.class, () -> interceptor.protect(empty));
    }

    @Test
    void testVaultFailureNeverReachesStore() {
        CredentialVault failingVault = org.mockito.Mockito.mock(CredentialVault.class);
        when(failingVault.encrypt(any(byte[].class), any(KeyContext.class)))
            .thenThrow(new VaultException("HSM unavailable"));

        MetadataStore store = new FilteringMetadataStore(delegate,
            List.of(new CredentialWriteInterceptor(failingVault, objectMapper)));

        assertThrows(CredentialProtectionException.class,
            () -> store.create(credential("cred-1", "API_KEY", "hunter2")));
        verify(delegate, never()).create(any());
    }

    @Test
    void testFilteringStoreEncryptsCredentialWrites() {
        when(delegate.create(any(MetadataRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        MetadataStore store = new FilteringMetadataStore(delegate, List.of(interceptor));

        MetadataRecord stored = store.create(credential("cred-1", "API_KEY", "hunter2"));

        assertTrue(CredentialRecord.isEncrypted(stored.getAttributes()));
        assertNull(stored.getAttributes().get("secret"));
    }

    @Test
    void testFilteringStoreLeavesOtherTypesAlone() {
        MetadataRecord dataSource = MetadataRecord.builder()
            .type("data-source")
            .id("ds-1")
            .attributes(new LinkedHashMap<>(Map.of("secret", "not-a-credential")))
            .build();
        when(delegate.create(dataSource)).thenReturn(dataSource);
        MetadataStore store = new FilteringMetadataStore(delegate, List.of(interceptor));

        assertSame(dataSource, store.create(dataSource));
        verify(delegate).create(dataSource);
    }
}
