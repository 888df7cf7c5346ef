package com.baskettecase.dsbroker.broker;

import com.baskettecase.dsbroker.audit.AuditableEvent;
import com.baskettecase.dsbroker.audit.Auditor;
import com.baskettecase.dsbroker.config.BrokerProperties;
import com.baskettecase.dsbroker.credential.AuthScheme;
import com.baskettecase.dsbroker.credential.CredentialRecord;
import com.baskettecase.dsbroker.credential.CredentialWriteInterceptor;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.crypto.IntegrityException;
import com.baskettecase.dsbroker.crypto.WrappingKeyStore;
import com.baskettecase.dsbroker.datasource.CredentialUpdate;
import com.baskettecase.dsbroker.datasource.DataSourceRecord;
import com.baskettecase.dsbroker.datasource.DataSourceRegistration;
import com.baskettecase.dsbroker.datasource.DataSourceRegistry;
import com.baskettecase.dsbroker.metadata.FilteringMetadataStore;
import com.baskettecase.dsbroker.metadata.InMemoryMetadataStore;
import com.baskettecase.dsbroker.metadata.MetadataRecord;
import com.baskettecase.dsbroker.metadata.MetadataStore;
import com.baskettecase.dsbroker.metadata.NotFoundException;
import com.baskettecase.dsbroker.pool.PoolConstructionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Closeable;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DataSourceBroker wired to a real vault, write interceptor and client pool
 */
class DataSourceBrokerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryMetadataStore backingStore;
    private MetadataStore metadataStore;
    private CredentialVault vault;
    private DataSourceService<FakeClient> service;
    private DataSourceBroker<FakeClient> broker;
    private DataSourceRegistry registry;

    private final AtomicInteger constructions = new AtomicInteger();
    private final List<AuditableEvent> auditEvents = new CopyOnWriteArrayList<>();
    private final Auditor auditor = auditEvents::add;

    private volatile CountDownLatch buildGate = new CountDownLatch(0);
    private volatile RuntimeException buildFailure;

    @BeforeEach
    void setUp() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        vault = new CredentialVault(
            WrappingKeyStore.fromBase64("default", "default", Base64.getEncoder().encodeToString(key)));

        backingStore = new InMemoryMetadataStore();
        metadataStore = new FilteringMetadataStore(backingStore,
            List.of(new CredentialWriteInterceptor(vault, objectMapper)));

        BrokerProperties properties = new BrokerProperties();
        properties.getPool().setAcquireTimeout(Duration.ofSeconds(5));
        properties.getPool().setRetireGracePeriod(Duration.ofMillis(10));

        service = newService();
        broker = service.setup(properties);
        registry = new DataSourceRegistry(metadataStore, service);
    }

    private DataSourceService<FakeClient> newService() {
        return new DataSourceService<>(params -> {
            constructions.incrementAndGet();
            assertTrue(buildGate.await(5, TimeUnit.SECONDS));
            if (buildFailure != null) {
                throw buildFailure;
            }
            return new FakeClient(params.endpoint(), params.auth().scheme(),
                params.auth().secretField(objectMapper, "password", "pass"));
        }, vault, objectMapper, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    private DataSourceRecord registerDs1() {
        DataSourceRegistration registration = new DataSourceRegistration();
        registration.setId("ds-1");
        registration.setTitle("Logs cluster");
        registration.setEndpoint("https://cluster.example:9200");
        registration.setAuthScheme("USERNAME_PASSWORD");
        registration.setSecret(Map.of("user", "admin", "pass", "hunter2"));
        return registry.register(registration);
    }

    @Test
    void testCredentialNeverStoredInPlaintext() {
        DataSourceRecord dataSource = registerDs1();

        MetadataRecord stored = backingStore.get(CredentialRecord.TYPE, dataSource.getCredentialId());
        assertTrue(CredentialRecord.isEncrypted(stored.getAttributes()));
        for (Object value : stored.getAttributes().values()) {
            assertFalse(String.valueOf(value).contains("hunter2"));
        }
        for (Object value : backingStore.get(DataSourceRecord.TYPE, "ds-1").getAttributes().values()) {
            assertFalse(String.valueOf(value).contains("hunter2"));
        }
    }

    @Test
    void testConcurrentCallersShareOneClient() throws Exception {
        registerDs1();
        buildGate = new CountDownLatch(1);

        CompletableFuture<FakeClient> first = broker.getDataSourceClient("ds-1", metadataStore, vault, auditor);
        CompletableFuture<FakeClient> second = broker.getDataSourceClient("ds-1", metadataStore, vault, auditor);
        buildGate.countDown();

        FakeClient client = first.get(5, TimeUnit.SECONDS);
        assertSame(client, second.get(5, TimeUnit.SECONDS));
        assertEquals(1, constructions.get());

        // Decrypted credential reached the client
        assertEquals("hunter2", client.password);
        assertEquals(AuthScheme.USERNAME_PASSWORD, client.scheme);

        // One audit event per successful call
        assertEquals(2, auditEvents.size());
        for (AuditableEvent event : auditEvents) {
            assertEquals("ds-1", event.dataSourceId());
            assertEquals(DataSourceBroker.CLIENT_CALL_EVENT, event.type());
        }
    }

    @Test
    void testMissingDataSourceFailsWithoutAudit() {
        CompletableFuture<FakeClient> future = broker.getDataSourceClient("missing", metadataStore, vault, auditor);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        DataSourceAccessException accessException = assertInstanceOf(DataSourceAccessException.class, e.getCause());
        assertEquals("missing", accessException.getDataSourceId());
        assertTrue(accessException.getMessage().contains("missing"));
        assertInstanceOf(NotFoundException.class, accessException.getCause());

        assertTrue(auditEvents.isEmpty());
        assertEquals(0, constructions.get());
    }

    @Test
    void testTamperedCredentialFailsWithoutAudit() {
        DataSourceRecord dataSource = registerDs1();
        MetadataRecord stored = backingStore.get(CredentialRecord.TYPE, dataSource.getCredentialId());
        Map<String, Object> attributes = new LinkedHashMap<>(stored.getAttributes());
        attributes.put("tag", Base64.getEncoder().encodeToString(new byte[16]));
        backingStore.update(stored.toBuilder().attributes(attributes).build());

        DataSourceAccessException e = assertThrows(DataSourceAccessException.class,
            () -> broker.getClient("ds-1", metadataStore, auditor));

        assertInstanceOf(IntegrityException.class, e.getCause());
        assertFalse(e.getMessage().contains("hunter2"));
        assertTrue(auditEvents.isEmpty());
        assertEquals(0, constructions.get());
    }

    @Test
    void testConstructionFailureIsRetried() {
        registerDs1();
        buildFailure = new IllegalStateException("connection refused");

        DataSourceAccessException e = assertThrows(DataSourceAccessException.class,
            () -> broker.getClient("ds-1", metadataStore, auditor));
        assertInstanceOf(PoolConstructionException.class, e.getCause());
        assertTrue(auditEvents.isEmpty());

        buildFailure = null;
        assertNotNull(broker.getClient("ds-1", metadataStore, auditor));
        assertEquals(2, constructions.get());
        assertEquals(1, auditEvents.size());
    }

    @Test
    void testTimedOutCallIsNotAudited() {
        registerDs1();
        service.stop();
        BrokerProperties properties = new BrokerProperties();
        properties.getPool().setAcquireTimeout(Duration.ofMillis(200));
        service = newService();
        broker = service.setup(properties);
        buildGate = new CountDownLatch(1);

        DataSourceAccessException e = assertThrows(DataSourceAccessException.class,
            () -> broker.getClient("ds-1", metadataStore, auditor));
        assertInstanceOf(TimeoutException.class, e.getCause());

        // The construction outlives the timed-out caller and serves the next one
        buildGate.countDown();
        assertNotNull(broker.getClient("ds-1", metadataStore, auditor));
        assertEquals(1, constructions.get());
        assertEquals(1, auditEvents.size());
    }

    @Test
    void testCancelledCallIsNotAudited() throws Exception {
        registerDs1();
        buildGate = new CountDownLatch(1);

        CompletableFuture<FakeClient> abandoned = broker.getDataSourceClient("ds-1", metadataStore, vault, auditor);
        assertTrue(abandoned.cancel(true));
        CompletableFuture<FakeClient> waiting = broker.getDataSourceClient("ds-1", metadataStore, vault, auditor);
        buildGate.countDown();

        assertNotNull(waiting.get(5, TimeUnit.SECONDS));
        assertEquals(1, constructions.get());
        assertEquals(1, auditEvents.size());
    }

    @Test
    void testRotatedCredentialBuildsNewClient() {
        registerDs1();
        FakeClient original = broker.getClient("ds-1", metadataStore, auditor);

        CredentialUpdate update = new CredentialUpdate();
        update.setAuthScheme("USERNAME_PASSWORD");
        update.setSecret(Map.of("username", "admin", "password", "correct-horse"));
        registry.rotateCredential("ds-1", update);

        FakeClient rotated = broker.getClient("ds-1", metadataStore, auditor);

        assertNotSame(original, rotated);
        assertEquals("correct-horse", rotated.password);
        assertEquals(2, constructions.get());
    }

    @Test
    void testDataSourceWithoutCredentialUsesNoAuth() {
        backingStore.create(DataSourceRecord.builder()
            .id("ds-open")
            .title("Open cluster")
            .engineType("opensearch")
            .endpoint("http://localhost:9200")
            .build()
            .toMetadata());

        FakeClient client = broker.getClient("ds-open", metadataStore, auditor);

        assertEquals(AuthScheme.NO_AUTH, client.scheme);
        assertEquals(1, auditEvents.size());
    }

    @Test
    void testAuditorFailureDoesNotFailCall() {
        registerDs1();
        Auditor failing = event -> {
            throw new IllegalStateException("audit backend down");
        };

        assertNotNull(broker.getClient("ds-1", metadataStore, failing));
    }

    @Test
    void testStoppedServiceRejectsCalls() {
        registerDs1();
        service.stop();

        DataSourceAccessException e = assertThrows(DataSourceAccessException.class,
            () -> broker.getClient("ds-1", metadataStore, auditor));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testSetupOnlyOnce() {
        assertThrows(IllegalStateException.class, () -> service.setup(new BrokerProperties()));
    }

    static class FakeClient implements Closeable {
        final String endpoint;
        final AuthScheme scheme;
        final String password;

        FakeClient(String endpoint, AuthScheme scheme, String password) {
            this.endpoint = endpoint;
            this.scheme = scheme;
            this.password = password;
        }

        @Override
        public void close() {
        }
    }
}
