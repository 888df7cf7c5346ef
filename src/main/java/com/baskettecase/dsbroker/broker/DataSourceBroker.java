package com.baskettecase.dsbroker.broker;

import com.baskettecase.dsbroker.audit.AuditableEvent;
import com.baskettecase.dsbroker.audit.Auditor;
import com.baskettecase.dsbroker.credential.AuthMaterial;
import com.baskettecase.dsbroker.credential.AuthScheme;
import com.baskettecase.dsbroker.credential.CredentialRecord;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.crypto.VaultException;
import com.baskettecase.dsbroker.datasource.DataSourceRecord;
import com.baskettecase.dsbroker.metadata.MetadataReader;
import com.baskettecase.dsbroker.metadata.NotFoundException;
import com.baskettecase.dsbroker.pool.ClientPool;
import com.baskettecase.dsbroker.pool.ConnectionParams;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Data Source Broker
 *
 * Turns a data source id into a pooled client: reads the data source and its credential,
 * decrypts the credential, hands the connection parameters to the pool and records one
 * audit event on success. The decrypted material lives only until the pool has finished
 * with it.
 */
@Slf4j
public class DataSourceBroker<C extends Closeable> implements DataSourceServiceSetup<C> {

    public static final String CLIENT_CALL_EVENT = "opensearch.dataSourceClient.call.internalUser";

    private final ClientPool<C> clientPool;
    private final CredentialVault vault;
    private final ObjectMapper objectMapper;
    private final Duration acquireTimeout;

    public DataSourceBroker(ClientPool<C> clientPool, CredentialVault vault,
                            ObjectMapper objectMapper, Duration acquireTimeout) {
        this.clientPool = clientPool;
        this.vault = vault;
        this.objectMapper = objectMapper;
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * The event is recorded just before the returned future completes, and only if the caller
     * has not cancelled it by then.
     */
    @Override
    public CompletableFuture<C> getDataSourceClient(String dataSourceId, MetadataReader metadataReader,
                                                    CredentialVault vault, Auditor auditor) {
        CompletableFuture<C> result = new CompletableFuture<>();
        acquire(dataSourceId, metadataReader, vault).whenComplete((client, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            if (result.isDone()) {
                log.debug("Data source {}: caller abandoned the request before the client was ready", dataSourceId);
                return;
            }
            audit(auditor, dataSourceId);
            result.complete(client);
        });
        return result;
    }

    /**
     * Blocking variant using the broker's own vault. The audit event is recorded on the calling
     * thread once the client is in hand, so a call that times out is never audited.
     *
     * @throws DataSourceAccessException on any failure, with the underlying error as cause
     */
    public C getClient(String dataSourceId, MetadataReader metadataReader, Auditor auditor) {
        CompletableFuture<C> future = acquire(dataSourceId, metadataReader, vault);
        C client;
        try {
            client = future.get(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw wrap(dataSourceId, e.getCause());
        } catch (TimeoutException e) {
            // Only this wait is abandoned; the shared construction carries on
            throw wrap(dataSourceId, new TimeoutException("Timed out after " + acquireTimeout + " waiting for client"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw wrap(dataSourceId, e);
        }
        audit(auditor, dataSourceId);
        return client;
    }

    // Resolves and pools the client; never audits
    private CompletableFuture<C> acquire(String dataSourceId, MetadataReader metadataReader, CredentialVault vault) {
        ConnectionParams params;
        try {
            params = resolve(dataSourceId, metadataReader, vault);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(wrap(dataSourceId, e));
        }

        CompletableFuture<C> client;
        try {
            client = clientPool.getOrCreateAsync(dataSourceId, params);
        } catch (RuntimeException e) {
            params.close();
            return CompletableFuture.failedFuture(wrap(dataSourceId, e));
        }

        return client
            .whenComplete((ignored, error) -> params.close())
            .handle((result, error) -> {
                if (error != null) {
                    throw wrap(dataSourceId, unwrap(error));
                }
                return result;
            });
    }

    private ConnectionParams resolve(String dataSourceId, MetadataReader metadataReader, CredentialVault vault) {
        DataSourceRecord dataSource = DataSourceRecord.fromMetadata(
            metadataReader.get(DataSourceRecord.TYPE, dataSourceId));

        if (dataSource.getEndpoint() == null || dataSource.getEndpoint().isBlank()) {
            throw new IllegalStateException("Data source has no endpoint");
        }

        if (dataSource.getCredentialId() == null) {
            return new ConnectionParams(dataSource.getEndpoint(), new AuthMaterial(AuthScheme.NO_AUTH, null), "none", 0L);
        }

        CredentialRecord credential = CredentialRecord.fromMetadata(
            metadataReader.get(CredentialRecord.TYPE, dataSource.getCredentialId()));

        byte[] payload = vault.decrypt(credential.getCipherRecord(), credential.keyContext());
        try {
            AuthMaterial auth = AuthMaterial.fromPayload(objectMapper, payload);
            return new ConnectionParams(dataSource.getEndpoint(), auth,
                credential.credentialVersion(), credential.getVersion());
        } finally {
            Arrays.fill(payload, (byte) 0);
        }
    }

    private void audit(Auditor auditor, String dataSourceId) {
        try {
            auditor.record(new AuditableEvent(CLIENT_CALL_EVENT, dataSourceId));
        } catch (RuntimeException e) {
            log.error("Auditor failed for data source {}", dataSourceId, e);
        }
    }

    private DataSourceAccessException wrap(String dataSourceId, Throwable error) {
        if (error instanceof DataSourceAccessException accessException) {
            return accessException;
        }
        if (error instanceof NotFoundException) {
            log.warn("Data source {}: {}", dataSourceId, error.getMessage());
        } else if (error instanceof VaultException) {
            log.error("Data source {}: credential could not be decrypted ({})",
                dataSourceId, error.getClass().getSimpleName());
        } else {
            log.error("Data source {}: {}", dataSourceId, error.getMessage());
        }
        return new DataSourceAccessException(dataSourceId, error);
    }

    private Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
