package com.baskettecase.dsbroker.datasource;

import com.baskettecase.dsbroker.broker.DataSourceService;
import com.baskettecase.dsbroker.credential.CredentialRecord;
import com.baskettecase.dsbroker.metadata.MetadataRecord;
import com.baskettecase.dsbroker.metadata.MetadataStore;
import com.baskettecase.dsbroker.metadata.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Data Source Registry
 *
 * Creates, lists, rotates and removes data sources. Every write goes through the
 * {@link MetadataStore}, so credential payloads are encrypted by the write interceptor
 * before they are persisted. Nothing here decrypts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceRegistry {

    private final MetadataStore metadataStore;
    private final DataSourceService<?> dataSourceService;

    /**
     * Register a data source and its credential
     *
     * @return The stored data source (no secret material)
     */
    public DataSourceRecord register(DataSourceRegistration registration) {
        String namespace = registration.getNamespace() != null ? registration.getNamespace() : "default";

        MetadataRecord credential = metadataStore.create(MetadataRecord.builder()
            .type(CredentialRecord.TYPE)
            .id(UUID.randomUUID().toString())
            .namespace(namespace)
            .attributes(plaintextPayload(registration.getAuthScheme(), registration.getSecret()))
            .build());

        DataSourceRecord dataSource = DataSourceRecord.builder()
            .id(registration.getId() != null ? registration.getId() : UUID.randomUUID().toString())
            .title(registration.getTitle())
            .engineType(registration.getEngineType())
            .endpoint(registration.getEndpoint())
            .credentialId(credential.getId())
            .namespace(namespace)
            .build();

        try {
            metadataStore.create(dataSource.toMetadata());
        } catch (RuntimeException e) {
            log.error("Failed to store data source {}; removing orphaned credential {}",
                dataSource.getId(), credential.getId());
            metadataStore.delete(CredentialRecord.TYPE, credential.getId());
            throw e;
        }

        log.info("Registered data source {} ({})", dataSource.getId(), dataSource.getEndpoint());
        return dataSource;
    }

    /**
     * Replace the credential of a data source. Pooled clients built with the old
     * credential are retired; the next request builds a fresh one.
     */
    public DataSourceRecord rotateCredential(String id, CredentialUpdate update) {
        DataSourceRecord dataSource = get(id);

        metadataStore.update(MetadataRecord.builder()
            .type(CredentialRecord.TYPE)
            .id(dataSource.getCredentialId())
            .namespace(dataSource.getNamespace())
            .attributes(plaintextPayload(update.getAuthScheme(), update.getSecret()))
            .build());

        int retired = dataSourceService.invalidate(id);
        log.info("Rotated credential for data source {} ({} pooled client(s) retired)", id, retired);
        return dataSource;
    }

    public List<DataSourceRecord> list() {
        return metadataStore.find(DataSourceRecord.TYPE).stream()
            .map(DataSourceRecord::fromMetadata)
            .toList();
    }

    /**
     * @throws NotFoundException if no such data source exists
     */
    public DataSourceRecord get(String id) {
        return DataSourceRecord.fromMetadata(metadataStore.get(DataSourceRecord.TYPE, id));
    }

    /**
     * Remove a data source, its credential and any pooled clients
     */
    public void delete(String id) {
        DataSourceRecord dataSource = get(id);
        metadataStore.delete(DataSourceRecord.TYPE, id);

        try {
            metadataStore.delete(CredentialRecord.TYPE, dataSource.getCredentialId());
        } catch (NotFoundException e) {
            log.warn("Credential {} of data source {} was already gone", dataSource.getCredentialId(), id);
        }

        dataSourceService.invalidate(id);
        log.info("Deleted data source {}", id);
    }

    private Map<String, Object> plaintextPayload(String authScheme, Object secret) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("authScheme", authScheme);
        attributes.put("secret", secret);
        return attributes;
    }
}
