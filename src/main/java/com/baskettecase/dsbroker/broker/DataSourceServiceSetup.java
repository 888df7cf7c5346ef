package com.baskettecase.dsbroker.broker;

import com.baskettecase.dsbroker.audit.Auditor;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.metadata.MetadataReader;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * What {@link DataSourceService#setup} hands to the rest of the application.
 */
public interface DataSourceServiceSetup<C extends Closeable> {

    /**
     * Resolve a ready-to-use client for a data source.
     *
     * @param dataSourceId Data source to connect to
     * @param metadataReader Reader scoped to the caller, used to fetch the data source on their behalf
     * @param vault Vault used to decrypt the data source's credential
     * @param auditor Request-scoped auditor; receives one event on success
     * @return Future completing with the pooled client, or exceptionally with {@link DataSourceAccessException}
     */
    CompletableFuture<C> getDataSourceClient(
        String dataSourceId,
        MetadataReader metadataReader,
        CredentialVault vault,
        Auditor auditor
    );
}
