package com.baskettecase.dsbroker.api;

import com.baskettecase.dsbroker.audit.Auditor;
import com.baskettecase.dsbroker.broker.DataSourceAccessException;
import com.baskettecase.dsbroker.broker.DataSourceBroker;
import com.baskettecase.dsbroker.crypto.VaultException;
import com.baskettecase.dsbroker.metadata.MetadataReader;
import com.baskettecase.dsbroker.metadata.NotFoundException;
import org.elasticsearch.client.RestClient;
import org.springframework.http.HttpStatus;

/**
 * Data source access bound to one inbound request and its auditor.
 */
public class DataSourceRouteContext {

    private final DataSourceBroker<RestClient> broker;
    private final MetadataReader metadataReader;
    private final Auditor auditor;

    DataSourceRouteContext(DataSourceBroker<RestClient> broker, MetadataReader metadataReader, Auditor auditor) {
        this.broker = broker;
        this.metadataReader = metadataReader;
        this.auditor = auditor;
    }

    /**
     * @throws DataSourceClientException with the failing data source id in its message
     */
    public RestClient getClient(String dataSourceId) {
        try {
            return broker.getClient(dataSourceId, metadataReader, auditor);
        } catch (DataSourceAccessException e) {
            Throwable cause = e.getCause();
            HttpStatus status;
            if (cause instanceof NotFoundException) {
                status = HttpStatus.NOT_FOUND;
            } else if (cause instanceof VaultException) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            } else {
                status = HttpStatus.BAD_GATEWAY;
            }
            String detail = cause != null ? cause.getMessage() : e.getMessage();
            throw new DataSourceClientException(dataSourceId, status,
                "Data Source Error: " + dataSourceId + ": " + detail, e);
        }
    }
}
