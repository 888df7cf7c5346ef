package com.baskettecase.dsbroker.broker;

import lombok.Getter;

/**
 * Any failure while resolving a client, tagged with the data source it concerns.
 * The underlying error is the cause.
 */
@Getter
public class DataSourceAccessException extends RuntimeException {

    private final String dataSourceId;

    public DataSourceAccessException(String dataSourceId, Throwable cause) {
        super("Failed to get client for data source " + dataSourceId + ": " + cause.getMessage(), cause);
        this.dataSourceId = dataSourceId;
    }
}
