package com.baskettecase.dsbroker.pool;

import lombok.Getter;

/**
 * A pooled client could not be built, or the wait for one was abandoned.
 */
@Getter
public class PoolConstructionException extends RuntimeException {

    private final String dataSourceId;

    public PoolConstructionException(String dataSourceId, String message) {
        super(message);
        this.dataSourceId = dataSourceId;
    }

    public PoolConstructionException(String dataSourceId, Throwable cause) {
        super("Failed to construct client for data source " + dataSourceId + ": " + cause.getMessage(), cause);
        this.dataSourceId = dataSourceId;
    }
}
