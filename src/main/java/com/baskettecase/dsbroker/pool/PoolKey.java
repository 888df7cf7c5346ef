package com.baskettecase.dsbroker.pool;

/**
 * Cache key: a data source id plus the fingerprint of the parameters its client was built with.
 */
public record PoolKey(String dataSourceId, String fingerprint) {

    @Override
    public String toString() {
        return dataSourceId + "@" + fingerprint;
    }
}
