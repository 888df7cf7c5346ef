package com.baskettecase.dsbroker.broker;

import com.baskettecase.dsbroker.config.BrokerProperties;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.pool.ClientFactory;
import com.baskettecase.dsbroker.pool.ClientPool;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;

/**
 * Owns the client pool for the lifetime of the process.
 *
 * {@link #setup} creates the pool and returns the broker; {@link #stop} tears the pool down.
 */
@Slf4j
public class DataSourceService<C extends Closeable> {

    private final ClientFactory<C> clientFactory;
    private final CredentialVault vault;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private volatile ClientPool<C> clientPool;

    public DataSourceService(ClientFactory<C> clientFactory, CredentialVault vault,
                             ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.clientFactory = clientFactory;
        this.vault = vault;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    public synchronized DataSourceBroker<C> setup(BrokerProperties config) {
        if (clientPool != null) {
            throw new IllegalStateException("Data source service is already set up");
        }
        clientPool = new ClientPool<>("data-source-clients", clientFactory, config.getPool(), meterRegistry);
        log.info("Data source service set up");
        return new DataSourceBroker<>(clientPool, vault, objectMapper, config.getPool().getAcquireTimeout());
    }

    /**
     * Retire pooled clients of a data source after its credential changed or it was removed
     *
     * @return Number of clients retired
     */
    public int invalidate(String dataSourceId) {
        ClientPool<C> pool = clientPool;
        return pool == null ? 0 : pool.invalidate(dataSourceId);
    }

    public void stop() {
        ClientPool<C> pool = clientPool;
        if (pool != null) {
            pool.shutdown();
        }
    }
}
