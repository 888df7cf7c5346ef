package com.baskettecase.dsbroker.broker;

import com.baskettecase.dsbroker.config.BrokerProperties;
import com.baskettecase.dsbroker.crypto.CredentialVault;
import com.baskettecase.dsbroker.pool.RestClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.elasticsearch.client.RestClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the broker: one client pool and one vault per process, owned by the Spring context.
 */
@Configuration
public class BrokerConfig {

    @Bean
    public RestClientFactory restClientFactory(BrokerProperties properties, ObjectMapper objectMapper) {
        return new RestClientFactory(properties.getClient(), objectMapper);
    }

    @Bean(destroyMethod = "stop")
    public DataSourceService<RestClient> dataSourceService(
            RestClientFactory restClientFactory,
            CredentialVault vault,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        return new DataSourceService<>(restClientFactory, vault, objectMapper, meterRegistry);
    }

    @Bean
    public DataSourceBroker<RestClient> dataSourceBroker(
            DataSourceService<RestClient> dataSourceService,
            BrokerProperties properties) {
        return dataSourceService.setup(properties);
    }
}
