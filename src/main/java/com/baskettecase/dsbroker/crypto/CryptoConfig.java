package com.baskettecase.dsbroker.crypto;

import com.baskettecase.dsbroker.config.BrokerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the wrapping key once at startup.
 */
@Configuration
public class CryptoConfig {

    @Bean
    public WrappingKeyStore wrappingKeyStore(BrokerProperties properties) {
        BrokerProperties.WrappingKey key = properties.getWrappingKey();
        return WrappingKeyStore.fromBase64(key.getName(), key.getNamespace(), key.getMaterial());
    }
}
