package com.baskettecase.dsbroker.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Broker configuration
 *
 * Bound from the {@code dsbroker.*} namespace in application.yml.
 * The wrapping key material is normally supplied via the DSBROKER_WRAPPING_KEY environment variable.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "dsbroker")
public class BrokerProperties {

    private WrappingKey wrappingKey = new WrappingKey();
    private Audit audit = new Audit();
    private Pool pool = new Pool();
    private Client client = new Client();

    @Data
    public static class WrappingKey {
        private String name = "default";
        private String namespace = "default";

        // Base64-encoded 32-byte AES key
        @ToString.Exclude
        private String material;
    }

    @Data
    public static class Audit {
        // file:<path>, log:<logger> or a bare file path
        private String destination = "file:logs/data-source-audit.log";
    }

    @Data
    public static class Pool {
        private int maxSize = 100;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration retireGracePeriod = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Client {
        private int connectTimeoutMs = 5000;
        private int socketTimeoutMs = 60000;
    }
}
