package com.baskettecase.dsbroker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Data Source Broker Application
 *
 * Stores data-source credentials encrypted at rest and hands out pooled, authenticated
 * cluster clients to request handlers, recording who accessed which data source.
 */
@Slf4j
@SpringBootApplication
public class DataSourceBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataSourceBrokerApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Data Source Broker is ready!");
        log.info("🔐 Credentials are encrypted at rest under the configured wrapping key");
        log.info("📡 Data source API at: /api/v1/data-sources");
        log.info("📊 Metrics available at: /actuator/prometheus");
        log.info("🏥 Health check at: /actuator/health");
    }
}
