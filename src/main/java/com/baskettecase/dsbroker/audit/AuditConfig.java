package com.baskettecase.dsbroker.audit;

import com.baskettecase.dsbroker.config.BrokerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Audit sink configuration.
 *
 * Destinations: {@code file:<path>}, {@code log:<logger name>}, or a bare path.
 * Unset falls back to the local append-only file.
 */
@Slf4j
@Configuration
public class AuditConfig {

    static final String DEFAULT_DESTINATION = "file:logs/data-source-audit.log";

    @Bean(destroyMethod = "close")
    public AuditSink auditSink(BrokerProperties properties, ObjectMapper objectMapper) {
        AuditSink sink = createSink(properties.getAudit().getDestination(), objectMapper);
        log.info("Audit sink: {}", sink.describe());
        return sink;
    }

    static AuditSink createSink(String destination, ObjectMapper objectMapper) {
        String descriptor = destination == null || destination.isBlank() ? DEFAULT_DESTINATION : destination.trim();

        if (descriptor.startsWith("log:")) {
            return new LoggerAuditSink(descriptor.substring("log:".length()), objectMapper);
        }
        if (descriptor.startsWith("file:")) {
            descriptor = descriptor.substring("file:".length());
        }
        return new FileAuditSink(Path.of(descriptor), objectMapper);
    }
}
