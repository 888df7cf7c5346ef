package com.baskettecase.dsbroker.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes audit events as JSON to a dedicated SLF4J logger, leaving durability to the logging backend.
 */
public class LoggerAuditSink implements AuditSink {

    private final Logger auditLog;
    private final ObjectMapper objectMapper;

    public LoggerAuditSink(String loggerName, ObjectMapper objectMapper) {
        this.auditLog = LoggerFactory.getLogger(loggerName);
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEvent event) throws IOException {
        auditLog.info(objectMapper.writeValueAsString(event));
    }

    @Override
    public String describe() {
        return "log:" + auditLog.getName();
    }

    @Override
    public void close() {
    }
}
