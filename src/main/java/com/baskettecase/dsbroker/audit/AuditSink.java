package com.baskettecase.dsbroker.audit;

import java.io.Closeable;
import java.io.IOException;

/**
 * Append-only destination for audit events.
 */
public interface AuditSink extends Closeable {

    /**
     * Append one event synchronously.
     */
    void append(AuditEvent event) throws IOException;

    /**
     * Human-readable destination, for logging
     */
    String describe();
}
