package com.baskettecase.dsbroker.audit;

/**
 * Records credential-bearing accesses on behalf of one inbound request.
 */
public interface Auditor {

    /**
     * Append the event to the audit trail. Never throws; sink failures are logged.
     */
    void record(AuditableEvent event);
}
