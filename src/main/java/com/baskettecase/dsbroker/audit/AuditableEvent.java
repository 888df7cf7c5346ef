package com.baskettecase.dsbroker.audit;

/**
 * What a component asks the auditor to record; the auditor adds time and requester.
 *
 * @param type Event type, e.g. {@code opensearch.dataSourceClient.call.internalUser}
 * @param dataSourceId The data source accessed
 */
public record AuditableEvent(String type, String dataSourceId) {}
