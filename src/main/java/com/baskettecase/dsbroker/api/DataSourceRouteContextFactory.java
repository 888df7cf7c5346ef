package com.baskettecase.dsbroker.api;

import com.baskettecase.dsbroker.audit.AuditSink;
import com.baskettecase.dsbroker.audit.ScopedAuditor;
import com.baskettecase.dsbroker.broker.DataSourceBroker;
import com.baskettecase.dsbroker.metadata.MetadataStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.elasticsearch.client.RestClient;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link DataSourceRouteContext} per inbound request.
 */
@Component
@RequiredArgsConstructor
public class DataSourceRouteContextFactory {

    private final DataSourceBroker<RestClient> broker;
    private final MetadataStore metadataStore;
    private final AuditSink auditSink;

    public DataSourceRouteContext forRequest(HttpServletRequest request) {
        ScopedAuditor auditor = new ScopedAuditor(new HttpRequestContext(request), auditSink);
        return new DataSourceRouteContext(broker, metadataStore, auditor);
    }
}
