package com.baskettecase.dsbroker.audit;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;

/**
 * Auditor bound to a single request.
 *
 * Writes {@code "<requester> accessing <data source id>"} with the event type to the sink.
 * A failing sink is reported on the application log and does not fail the caller.
 */
@Slf4j
public class ScopedAuditor implements Auditor {

    private final RequestContext request;
    private final AuditSink sink;
    private final Clock clock;

    public ScopedAuditor(RequestContext request, AuditSink sink) {
        this(request, sink, Clock.systemUTC());
    }

    public ScopedAuditor(RequestContext request, AuditSink sink, Clock clock) {
        this.request = request;
        this.sink = sink;
        this.clock = clock;
    }

    @Override
    public void record(AuditableEvent event) {
        String requester = request.forwardedIdentity();
        AuditEvent auditEvent = AuditEvent.builder()
            .timestamp(clock.instant())
            .requester(requester)
            .id(event.dataSourceId())
            .type(event.type())
            .message(requester + " accessing " + event.dataSourceId())
            .build();

        try {
            sink.append(auditEvent);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write audit event {} for data source {} to {}",
                event.type(), event.dataSourceId(), sink.describe(), e);
        }
    }
}
