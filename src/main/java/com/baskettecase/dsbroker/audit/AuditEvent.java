package com.baskettecase.dsbroker.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * One line of the audit trail. Written once, never modified.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
    Instant timestamp,
    String requester,
    String id,
    String type,
    String message
) {}
