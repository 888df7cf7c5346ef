package com.baskettecase.dsbroker.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ScopedAuditor
 */
@ExtendWith(MockitoExtension.class)
class ScopedAuditorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private AuditSink failingSink;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void testRecordsRequesterAndDataSource() {
        RecordingSink sink = new RecordingSink();
        ScopedAuditor auditor = new ScopedAuditor(() -> "10.0.0.7", sink, clock);

        auditor.record(new AuditableEvent("opensearch.dataSourceClient.call.internalUser", "ds-1"));

        assertEquals(1, sink.events.size());
        AuditEvent event = sink.events.get(0);
        assertEquals(NOW, event.timestamp());
        assertEquals("10.0.0.7", event.requester());
        assertEquals("ds-1", event.id());
        assertEquals("opensearch.dataSourceClient.call.internalUser", event.type());
        assertEquals("10.0.0.7 accessing ds-1", event.message());
    }

    @Test
    void testOneEventPerRecordCall() {
        RecordingSink sink = new RecordingSink();
        ScopedAuditor auditor = new ScopedAuditor(() -> "alice", sink, clock);

        auditor.record(new AuditableEvent("opensearch.dataSourceClient.call.internalUser", "ds-1"));
        auditor.record(new AuditableEvent("opensearch.dataSourceClient.call.internalUser", "ds-2"));

        assertEquals(2, sink.events.size());
        assertEquals("alice accessing ds-2", sink.events.get(1).message());
    }

    @Test
    void testSinkFailureDoesNotPropagate() throws IOException {
        when(failingSink.describe()).thenReturn("file:/readonly/audit.log");
        doThrow(new IOException("disk full")).when(failingSink).append(any(AuditEvent.class));
        ScopedAuditor auditor = new ScopedAuditor(() -> "alice", failingSink, clock);

        assertDoesNotThrow(() ->
            auditor.record(new AuditableEvent("opensearch.dataSourceClient.call.internalUser", "ds-1")));
    }

    static class RecordingSink implements AuditSink {
        final List<AuditEvent> events = new ArrayList<>();

        @Override
        public void append(AuditEvent event) {
            events.add(event);
        }

        @Override
        public String describe() {
            return "memory";
        }

        @Override
        public void close() {
        }
    }
}
