package com.kgraph.resolution.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (TraceSpan span = noOp.startSpan("ingest")) {
                    span.setAttribute("documentId", "doc-1");
                    span.setAttribute("mentions", 12L);
                    span.setStatus(TraceSpan.Status.OK);
                    span.recordException(new IllegalStateException("boom"));
                }
            });
        }

        @Test
        @DisplayName("Should hand out the same span instance")
        void sameSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("ingest"), noOp.startSpan("search"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OpenTelemetryTests {

        private Tracer tracer;
        private SpanBuilder spanBuilder;
        private Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            spanBuilder = mock(SpanBuilder.class);
            otelSpan = mock(Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should start a span with the operation name")
        void startsNamedSpan() {
            TraceSpan span = service.startSpan("extract.chunk");

            assertNotNull(span);
            verify(tracer).spanBuilder("extract.chunk");
            verify(spanBuilder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes, status and exceptions")
        void forwardsCalls() {
            TraceSpan span = service.startSpan("search");
            RuntimeException failure = new RuntimeException("store down");

            span.setAttribute("query", "apple");
            span.setAttribute("hits", 3L);
            span.setStatus(TraceSpan.Status.ERROR);
            span.recordException(failure);

            verify(otelSpan).setAttribute("query", "apple");
            verify(otelSpan).setAttribute("hits", 3L);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(failure);
        }

        @Test
        @DisplayName("Should end the span on close")
        void endsOnClose() {
            try (TraceSpan span = service.startSpan("ingest")) {
                span.setStatus(TraceSpan.Status.OK);
            }
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Should require a tracer")
        void requiresTracer() {
            assertThrows(NullPointerException.class, () -> new OpenTelemetryTracingService(null));
        }
    }
}
