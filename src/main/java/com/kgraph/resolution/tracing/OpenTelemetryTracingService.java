package com.kgraph.resolution.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Spans opened here are named {@code ingest}, {@code extract.chunk} and {@code search}.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public TraceSpan startSpan(String operationName) {
        return new OTelSpan(tracer.spanBuilder(operationName).startSpan());
    }

    private static class OTelSpan implements TraceSpan {

        private final Span span;

        OTelSpan(Span span) {
            this.span = span;
        }

        @Override
        public void setAttribute(String key, String value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            span.setAttribute(key, value);
        }

        @Override
        public void setStatus(Status status) {
            span.setStatus(status == Status.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            span.recordException(t);
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
