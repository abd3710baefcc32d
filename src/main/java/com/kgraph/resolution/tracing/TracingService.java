package com.kgraph.resolution.tracing;

/**
 * Tracing integration point. The default {@link NoOpTracingService} records nothing,
 * so the pipeline runs without a tracer configured.
 */
public interface TracingService {

    TraceSpan startSpan(String operationName);
}
