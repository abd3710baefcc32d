package com.kgraph.resolution.tracing;

/**
 * A unit of work in a trace. Ends when closed, so it can be used in try-with-resources.
 *
 * <pre>
 * try (TraceSpan span = tracingService.startSpan("ingest")) {
 *     span.setAttribute("documentId", documentId);
 *     ...
 *     span.setStatus(TraceSpan.Status.OK);
 * }
 * </pre>
 */
public interface TraceSpan extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(Status status);

    void recordException(Throwable t);

    @Override
    void close();

    enum Status { OK, ERROR }
}
