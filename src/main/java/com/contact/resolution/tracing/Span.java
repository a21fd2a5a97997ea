package com.contact.resolution.tracing;

/**
 * A unit of work in a distributed trace. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("contact.resolve")) {
 *     span.setAttribute("lookup.type", "phone");
 *     span.addEvent("tier.fallthrough");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Records a point-in-time event, e.g. a tier that was skipped.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
