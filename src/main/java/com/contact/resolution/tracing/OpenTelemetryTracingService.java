package com.contact.resolution.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Spans are named {@code contact.resolve}, {@code contact.replicate} and so on.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_SCOPE = "com.contact.resolution";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer of whatever SDK registered itself with {@link GlobalOpenTelemetry};
     * spans are dropped if none did.
     */
    public static OpenTelemetryTracingService fromGlobal() {
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName) {
        return new OTelSpanAdapter(tracer.spanBuilder(operationName).startSpan());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            otelSpan.addEvent(name);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
