package com.contact.resolution.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("contact.resolve", Map.of("lookup.type", "phone"))) {
                    span.setAttribute("resolution.source", "edge");
                    span.setAttribute("resolution.version", 2L);
                    span.addEvent("tier.unavailable.distributed");
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should hand out one shared span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("contact.replicate"), noOp.startSpan("contact.drift"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should start a span with the operation name and initial attributes")
        void createSpanWithAttributes() {
            Span span = service.startSpan("contact.resolve", Map.of("lookup.type", "email"));

            assertNotNull(span);
            verify(tracer).spanBuilder("contact.resolve");
            verify(builder).setAttribute("lookup.type", "email");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Should forward attributes, events and exceptions")
        void forwardsToOtel() {
            RuntimeException failure = new RuntimeException("sor timeout");

            Span span = service.startSpan("contact.resolve");
            span.setAttribute("resolution.source", "system-of-record");
            span.setAttribute("resolution.version", 4L);
            span.addEvent("sor.lookup");
            span.recordException(failure);

            verify(otelSpan).setAttribute("resolution.source", "system-of-record");
            verify(otelSpan).setAttribute("resolution.version", 4L);
            verify(otelSpan).addEvent("sor.lookup");
            verify(otelSpan).recordException(failure);
        }

        @Test
        @DisplayName("Should map span status onto OpenTelemetry status codes")
        void mapsStatus() {
            Span span = service.startSpan("contact.replicate");
            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Global tracer without an SDK yields working no-op spans")
        void fromGlobalWithoutSdk() {
            assertDoesNotThrow(() -> {
                try (Span span = OpenTelemetryTracingService.fromGlobal().startSpan("contact.resolve")) {
                    span.setAttribute("lookup.type", "phone");
                    span.setStatus(Span.SpanStatus.OK);
                }
            });
        }

        @Test
        @DisplayName("Should end the span on close")
        void endSpanOnClose() {
            service.startSpan("contact.drift").close();

            verify(otelSpan).end();
        }
    }
}
