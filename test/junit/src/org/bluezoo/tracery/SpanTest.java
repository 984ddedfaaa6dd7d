/*
 * SpanTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of tracery, a causally-correct telemetry pipeline.
 *
 * tracery is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * tracery is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with tracery.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.tracery;

import org.bluezoo.tracery.export.RecordingSpanExporter;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.List;

/**
 * Unit tests for {@link Span}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SpanTest {

    private RecordingSpanExporter sink;
    private Telemetry telemetry;
    private Tracer tracer;

    @Before
    public void setUp() {
        TelemetryConfig config = new TelemetryConfig();
        config.setServiceName("span-test");
        config.setMetricsEnabled(false);
        config.setFlushIntervalMs(60000);
        sink = new RecordingSpanExporter();
        telemetry = new Telemetry(config, sink);
        tracer = telemetry.getTracer("test");
    }

    @After
    public void tearDown() {
        telemetry.shutdown();
    }

    // ========================================================================
    // Attribute Tests
    // ========================================================================

    @Test
    public void testAttributes() {
        Span span = tracer.startSpan("op", Attribute.string("initial", "yes"));
        span.setAttribute("http.method", "GET")
            .setAttribute("http.status_code", 200L)
            .setAttribute("ratio", 0.5)
            .setAttribute("cached", true);
        span.end();

        SpanData data = span.getData();
        assertEquals(5, data.getAttributes().size());
        assertEquals("yes", data.getAttribute("initial").getStringValue());
        assertEquals(200L, data.getAttribute("http.status_code").getIntValue());
        assertEquals(Boolean.TRUE, data.getAttribute("cached").getValue());
    }

    @Test
    public void testAttributeReplaced() {
        Span span = tracer.startSpan("op");
        span.setAttribute("key", "first");
        span.setAttribute("key", "second");
        span.end();

        List<Attribute> attrs = span.getData().getAttributes();
        assertEquals(1, attrs.size());
        assertEquals("second", attrs.get(0).getStringValue());
    }

    // ========================================================================
    // End Tests
    // ========================================================================

    @Test
    public void testEndDefaultsToOk() {
        Span span = tracer.startSpan("op");
        assertFalse(span.isEnded());
        assertNull(span.getData());

        span.end();

        assertTrue(span.isEnded());
        assertTrue(span.getData().getStatus().isOk());
        assertEquals(SpanKind.INTERNAL, span.getData().getKind());
    }

    @Test
    public void testEndTimeNotBeforeStartTime() {
        for (int i = 0; i < 100; i++) {
            Span span = tracer.startSpan("op" + i);
            span.end();
            SpanData data = span.getData();
            assertTrue(data.getEndTimeUnixNano() >= data.getStartTimeUnixNano());
            assertTrue(data.getDurationNanos() >= 0L);
        }
    }

    @Test
    public void testEndWithExplicitStatus() {
        Span span = tracer.startSpan("op");
        span.end(SpanStatus.error("upstream timeout"));

        SpanStatus status = span.getData().getStatus();
        assertTrue(status.isError());
        assertEquals("upstream timeout", status.getMessage());
    }

    @Test
    public void testDoubleEndExportsOnce() throws Exception {
        Span span = tracer.startSpan("op");
        span.end();
        span.end();

        assertTrue(telemetry.flush());
        assertEquals(1, sink.getSpans().size());
        assertEquals(1L, telemetry.getDiagnostics().getUsageErrors());
    }

    // ========================================================================
    // Error Tests
    // ========================================================================

    @Test
    public void testRecordErrorSetsErrorStatus() {
        Span span = tracer.startSpan("op");
        span.recordError(new IllegalStateException("broken"));
        span.end();

        SpanData data = span.getData();
        assertTrue(data.getStatus().isError());
        assertEquals("broken", data.getStatus().getMessage());
        assertEquals(1, data.getEvents().size());
        SpanEvent event = data.getEvents().get(0);
        assertEquals("exception", event.getName());
        assertEquals("java.lang.IllegalStateException", event.getAttributes().get(0).getStringValue());
    }

    @Test
    public void testExplicitOkOverridesRecordedError() {
        Span span = tracer.startSpan("op");
        span.recordError(new RuntimeException("retried"));
        span.setStatus(SpanStatus.OK);
        span.end();

        assertTrue(span.getData().getStatus().isOk());
    }

    @Test
    public void testMutationAfterEndRejected() {
        Span span = tracer.startSpan("op");
        span.setAttribute("before", true);
        span.end();

        span.setAttribute("after", true);
        span.addEvent("late");
        span.recordError(new RuntimeException("late"));
        span.setStatus(SpanStatus.error("late"));

        SpanData data = span.getData();
        assertEquals(1, data.getAttributes().size());
        assertTrue(data.getEvents().isEmpty());
        assertTrue(data.getStatus().isOk());
        assertEquals(4L, telemetry.getDiagnostics().getUsageErrors());
        assertEquals(1, span.getAttributes().size());
    }

    @Test
    public void testEvents() {
        Span span = tracer.startSpan("op");
        span.addEvent("cache.miss", Attribute.string("key", "item:7"));
        span.end();

        SpanEvent event = span.getData().getEvents().get(0);
        assertEquals("cache.miss", event.getName());
        assertEquals("item:7", event.getAttributes().get(0).getStringValue());
        assertTrue(event.getTimeUnixNano() >= span.getStartTimeUnixNano());
    }

    // ========================================================================
    // Cancel Tests
    // ========================================================================

    @Test
    public void testCancel() {
        Span span = tracer.startSpan("op");
        span.cancel();

        SpanData data = span.getData();
        assertTrue(data.getStatus().isError());
        assertEquals("cancelled", data.getStatus().getMessage());
        assertEquals(Boolean.TRUE, data.getAttribute("cancelled").getValue());
        assertNull(tracer.currentSpan());
    }

}
