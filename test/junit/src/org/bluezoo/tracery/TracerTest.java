/*
 * TracerTest.java
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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Unit tests for {@link Tracer} and {@link Telemetry}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TracerTest {

    private RecordingSpanExporter sink;
    private Telemetry telemetry;
    private Tracer tracer;

    @Before
    public void setUp() {
        TelemetryConfig config = new TelemetryConfig();
        config.setServiceName("tracer-test");
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
    // Tracer Registry Tests
    // ========================================================================

    @Test
    public void testSameTracerPerName() {
        assertSame(tracer, telemetry.getTracer("test"));
        assertNotSame(tracer, telemetry.getTracer("other"));
        assertEquals("test", tracer.getName());
    }

    // ========================================================================
    // Parenting Tests
    // ========================================================================

    @Test
    public void testRootSpanStartsNewTrace() {
        Span a = tracer.startSpan("a");
        a.end();
        Span b = tracer.startSpan("b");
        b.end();

        assertFalse(a.getSpanContext().hasParent());
        assertFalse(b.getSpanContext().hasParent());
        assertFalse(a.getSpanContext().sameTrace(b.getSpanContext()));
    }

    @Test
    public void testSpanEndedOnAnotherThreadUnbindsStartingThread() throws Exception {
        Span outer = tracer.startSpan("outer");
        final Span first = tracer.startSpan("request-1");
        ExecutorService callbacks = Executors.newSingleThreadExecutor();
        try {
            callbacks.submit(new Runnable() {
                @Override
                public void run() {
                    first.end();
                }
            }).get(5, TimeUnit.SECONDS);
        } finally {
            callbacks.shutdownNow();
        }
        assertSame(outer, tracer.currentSpan());
        outer.end();
        assertNull(tracer.currentSpan());

        Span second = tracer.startSpan("request-2");
        second.end();
        assertFalse(second.getSpanContext().hasParent());
        assertFalse(first.getSpanContext().sameTrace(second.getSpanContext()));
        assertEquals(0, telemetry.getDiagnostics().getUsageErrors());
    }

    @Test
    public void testNestedSpansParentedOnCurrent() {
        Span root = tracer.startSpan("root");
        assertSame(root, tracer.currentSpan());
        Span child = tracer.startSpan("child");
        assertSame(child, tracer.currentSpan());
        Span grandchild = tracer.startSpan("grandchild");
        grandchild.end();
        assertSame(child, tracer.currentSpan());
        Span sibling = tracer.startSpan("sibling");
        sibling.end();
        child.end();
        assertSame(root, tracer.currentSpan());
        root.end();
        assertNull(tracer.currentSpan());

        assertEquals(root.getSpanContext().getSpanIdHex(), child.getSpanContext().getParentSpanIdHex());
        assertEquals(child.getSpanContext().getSpanIdHex(), grandchild.getSpanContext().getParentSpanIdHex());
        assertEquals(child.getSpanContext().getSpanIdHex(), sibling.getSpanContext().getParentSpanIdHex());
        assertTrue(grandchild.getSpanContext().sameTrace(root.getSpanContext()));
    }

    @Test
    public void testRandomNestingParentIsCurrentSpan() {
        Random random = new Random(42L);
        List<Span> stack = new ArrayList<Span>();
        for (int i = 0; i < 500; i++) {
            if (stack.isEmpty() || random.nextInt(3) != 0) {
                Span expectedParent = stack.isEmpty() ? null : stack.get(stack.size() - 1);
                Span span = tracer.startSpan("span" + i);
                if (expectedParent == null) {
                    assertFalse(span.getSpanContext().hasParent());
                } else {
                    assertEquals(expectedParent.getSpanContext().getSpanIdHex(),
                            span.getSpanContext().getParentSpanIdHex());
                }
                stack.add(span);
            } else {
                stack.remove(stack.size() - 1).end();
            }
        }
        while (!stack.isEmpty()) {
            stack.remove(stack.size() - 1).end();
        }
        assertNull(tracer.currentSpan());
        assertEquals(0L, telemetry.getDiagnostics().getUsageErrors());
    }

    @Test
    public void testExplicitParentDoesNotBind() {
        Span root = tracer.startSpan("root");
        Context rootContext = telemetry.getPropagator().current();
        root.end();

        Span child = tracer.startSpan(rootContext, "continuation");
        assertNull(tracer.currentSpan());
        child.end();

        assertEquals(root.getSpanContext().getSpanIdHex(), child.getSpanContext().getParentSpanIdHex());
        assertEquals(0L, telemetry.getDiagnostics().getUsageErrors());
    }

    @Test
    public void testUnknownLocalParentIsUsageError() {
        Context foreign = Context.of(SpanContext.newRoot(true));

        Span span = tracer.startSpan(foreign, "orphan");
        span.end();

        assertEquals(1L, telemetry.getDiagnostics().getUsageErrors());
        assertTrue(span.getSpanContext().sameTrace(foreign.getSpanContext()));
    }

    @Test
    public void testRemoteParentFromTraceparent() {
        Context remote = telemetry.getPropagator().extract(
                "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01");

        Span span = tracer.startSpan(remote, "GET /items/{item_id}", SpanKind.SERVER);
        span.end();

        assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", span.getSpanContext().getTraceIdHex());
        assertEquals("00f067aa0ba902b7", span.getSpanContext().getParentSpanIdHex());
        assertEquals(SpanKind.SERVER, span.getData().getKind());
        assertEquals(0L, telemetry.getDiagnostics().getUsageErrors());
    }

    // ========================================================================
    // Scenario Tests
    // ========================================================================

    @Test
    public void testRequestScenarioTiming() throws Exception {
        Span request = tracer.startSpan("request");
        Span db = tracer.startSpan("db.query");
        Thread.sleep(400);
        db.end();
        Span cpu = tracer.startSpan("cpu.work");
        Thread.sleep(170);
        cpu.end();
        Thread.sleep(180);
        request.end();

        assertTrue(telemetry.flush());
        List<SpanData> spans = sink.getSpans();
        assertEquals(3, spans.size());

        SpanData requestData = sink.find("request");
        SpanData dbData = sink.find("db.query");
        SpanData cpuData = sink.find("cpu.work");
        for (SpanData span : spans) {
            assertEquals(requestData.getTraceIdHex(), span.getTraceIdHex());
        }
        assertNull(requestData.getParentSpanIdHex());
        assertEquals(requestData.getSpanIdHex(), dbData.getParentSpanIdHex());
        assertEquals(requestData.getSpanIdHex(), cpuData.getParentSpanIdHex());

        assertDuration(400, dbData);
        assertDuration(170, cpuData);
        assertDuration(750, requestData);
        assertEquals("tracer-test", sink.getResource().getServiceName());
    }

    private static void assertDuration(double expectedMs, SpanData span) {
        double actual = span.getDurationMillis();
        assertTrue(span.getName() + " took " + actual + "ms", actual >= expectedMs);
        assertTrue(span.getName() + " took " + actual + "ms", actual < expectedMs + 150.0);
    }

    // ========================================================================
    // Scoped Helper Tests
    // ========================================================================

    @Test
    public void testInSpanReturnsValue() throws Exception {
        String result = tracer.inSpan("compute", new Callable<String>() {
            @Override
            public String call() {
                assertEquals("compute", tracer.currentSpan().getName());
                return "done";
            }
        });

        assertEquals("done", result);
        assertNull(tracer.currentSpan());
        assertTrue(telemetry.flush());
        assertTrue(sink.find("compute").getStatus().isOk());
    }

    @Test
    public void testInSpanEndsOnException() {
        try {
            tracer.inSpan("failing", new Runnable() {
                @Override
                public void run() {
                    throw new IllegalStateException("boom");
                }
            });
            fail("exception expected");
        } catch (IllegalStateException e) {
            assertEquals("boom", e.getMessage());
        }

        assertNull(tracer.currentSpan());
        assertTrue(telemetry.flush());
        SpanData data = sink.find("failing");
        assertTrue(data.getStatus().isError());
        assertEquals("boom", data.getStatus().getMessage());
    }

    @Test
    public void testInSpanCancelledOnInterrupt() throws Exception {
        try {
            tracer.inSpan("sleeping", new Callable<Void>() {
                @Override
                public Void call() throws Exception {
                    throw new InterruptedException();
                }
            });
            fail("InterruptedException expected");
        } catch (InterruptedException e) {
            // expected
        }

        assertTrue(telemetry.flush());
        SpanData data = sink.find("sleeping");
        assertTrue(data.getStatus().isError());
        assertEquals(Boolean.TRUE, data.getAttribute("cancelled").getValue());
    }

    // ========================================================================
    // Async Tests
    // ========================================================================

    @Test
    public void testTraceAsyncEndsOnCompletion() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            final ContextPropagator propagator = telemetry.getPropagator();
            CompletableFuture<String> future = tracer.traceAsync(Context.root(), "load",
                    new Function<Context, CompletableFuture<String>>() {
                        @Override
                        public CompletableFuture<String> apply(final Context ctx) {
                            return propagator.supplyAsync(ctx, () -> {
                                Span inner = tracer.startSpan("inner");
                                inner.end();
                                return "rows";
                            }, pool);
                        }
                    });

            assertEquals("rows", future.get(5, TimeUnit.SECONDS));

            SpanData load = awaitExported("load");
            SpanData inner = awaitExported("inner");
            assertNotNull(load);
            assertEquals(load.getSpanIdHex(), inner.getParentSpanIdHex());
            assertTrue(load.getStatus().isOk());
        } finally {
            pool.shutdown();
        }
    }

    // The span ends in a completion callback that may run just after get() returns
    private SpanData awaitExported(String name) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        SpanData data = sink.find(name);
        while (data == null && System.currentTimeMillis() < deadline) {
            telemetry.flush();
            Thread.sleep(10L);
            data = sink.find(name);
        }
        return data;
    }

    @Test
    public void testTraceAsyncCancelled() throws Exception {
        final CompletableFuture<String> pending = new CompletableFuture<String>();
        CompletableFuture<String> future = tracer.traceAsync(Context.root(), "slow",
                new Function<Context, CompletableFuture<String>>() {
                    @Override
                    public CompletableFuture<String> apply(Context ctx) {
                        return pending;
                    }
                });

        future.cancel(true);

        assertTrue(telemetry.flush());
        SpanData data = sink.find("slow");
        assertNotNull(data);
        assertTrue(data.getStatus().isError());
        assertEquals(Boolean.TRUE, data.getAttribute("cancelled").getValue());
    }

    @Test
    public void testTraceAsyncFailed() throws Exception {
        CompletableFuture<String> future = tracer.traceAsync(Context.root(), "broken",
                new Function<Context, CompletableFuture<String>>() {
                    @Override
                    public CompletableFuture<String> apply(Context ctx) {
                        CompletableFuture<String> f = new CompletableFuture<String>();
                        f.completeExceptionally(new IllegalArgumentException("bad row"));
                        return f;
                    }
                });

        assertTrue(future.isCompletedExceptionally());
        assertTrue(telemetry.flush());
        SpanData data = sink.find("broken");
        assertEquals("bad row", data.getStatus().getMessage());
    }

    // ========================================================================
    // Sampling Tests
    // ========================================================================

    @Test
    public void testTracesDisabledExportsNothing() throws Exception {
        TelemetryConfig config = new TelemetryConfig();
        config.setTracesEnabled(false);
        config.setMetricsEnabled(false);
        RecordingSpanExporter quiet = new RecordingSpanExporter();
        Telemetry disabled = new Telemetry(config, quiet);
        try {
            Tracer t = disabled.getTracer("test");
            Span root = t.startSpan("root");
            Span child = t.startSpan("child");
            child.end();
            root.end();

            assertFalse(child.getSpanContext().isSampled());
            assertEquals(root.getSpanContext().getSpanIdHex(), child.getSpanContext().getParentSpanIdHex());
            assertTrue(disabled.flush());
            assertTrue(quiet.getSpans().isEmpty());
        } finally {
            disabled.shutdown();
        }
    }

}
