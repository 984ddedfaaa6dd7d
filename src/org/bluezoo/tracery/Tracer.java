/*
 * Tracer.java
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

import org.bluezoo.tracery.export.BatchSpanExporter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Creates spans for one logical component.
 * Obtain tracers from {@link Telemetry#getTracer(String)}; every tracer of
 * a {@code Telemetry} shares its resource, propagator and exporter.
 *
 * <p>Parenting is decided by the context current when a span starts. A
 * call made outside the intended scope produces a mis-parented or root
 * span; the tracer does not try to repair this. The one check it makes
 * is that a local parent span ID was actually issued by this telemetry
 * instance.
 *
 * <pre>
 * Span span = tracer.startSpan("db.query");
 * try {
 *     ...
 * } catch (SQLException e) {
 *     span.recordError(e);
 *     throw e;
 * } finally {
 *     span.end();
 * }
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Tracer {

    private final String name;
    private final ContextPropagator propagator;
    private final BatchSpanExporter exporter;
    private final TelemetryDiagnostics diagnostics;
    private final IssuedSpanIds issuedSpanIds;
    private final boolean sampleNewTraces;

    Tracer(String name, ContextPropagator propagator, BatchSpanExporter exporter,
           TelemetryDiagnostics diagnostics, IssuedSpanIds issuedSpanIds, boolean sampleNewTraces) {
        this.name = name;
        this.propagator = propagator;
        this.exporter = exporter;
        this.diagnostics = diagnostics;
        this.issuedSpanIds = issuedSpanIds;
        this.sampleNewTraces = sampleNewTraces;
    }

    /**
     * Returns the component name this tracer was obtained for.
     */
    public String getName() {
        return name;
    }

    TelemetryDiagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * Starts a span as a child of the current span, or as the root of a
     * new trace if there is none, and makes it current until it ends.
     *
     * @param spanName the span name
     * @param attributes initial attributes
     * @return the open span
     */
    public Span startSpan(String spanName, Attribute... attributes) {
        return start(spanName, SpanKind.INTERNAL, attributes);
    }

    /**
     * Starts a span of the given kind under the current span and makes
     * it current until it ends.
     *
     * @param spanName the span name
     * @param kind the span kind
     * @return the open span
     */
    public Span startSpan(String spanName, SpanKind kind) {
        return start(spanName, kind, null);
    }

    private Span start(String spanName, SpanKind kind, Attribute[] attributes) {
        Span span = createSpan(propagator.current(), spanName, kind, attributes);
        span.setScope(propagator.attach(Context.of(span)));
        return span;
    }

    /**
     * Starts a span under an explicit parent without changing the
     * current context. This is the form to use for work that suspends
     * or continues on another task.
     *
     * @param parent the parent context; the empty context starts a new trace
     * @param spanName the span name
     * @param attributes initial attributes
     * @return the open span
     */
    public Span startSpan(Context parent, String spanName, Attribute... attributes) {
        return createSpan(parent != null ? parent : Context.root(), spanName, SpanKind.INTERNAL, attributes);
    }

    /**
     * Starts a span of the given kind under an explicit parent without
     * changing the current context.
     */
    public Span startSpan(Context parent, String spanName, SpanKind kind) {
        return createSpan(parent != null ? parent : Context.root(), spanName, kind, null);
    }

    private Span createSpan(Context parent, String spanName, SpanKind kind, Attribute[] attributes) {
        SpanContext parentContext = parent.getSpanContext();
        SpanContext spanContext;
        if (parentContext == null) {
            spanContext = SpanContext.newRoot(sampleNewTraces);
        } else {
            if (!parentContext.isRemote() && !issuedSpanIds.contains(parentContext)) {
                diagnostics.usageError("usage.unknown_parent", parentContext.getSpanIdHex(), name);
            }
            spanContext = parentContext.newChild();
        }
        issuedSpanIds.add(spanContext);
        return new Span(this, spanContext, spanName, kind, attributes);
    }

    /**
     * Returns the current local span, or null.
     */
    public Span currentSpan() {
        return propagator.current().getSpan();
    }

    /**
     * Runs a callable inside a new span. The span ends however the
     * callable exits: with ERROR status if it throws, cancelled if it is
     * interrupted or cancelled.
     *
     * @param spanName the span name
     * @param body the work
     * @return the result of the work
     * @throws Exception whatever the work throws
     */
    public <T> T inSpan(String spanName, Callable<T> body) throws Exception {
        Span span = startSpan(spanName);
        try {
            return body.call();
        } catch (InterruptedException | CancellationException e) {
            span.cancel();
            throw e;
        } catch (Exception | Error e) {
            span.recordError(e);
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
    }

    /**
     * Runs a runnable inside a new span.
     *
     * @param spanName the span name
     * @param body the work
     */
    public void inSpan(String spanName, Runnable body) {
        Span span = startSpan(spanName);
        try {
            body.run();
        } catch (CancellationException e) {
            span.cancel();
            throw e;
        } catch (RuntimeException | Error e) {
            span.recordError(e);
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
    }

    /**
     * Traces asynchronous work. The span starts under {@code parent}, the
     * body runs with the span's context current and receives that context
     * to hand on to its continuations, and the span ends when the
     * returned future completes. A cancelled future closes the span with
     * ERROR status and {@code cancelled=true}.
     *
     * @param parent the parent context
     * @param spanName the span name
     * @param body starts the work and returns its future
     * @return the future returned by the body
     */
    public <T> CompletableFuture<T> traceAsync(Context parent, String spanName,
                                               Function<Context, CompletableFuture<T>> body) {
        final Span span = startSpan(parent, spanName);
        final Context context = Context.of(span);
        CompletableFuture<T> future;
        try (Scope scope = propagator.attach(context)) {
            future = body.apply(context);
        } catch (RuntimeException | Error e) {
            span.recordError(e);
            span.end();
            throw e;
        }
        if (future == null) {
            span.end();
            return null;
        }
        future.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T result, Throwable failure) {
                finish(span, failure);
            }
        });
        return future;
    }

    private static void finish(Span span, Throwable failure) {
        if (failure == null) {
            span.end();
            return;
        }
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof CancellationException) {
            span.cancel();
        } else {
            span.recordError(cause);
            span.end();
        }
    }

    void spanEnded(SpanData data) {
        if (data.getSpanContext().isSampled()) {
            exporter.submit(data);
        }
    }

    @Override
    public String toString() {
        return "Tracer[" + name + "]";
    }

    /**
     * Bounded memory of span IDs issued by the tracers of one telemetry
     * instance, used to validate local parents. The oldest IDs are
     * forgotten first.
     */
    static final class IssuedSpanIds {

        private final Map<Long, Boolean> ids;

        IssuedSpanIds(final int capacity) {
            this.ids = new LinkedHashMap<Long, Boolean>(Math.min(capacity, 1024), 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                    return size() > capacity;
                }
            };
        }

        synchronized void add(SpanContext context) {
            ids.put(key(context), Boolean.TRUE);
        }

        synchronized boolean contains(SpanContext context) {
            return ids.containsKey(key(context));
        }

        private static Long key(SpanContext context) {
            byte[] id = context.getSpanId();
            long value = 0L;
            for (byte b : id) {
                value = (value << 8) | (b & 0xFF);
            }
            return Long.valueOf(value);
        }
    }

}
