/*
 * Context.java
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

/**
 * An immutable value identifying the active span of a logical task.
 * Contexts are passed explicitly across every hand-off between tasks;
 * the {@link ContextPropagator} only binds one to the thread that is
 * currently executing a task.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Context {

    private static final Context ROOT = new Context(null, null);

    private final SpanContext spanContext;
    private final Span span;

    private Context(SpanContext spanContext, Span span) {
        this.spanContext = spanContext;
        this.span = span;
    }

    /**
     * Returns the empty context: no active span.
     */
    public static Context root() {
        return ROOT;
    }

    /**
     * Returns a context whose active span is identified only by its
     * span context, such as one extracted from a header or carried by a
     * {@link DetachedHandle}.
     */
    public static Context of(SpanContext spanContext) {
        return spanContext != null ? new Context(spanContext, null) : ROOT;
    }

    /**
     * Returns a context whose active span is the given local span.
     */
    static Context of(Span span) {
        return new Context(span.getSpanContext(), span);
    }

    /**
     * Returns the span context of the active span, or null.
     */
    public SpanContext getSpanContext() {
        return spanContext;
    }

    /**
     * Returns the active span if it was started in this process and is
     * reachable from this context, otherwise null.
     */
    public Span getSpan() {
        return span;
    }

    public boolean isEmpty() {
        return spanContext == null;
    }

    @Override
    public String toString() {
        return isEmpty() ? "Context[root]" : "Context[" + spanContext.getTraceIdHex() + "/" + spanContext.getSpanIdHex() + "]";
    }

}
