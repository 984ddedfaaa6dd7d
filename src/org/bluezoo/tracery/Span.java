/*
 * Span.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single timed operation within a trace.
 *
 * <p>An open span belongs to the code path that started it. That code
 * path must end it on every exit path, normally with try/finally or one
 * of the {@link Tracer#inSpan(String, Runnable) inSpan} helpers. Ending
 * the span freezes it into a {@link SpanData} that is handed to the
 * exporter; any later mutation is rejected and reported as a usage error.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Span {

    static final String CANCELLED = "cancelled";

    private final Tracer tracer;
    private final SpanContext spanContext;
    private final String name;
    private final SpanKind kind;
    private final long startTimeUnixNano;
    private final long startNanoTime;

    private final Map<String, Attribute> attributes;
    private final List<SpanEvent> events;
    private SpanStatus status;
    private SpanStatus recordedError;
    private boolean ended;
    private SpanData data;

    // Binding pushed by Tracer.startSpan, restored on end
    private Scope scope;

    Span(Tracer tracer, SpanContext spanContext, String name, SpanKind kind, Attribute[] initialAttributes) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.tracer = tracer;
        this.spanContext = spanContext;
        this.name = name;
        this.kind = kind != null ? kind : SpanKind.INTERNAL;
        this.startTimeUnixNano = System.currentTimeMillis() * 1_000_000L;
        this.startNanoTime = System.nanoTime();
        this.attributes = new LinkedHashMap<String, Attribute>();
        this.events = new ArrayList<SpanEvent>();
        this.status = SpanStatus.UNSET;
        if (initialAttributes != null) {
            for (Attribute attribute : initialAttributes) {
                if (attribute != null) {
                    attributes.put(attribute.getKey(), attribute);
                }
            }
        }
    }

    void setScope(Scope scope) {
        this.scope = scope;
    }

    public SpanContext getSpanContext() {
        return spanContext;
    }

    public String getName() {
        return name;
    }

    public SpanKind getKind() {
        return kind;
    }

    /**
     * Returns the start time in nanoseconds since Unix epoch.
     */
    public long getStartTimeUnixNano() {
        return startTimeUnixNano;
    }

    public synchronized boolean isEnded() {
        return ended;
    }

    /**
     * Returns the finished span, or null while the span is open.
     */
    public synchronized SpanData getData() {
        return data;
    }

    // -- Mutators --

    /**
     * Sets an attribute, replacing any previous value for the key.
     *
     * @param attribute the attribute
     * @return this span for chaining
     */
    public Span setAttribute(Attribute attribute) {
        if (attribute == null) {
            return this;
        }
        synchronized (this) {
            if (!ended) {
                attributes.put(attribute.getKey(), attribute);
                return this;
            }
        }
        rejected("setAttribute(" + attribute.getKey() + ")");
        return this;
    }

    public Span setAttribute(String key, String value) {
        return setAttribute(Attribute.string(key, value));
    }

    public Span setAttribute(String key, long value) {
        return setAttribute(Attribute.integer(key, value));
    }

    public Span setAttribute(String key, double value) {
        return setAttribute(Attribute.doubleValue(key, value));
    }

    public Span setAttribute(String key, boolean value) {
        return setAttribute(Attribute.bool(key, value));
    }

    /**
     * Adds a named event with optional attributes.
     *
     * @param eventName the event name
     * @param eventAttributes the event attributes
     * @return this span for chaining
     */
    public Span addEvent(String eventName, Attribute... eventAttributes) {
        List<Attribute> list = eventAttributes != null ? Arrays.asList(eventAttributes) : null;
        SpanEvent event = new SpanEvent(eventName, System.currentTimeMillis() * 1_000_000L, list);
        synchronized (this) {
            if (!ended) {
                events.add(event);
                return this;
            }
        }
        rejected("addEvent(" + eventName + ")");
        return this;
    }

    /**
     * Records an exception on this span.
     * Adds an "exception" event and makes ERROR the status this span
     * ends with unless one is given explicitly to {@link #end(SpanStatus)}.
     *
     * @param exception the exception
     * @return this span for chaining
     */
    public Span recordError(Throwable exception) {
        if (exception == null) {
            return this;
        }
        SpanEvent event = SpanEvent.exception(exception, System.currentTimeMillis() * 1_000_000L);
        synchronized (this) {
            if (!ended) {
                events.add(event);
                recordedError = SpanStatus.error(exception.getMessage() != null
                        ? exception.getMessage() : exception.getClass().getName());
                return this;
            }
        }
        rejected("recordError");
        return this;
    }

    /**
     * Sets the status this span will end with.
     *
     * @param status the status
     * @return this span for chaining
     */
    public Span setStatus(SpanStatus status) {
        if (status == null) {
            return this;
        }
        synchronized (this) {
            if (!ended) {
                this.status = status;
                return this;
            }
        }
        rejected("setStatus");
        return this;
    }

    private void rejected(String operation) {
        tracer.getDiagnostics().usageError("usage.mutate_ended", operation, this);
    }

    /**
     * Ends this span. The status is the one set explicitly, else ERROR if
     * an error was recorded, else OK.
     */
    public void end() {
        end(null);
    }

    /**
     * Ends this span with an explicit status.
     * Ending a span twice is reported as a usage error and has no other
     * effect: the span is exported once.
     *
     * @param endStatus the final status, or null to derive it
     */
    public void end(SpanStatus endStatus) {
        SpanData finished;
        synchronized (this) {
            if (ended) {
                finished = null;
            } else {
                ended = true;
                long elapsed = Math.max(0L, System.nanoTime() - startNanoTime);
                long endTimeUnixNano = startTimeUnixNano + elapsed;
                SpanStatus finalStatus = resolveStatus(endStatus);
                this.status = finalStatus;
                this.data = new SpanData(tracer.getName(), spanContext, name, kind,
                        startTimeUnixNano, endTimeUnixNano,
                        new ArrayList<Attribute>(attributes.values()),
                        new ArrayList<SpanEvent>(events), finalStatus);
                finished = data;
            }
        }
        if (finished == null) {
            tracer.getDiagnostics().usageError("usage.double_end", this);
            return;
        }
        if (scope != null) {
            scope.release();
        }
        tracer.spanEnded(finished);
    }

    private SpanStatus resolveStatus(SpanStatus endStatus) {
        if (endStatus != null && endStatus.getCode() != SpanStatus.Code.UNSET) {
            return endStatus;
        }
        if (status.getCode() != SpanStatus.Code.UNSET) {
            return status;
        }
        return recordedError != null ? recordedError : SpanStatus.OK;
    }

    /**
     * Ends this span because the work it measures was cancelled.
     * The span is closed with status ERROR and the attribute
     * {@code cancelled=true}.
     */
    public void cancel() {
        synchronized (this) {
            if (!ended) {
                attributes.put(CANCELLED, Attribute.bool(CANCELLED, true));
            }
        }
        end(SpanStatus.error(CANCELLED));
    }

    /**
     * Returns an unmodifiable snapshot of the current attributes.
     */
    public synchronized List<Attribute> getAttributes() {
        return Collections.unmodifiableList(new ArrayList<Attribute>(attributes.values()));
    }

    @Override
    public String toString() {
        return "Span[" + name + ", " + spanContext.getSpanIdHex() + "]";
    }

}
