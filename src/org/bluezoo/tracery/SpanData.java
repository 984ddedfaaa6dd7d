/*
 * SpanData.java
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

import java.util.Collections;
import java.util.List;

/**
 * Immutable record of a finished span, as handed to the exporter.
 * Each one is self-describing: it carries its trace, span and parent
 * IDs, so a batch may mix spans of many traces in any order.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SpanData {

    private final String instrumentationScope;
    private final SpanContext spanContext;
    private final String name;
    private final SpanKind kind;
    private final long startTimeUnixNano;
    private final long endTimeUnixNano;
    private final List<Attribute> attributes;
    private final List<SpanEvent> events;
    private final SpanStatus status;

    SpanData(String instrumentationScope, SpanContext spanContext, String name, SpanKind kind,
             long startTimeUnixNano, long endTimeUnixNano,
             List<Attribute> attributes, List<SpanEvent> events, SpanStatus status) {
        this.instrumentationScope = instrumentationScope;
        this.spanContext = spanContext;
        this.name = name;
        this.kind = kind;
        this.startTimeUnixNano = startTimeUnixNano;
        this.endTimeUnixNano = endTimeUnixNano;
        this.attributes = Collections.unmodifiableList(attributes);
        this.events = Collections.unmodifiableList(events);
        this.status = status;
    }

    /**
     * Returns the name of the tracer that recorded this span.
     */
    public String getInstrumentationScope() {
        return instrumentationScope;
    }

    public SpanContext getSpanContext() {
        return spanContext;
    }

    public String getTraceIdHex() {
        return spanContext.getTraceIdHex();
    }

    public String getSpanIdHex() {
        return spanContext.getSpanIdHex();
    }

    /**
     * Returns the parent span ID as hex, or null for a root span.
     */
    public String getParentSpanIdHex() {
        return spanContext.getParentSpanIdHex();
    }

    public String getName() {
        return name;
    }

    public SpanKind getKind() {
        return kind;
    }

    public long getStartTimeUnixNano() {
        return startTimeUnixNano;
    }

    public long getEndTimeUnixNano() {
        return endTimeUnixNano;
    }

    public long getDurationNanos() {
        return endTimeUnixNano - startTimeUnixNano;
    }

    /**
     * Returns the duration in milliseconds. This is the one timing source
     * for anything derived from the span, such as latency histograms.
     */
    public double getDurationMillis() {
        return getDurationNanos() / 1_000_000.0;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * Returns the attribute with the given key, or null.
     */
    public Attribute getAttribute(String key) {
        for (Attribute attribute : attributes) {
            if (attribute.getKey().equals(key)) {
                return attribute;
            }
        }
        return null;
    }

    public List<SpanEvent> getEvents() {
        return events;
    }

    public SpanStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "SpanData[" + name + ", trace=" + getTraceIdHex() + ", span=" + getSpanIdHex() +
               ", parent=" + getParentSpanIdHex() + ", " + getDurationMillis() + "ms, " + status + "]";
    }

}
