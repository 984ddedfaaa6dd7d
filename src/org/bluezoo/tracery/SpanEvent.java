/*
 * SpanEvent.java
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
import java.util.Collections;
import java.util.List;

/**
 * A timestamped annotation recorded on an open span, such as an
 * exception. Immutable once created.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SpanEvent {

    private final String name;
    private final long timeUnixNano;
    private final List<Attribute> attributes;

    /**
     * Creates a span event.
     *
     * @param name the event name
     * @param timeUnixNano the timestamp in nanoseconds since Unix epoch
     * @param attributes the event attributes, may be null
     */
    public SpanEvent(String name, long timeUnixNano, List<Attribute> attributes) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
        this.timeUnixNano = timeUnixNano;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.<Attribute>emptyList()
                : Collections.unmodifiableList(new ArrayList<Attribute>(attributes));
    }

    /**
     * Creates the standard "exception" event for a throwable.
     *
     * @param exception the exception
     * @param timeUnixNano when it was recorded
     */
    static SpanEvent exception(Throwable exception, long timeUnixNano) {
        List<Attribute> attrs = new ArrayList<Attribute>(2);
        attrs.add(Attribute.string("exception.type", exception.getClass().getName()));
        if (exception.getMessage() != null) {
            attrs.add(Attribute.string("exception.message", exception.getMessage()));
        }
        return new SpanEvent("exception", timeUnixNano, attrs);
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the timestamp in nanoseconds since Unix epoch.
     */
    public long getTimeUnixNano() {
        return timeUnixNano;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "SpanEvent[" + name + " at " + timeUnixNano + ", " + attributes + "]";
    }

}
