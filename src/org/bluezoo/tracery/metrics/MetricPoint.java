/*
 * MetricPoint.java
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

package org.bluezoo.tracery.metrics;

/**
 * A single raw observation, waiting in the observation buffer for the
 * next aggregation pass.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MetricPoint {

    private final String instrumentName;
    private final double value;
    private final long longValue;
    private final Attributes attributes;
    private final long timeUnixNano;

    public MetricPoint(String instrumentName, double value, Attributes attributes, long timeUnixNano) {
        this(instrumentName, value, (long) value, attributes, timeUnixNano);
    }

    /**
     * Creates an integral observation, such as a counter delta. The exact
     * value is kept alongside its double approximation.
     */
    public MetricPoint(String instrumentName, long value, Attributes attributes, long timeUnixNano) {
        this(instrumentName, (double) value, value, attributes, timeUnixNano);
    }

    private MetricPoint(String instrumentName, double value, long longValue, Attributes attributes,
                        long timeUnixNano) {
        this.instrumentName = instrumentName;
        this.value = value;
        this.longValue = longValue;
        this.attributes = attributes != null ? attributes : Attributes.empty();
        this.timeUnixNano = timeUnixNano;
    }

    public String getInstrumentName() {
        return instrumentName;
    }

    public double getValue() {
        return value;
    }

    public long getLongValue() {
        return longValue;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public long getTimeUnixNano() {
        return timeUnixNano;
    }

    @Override
    public String toString() {
        return "MetricPoint[" + instrumentName + attributes + "=" + value + "]";
    }

}
