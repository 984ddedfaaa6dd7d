/*
 * AggregatedMetric.java
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

import java.util.Arrays;

/**
 * The reduced value of one time series (instrument and attribute set)
 * over one aggregation window. Immutable once published.
 *
 * <p>For a counter, {@link #getSum()} is the total and {@link #getCount()}
 * the number of increments. For a histogram, the bucket counts, sum,
 * count, minimum and maximum of the recorded values are available.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AggregatedMetric {

    private final String name;
    private final InstrumentKind kind;
    private final String description;
    private final String unit;
    private final AggregationTemporality temporality;
    private final Attributes attributes;
    private final long windowStartUnixNano;
    private final long windowEndUnixNano;
    private final long count;
    private final double sum;
    private final long longSum;
    private final double min;
    private final double max;
    private final double[] boundaries;
    private final long[] bucketCounts;

    AggregatedMetric(Instrument instrument, AggregationTemporality temporality, Attributes attributes,
                     long windowStartUnixNano, long windowEndUnixNano,
                     long count, double sum, long longSum, double min, double max,
                     double[] boundaries, long[] bucketCounts) {
        this.name = instrument.getName();
        this.kind = instrument.getKind();
        this.description = instrument.getDescription();
        this.unit = instrument.getUnit();
        this.temporality = temporality;
        this.attributes = attributes;
        this.windowStartUnixNano = windowStartUnixNano;
        this.windowEndUnixNano = windowEndUnixNano;
        this.count = count;
        this.sum = sum;
        this.longSum = longSum;
        this.min = min;
        this.max = max;
        this.boundaries = boundaries != null ? boundaries.clone() : new double[0];
        this.bucketCounts = bucketCounts != null ? bucketCounts.clone() : new long[0];
    }

    public String getName() {
        return name;
    }

    public InstrumentKind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public String getUnit() {
        return unit;
    }

    public AggregationTemporality getTemporality() {
        return temporality;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public long getWindowStartUnixNano() {
        return windowStartUnixNano;
    }

    public long getWindowEndUnixNano() {
        return windowEndUnixNano;
    }

    /**
     * Returns the number of observations reduced into this value.
     */
    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    /**
     * Returns a counter's exact total.
     */
    public long getLongValue() {
        return longSum;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * Returns a histogram's bucket boundaries; empty for a counter.
     */
    public double[] getBoundaries() {
        return boundaries.clone();
    }

    /**
     * Returns a histogram's per-bucket counts. The length is one more
     * than the number of boundaries.
     */
    public long[] getBucketCounts() {
        return bucketCounts.clone();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("AggregatedMetric[");
        buf.append(name).append(attributes).append(", ").append(kind);
        if (kind == InstrumentKind.COUNTER) {
            buf.append(", value=").append(getLongValue());
        } else {
            buf.append(", count=").append(count).append(", sum=").append(sum);
            buf.append(", buckets=").append(Arrays.toString(bucketCounts));
        }
        buf.append(']');
        return buf.toString();
    }

}
