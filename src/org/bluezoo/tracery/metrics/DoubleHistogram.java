/*
 * DoubleHistogram.java
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

import org.bluezoo.tracery.TelemetryDiagnostics;

import java.text.MessageFormat;
import java.util.Arrays;

/**
 * A histogram for recording distributions of double values over explicit
 * bucket boundaries. The boundaries are fixed when the histogram is
 * built.
 *
 * <p>Bucket {@code i} counts values {@code v} with
 * {@code bounds[i-1] < v <= bounds[i]}; the last bucket counts values
 * above the last boundary.
 *
 * <p>Example usage:
 * <pre>
 * DoubleHistogram latency = meter.histogramBuilder("http.server.request_duration")
 *     .setDescription("Request latency")
 *     .setUnit("ms")
 *     .setExplicitBuckets(5, 10, 25, 50, 100, 250, 500, 1000)
 *     .build();
 *
 * latency.record(45.2, Attributes.of("route", "/items/{item_id}"));
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DoubleHistogram implements Instrument {

    // Default bucket boundaries (suitable for latency in ms)
    static final double[] DEFAULT_BOUNDARIES = {
        0, 5, 10, 25, 50, 75, 100, 250, 500, 750, 1000, 2500, 5000, 7500, 10000
    };

    private final String name;
    private final String description;
    private final String unit;
    private final double[] boundaries;
    private final ObservationBuffer buffer;
    private final TelemetryDiagnostics diagnostics;
    private final boolean registered;

    DoubleHistogram(String name, String description, String unit, double[] boundaries,
                    ObservationBuffer buffer, TelemetryDiagnostics diagnostics, boolean registered) {
        this.name = name;
        this.description = description;
        this.unit = unit;
        this.boundaries = boundaries != null ? boundaries.clone() : DEFAULT_BOUNDARIES.clone();
        Arrays.sort(this.boundaries);
        this.buffer = buffer;
        this.diagnostics = diagnostics;
        this.registered = registered;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public InstrumentKind getKind() {
        return InstrumentKind.HISTOGRAM;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public String getUnit() {
        return unit;
    }

    @Override
    public boolean isRegistered() {
        return registered;
    }

    /**
     * Returns a copy of the bucket boundaries.
     */
    public double[] getBoundaries() {
        return boundaries.clone();
    }

    /**
     * Records a value.
     *
     * @param value the value to record
     */
    public void record(double value) {
        record(value, Attributes.empty());
    }

    /**
     * Records a value with attributes.
     *
     * @param value the value to record
     * @param attributes the attributes for this measurement
     * @throws InvalidObservationException if the value is NaN or infinite
     */
    public void record(double value, Attributes attributes) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            diagnostics.invalidObservation(name, value);
            String msg = MessageFormat.format(Meter.L10N.getString("metrics.non_finite"), name, value);
            throw new InvalidObservationException(name, msg);
        }
        if (!registered) {
            diagnostics.usageError("usage.rejected_instrument", name, InstrumentKind.HISTOGRAM);
            return;
        }
        buffer.add(new MetricPoint(name, value, attributes, System.currentTimeMillis() * 1_000_000L));
    }

    /**
     * Returns the index of the bucket a value falls into.
     */
    int findBucket(double value) {
        // Binary search for the first boundary not below the value
        int low = 0;
        int high = boundaries.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (value > boundaries[mid]) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        return "DoubleHistogram[" + name + ", buckets=" + Arrays.toString(boundaries) + "]";
    }

    /**
     * Builder for DoubleHistogram.
     */
    public static class Builder {

        private final Meter meter;
        private final String name;
        private String description = "";
        private String unit = "";
        private double[] boundaries;

        Builder(Meter meter, String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name cannot be empty");
            }
            this.meter = meter;
            this.name = name;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setUnit(String unit) {
            this.unit = unit;
            return this;
        }

        /**
         * Sets explicit bucket boundaries.
         * Values at or below the first boundary go into bucket 0.
         * Values above the last boundary go into the last bucket.
         */
        public Builder setExplicitBuckets(double... boundaries) {
            for (double boundary : boundaries) {
                if (Double.isNaN(boundary) || Double.isInfinite(boundary)) {
                    throw new IllegalArgumentException("bucket boundary must be finite: " + boundary);
                }
            }
            this.boundaries = boundaries.clone();
            return this;
        }

        /**
         * Registers the histogram, or returns the histogram already
         * registered under this name. The boundaries of an existing
         * histogram are kept.
         */
        public DoubleHistogram build() {
            return meter.registerHistogram(name, description, unit, boundaries);
        }
    }

}
