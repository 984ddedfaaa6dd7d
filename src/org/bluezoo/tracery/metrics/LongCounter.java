/*
 * LongCounter.java
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

/**
 * A monotonically increasing counter for long values.
 * Each increment becomes a {@link MetricPoint} in the meter's observation
 * buffer; totals are computed by the {@link MetricAggregator}.
 *
 * <p>Example usage:
 * <pre>
 * LongCounter requests = meter.counterBuilder("http.server.requests")
 *     .setDescription("Total HTTP requests")
 *     .build();
 *
 * requests.add(1, Attributes.of("route", "/items/{item_id}"));
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class LongCounter implements Instrument {

    private final String name;
    private final String description;
    private final String unit;
    private final ObservationBuffer buffer;
    private final TelemetryDiagnostics diagnostics;
    private final boolean registered;

    LongCounter(String name, String description, String unit,
                ObservationBuffer buffer, TelemetryDiagnostics diagnostics, boolean registered) {
        this.name = name;
        this.description = description;
        this.unit = unit;
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
        return InstrumentKind.COUNTER;
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
     * Adds a value to the counter.
     *
     * @param value the value to add (must be non-negative)
     */
    public void add(long value) {
        add(value, Attributes.empty());
    }

    /**
     * Adds a value to the counter with attributes.
     *
     * @param value the value to add (must be non-negative)
     * @param attributes the attributes for this measurement
     * @throws InvalidObservationException if the value is negative
     */
    public void add(long value, Attributes attributes) {
        if (value < 0) {
            diagnostics.invalidObservation(name, value);
            String msg = MessageFormat.format(Meter.L10N.getString("metrics.negative_counter"), name, value);
            throw new InvalidObservationException(name, msg);
        }
        if (!registered) {
            diagnostics.usageError("usage.rejected_instrument", name, InstrumentKind.COUNTER);
            return;
        }
        buffer.add(new MetricPoint(name, value, attributes, System.currentTimeMillis() * 1_000_000L));
    }

    @Override
    public String toString() {
        return "LongCounter[" + name + "]";
    }

    /**
     * Builder for LongCounter.
     */
    public static class Builder {

        private final Meter meter;
        private final String name;
        private String description = "";
        private String unit = "";

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
         * Registers the counter, or returns the counter already registered
         * under this name.
         */
        public LongCounter build() {
            return meter.registerCounter(name, description, unit);
        }
    }

}
