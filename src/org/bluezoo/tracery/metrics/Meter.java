/*
 * Meter.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Factory and registry for metric instruments.
 * An instrument's identity is its name: building an instrument under a
 * name that is already registered returns the existing instrument.
 * Registering a name under a different kind is reported as a usage error
 * and yields an instrument that rejects every observation.
 *
 * <p>Example usage:
 * <pre>
 * Meter meter = telemetry.getMeter();
 *
 * LongCounter counter = meter.counterBuilder("http.server.requests")
 *     .setDescription("Total HTTP requests")
 *     .build();
 *
 * DoubleHistogram histogram = meter.histogramBuilder("http.server.request_duration")
 *     .setDescription("Request duration")
 *     .setUnit("ms")
 *     .build();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Meter {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.tracery.metrics.L10N");

    private static final Comparator<Instrument> BY_NAME = new Comparator<Instrument>() {
        @Override
        public int compare(Instrument a, Instrument b) {
            return a.getName().compareTo(b.getName());
        }
    };

    private final String name;
    private final ObservationBuffer buffer;
    private final TelemetryDiagnostics diagnostics;
    private final ConcurrentMap<String, Instrument> instruments;

    /**
     * Creates a new meter.
     *
     * @param name the instrumentation scope name
     * @param buffer the buffer receiving raw observations
     * @param diagnostics where usage errors and rejected values are counted
     */
    public Meter(String name, ObservationBuffer buffer, TelemetryDiagnostics diagnostics) {
        this.name = name;
        this.buffer = buffer;
        this.diagnostics = diagnostics;
        this.instruments = new ConcurrentHashMap<String, Instrument>();
    }

    /**
     * Returns the instrumentation scope name.
     */
    public String getName() {
        return name;
    }

    ObservationBuffer getBuffer() {
        return buffer;
    }

    /**
     * Creates a builder for a LongCounter.
     *
     * @param name the counter name
     * @return the builder
     */
    public LongCounter.Builder counterBuilder(String name) {
        return new LongCounter.Builder(this, name);
    }

    /**
     * Creates a builder for a DoubleHistogram.
     *
     * @param name the histogram name
     * @return the builder
     */
    public DoubleHistogram.Builder histogramBuilder(String name) {
        return new DoubleHistogram.Builder(this, name);
    }

    LongCounter registerCounter(String name, String description, String unit) {
        LongCounter candidate = new LongCounter(name, description, unit, buffer, diagnostics, true);
        Instrument existing = instruments.putIfAbsent(name, candidate);
        if (existing == null) {
            return candidate;
        }
        if (existing instanceof LongCounter) {
            return (LongCounter) existing;
        }
        diagnostics.usageError("usage.kind_mismatch", name, existing.getKind(), InstrumentKind.COUNTER);
        return new LongCounter(name, description, unit, buffer, diagnostics, false);
    }

    DoubleHistogram registerHistogram(String name, String description, String unit, double[] boundaries) {
        DoubleHistogram candidate = new DoubleHistogram(name, description, unit, boundaries,
                buffer, diagnostics, true);
        Instrument existing = instruments.putIfAbsent(name, candidate);
        if (existing == null) {
            return candidate;
        }
        if (existing instanceof DoubleHistogram) {
            return (DoubleHistogram) existing;
        }
        diagnostics.usageError("usage.kind_mismatch", name, existing.getKind(), InstrumentKind.HISTOGRAM);
        return new DoubleHistogram(name, description, unit, boundaries, buffer, diagnostics, false);
    }

    /**
     * Returns the instrument registered under a name, or null.
     */
    public Instrument getInstrument(String name) {
        return instruments.get(name);
    }

    /**
     * Returns all registered instruments, sorted by name.
     */
    public List<Instrument> getInstruments() {
        List<Instrument> list = new ArrayList<Instrument>(instruments.values());
        Collections.sort(list, BY_NAME);
        return list;
    }

    @Override
    public String toString() {
        return "Meter[" + name + ", instruments=" + instruments.size() + "]";
    }

}
