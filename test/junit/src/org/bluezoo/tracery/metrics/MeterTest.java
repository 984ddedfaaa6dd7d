/*
 * MeterTest.java
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

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.List;

/**
 * Unit tests for {@link Meter} and metric instruments.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MeterTest {

    private TelemetryDiagnostics diagnostics;
    private ObservationBuffer buffer;
    private Meter meter;

    @Before
    public void setUp() {
        diagnostics = new TelemetryDiagnostics();
        buffer = new ObservationBuffer(1024, diagnostics);
        meter = new Meter("test.meter", buffer, diagnostics);
    }

    // ========================================================================
    // Meter Construction Tests
    // ========================================================================

    @Test
    public void testMeterConstruction() {
        assertEquals("test.meter", meter.getName());
        assertTrue(meter.getInstruments().isEmpty());
    }

    @Test
    public void testInstrumentsSortedByName() {
        meter.histogramBuilder("zeta").build();
        meter.counterBuilder("alpha").build();
        List<Instrument> instruments = meter.getInstruments();
        assertEquals(2, instruments.size());
        assertEquals("alpha", instruments.get(0).getName());
        assertEquals("zeta", instruments.get(1).getName());
    }

    // ========================================================================
    // LongCounter Tests
    // ========================================================================

    @Test
    public void testCounterBuilder() {
        LongCounter counter = meter.counterBuilder("requests.total")
                .setDescription("Total requests")
                .setUnit("1")
                .build();

        assertNotNull(counter);
        assertEquals("requests.total", counter.getName());
        assertEquals("Total requests", counter.getDescription());
        assertEquals("1", counter.getUnit());
        assertEquals(InstrumentKind.COUNTER, counter.getKind());
        assertTrue(counter.isRegistered());
    }

    @Test
    public void testCounterAddBuffers() {
        LongCounter counter = meter.counterBuilder("requests").build();

        counter.add(1);
        counter.add(5, Attributes.of("method", "GET"));
        counter.add(0);

        assertEquals(3, buffer.size());
    }

    @Test
    public void testCounterNegativeValue() {
        LongCounter counter = meter.counterBuilder("requests").build();
        try {
            counter.add(-1);
            fail("Expected InvalidObservationException");
        } catch (InvalidObservationException e) {
            assertEquals("requests", e.getInstrumentName());
        }
        assertEquals(0, buffer.size());
        assertEquals(1, diagnostics.getInvalidObservations());
    }

    @Test
    public void testCounterNullAttributes() {
        LongCounter counter = meter.counterBuilder("requests").build();
        counter.add(1, null);
        List<MetricPoint> points = buffer.swap();
        assertEquals(1, points.size());
        assertTrue(points.get(0).getAttributes().isEmpty());
    }

    // ========================================================================
    // DoubleHistogram Tests
    // ========================================================================

    @Test
    public void testHistogramBuilder() {
        DoubleHistogram histogram = meter.histogramBuilder("request.duration")
                .setDescription("Request duration")
                .setUnit("ms")
                .build();

        assertEquals("request.duration", histogram.getName());
        assertEquals("ms", histogram.getUnit());
        assertEquals(InstrumentKind.HISTOGRAM, histogram.getKind());
        assertArrayEquals(DoubleHistogram.DEFAULT_BOUNDARIES, histogram.getBoundaries(), 0.0);
    }

    @Test
    public void testHistogramExplicitBuckets() {
        DoubleHistogram histogram = meter.histogramBuilder("latency")
                .setExplicitBuckets(100.0, 10.0, 50.0)
                .build();
        assertArrayEquals(new double[] { 10.0, 50.0, 100.0 }, histogram.getBoundaries(), 0.0);

        // Boundaries cannot be changed through the returned copy
        histogram.getBoundaries()[0] = 99.0;
        assertEquals(10.0, histogram.getBoundaries()[0], 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHistogramNonFiniteBucket() {
        meter.histogramBuilder("latency").setExplicitBuckets(1.0, Double.POSITIVE_INFINITY);
    }

    @Test
    public void testHistogramBucketsUpperInclusive() {
        DoubleHistogram histogram = meter.histogramBuilder("latency")
                .setExplicitBuckets(10.0, 50.0, 100.0)
                .build();
        assertEquals(0, histogram.findBucket(-3.0));
        assertEquals(0, histogram.findBucket(10.0));
        assertEquals(1, histogram.findBucket(10.5));
        assertEquals(1, histogram.findBucket(50.0));
        assertEquals(2, histogram.findBucket(100.0));
        assertEquals(3, histogram.findBucket(100.1));
    }

    @Test
    public void testHistogramRejectsNonFinite() {
        DoubleHistogram histogram = meter.histogramBuilder("latency").build();
        histogram.record(12.5);
        try {
            histogram.record(Double.NaN);
            fail("Expected InvalidObservationException");
        } catch (InvalidObservationException e) {
            assertEquals("latency", e.getInstrumentName());
        }
        try {
            histogram.record(Double.NEGATIVE_INFINITY, Attributes.of("route", "/"));
            fail("Expected InvalidObservationException");
        } catch (IllegalArgumentException e) {
            // InvalidObservationException is an IllegalArgumentException
        }
        assertEquals(1, buffer.size());
        assertEquals(2, diagnostics.getInvalidObservations());
    }

    // ========================================================================
    // Registration Tests
    // ========================================================================

    @Test
    public void testSameNameReturnsSameInstrument() {
        LongCounter a = meter.counterBuilder("requests").setDescription("first").build();
        LongCounter b = meter.counterBuilder("requests").setDescription("second").build();
        assertSame(a, b);
        assertEquals("first", b.getDescription());
        assertEquals(0, diagnostics.getUsageErrors());
    }

    @Test
    public void testKindMismatchReturnsRejectingInstrument() {
        LongCounter counter = meter.counterBuilder("jobs").build();
        DoubleHistogram histogram = meter.histogramBuilder("jobs").build();

        assertEquals(1, diagnostics.getUsageErrors());
        assertFalse(histogram.isRegistered());
        assertSame(counter, meter.getInstrument("jobs"));

        histogram.record(5.0);
        assertEquals(0, buffer.size());
        assertEquals(2, diagnostics.getUsageErrors());

        counter.add(1);
        assertEquals(1, buffer.size());
    }

    // ========================================================================
    // Attributes Tests
    // ========================================================================

    @Test
    public void testAttributesIdentity() {
        Attributes a = Attributes.of("route", "/items/{item_id}", "method", "GET");
        Attributes b = Attributes.of("method", "GET", "route", "/items/{item_id}");
        Attributes c = Attributes.of("method", "GET", "route", "/other");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertFalse(a.equals(c));
        assertEquals("GET", a.get("method"));
        assertEquals(2, a.size());
    }

    @Test
    public void testAttributesTypeMatters() {
        assertFalse(Attributes.of("code", 200L).equals(Attributes.of("code", "200")));
    }

    @Test
    public void testAttributesSkipNullValues() {
        Attributes attrs = Attributes.of("a", "x", "b", null);
        assertEquals(1, attrs.size());
        assertNull(attrs.get("b"));
        assertTrue(Attributes.empty().isEmpty());
    }

    // ========================================================================
    // Buffer Tests
    // ========================================================================

    @Test
    public void testBufferEvictsOldestWhenFull() {
        ObservationBuffer small = new ObservationBuffer(2, diagnostics);
        small.add(new MetricPoint("x", 1.0, null, 1L));
        small.add(new MetricPoint("x", 2.0, null, 2L));
        small.add(new MetricPoint("x", 3.0, null, 3L));
        assertEquals(1, diagnostics.getDroppedObservations());

        List<MetricPoint> points = small.swap();
        assertEquals(2, points.size());
        assertEquals(2.0, points.get(0).getValue(), 0.0);
        assertEquals(3.0, points.get(1).getValue(), 0.0);
        assertEquals(0, small.size());
    }

}
