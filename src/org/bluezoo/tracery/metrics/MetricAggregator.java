/*
 * MetricAggregator.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reduces the raw observations of a meter into per-series aggregates.
 *
 * <p>Each pass takes the whole observation buffer in one swap, reduces it
 * per instrument and attribute set, and publishes an immutable
 * point-in-time list. With {@link AggregationTemporality#CUMULATIVE}
 * temporality each series carries totals since the aggregator started;
 * with {@link AggregationTemporality#DELTA} only the observations of the
 * last window. A pass that finds no new observations republishes the
 * previous list unchanged, so repeated pulls with no traffic in between
 * return identical values.
 *
 * <p>Passes run on demand through {@link #pull()} and, once
 * {@link #start(long)} has been called, periodically on a background
 * thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MetricAggregator {

    private static final Logger LOGGER = Logger.getLogger(MetricAggregator.class.getName());

    private static final Comparator<AggregatedMetric> BY_SERIES = new Comparator<AggregatedMetric>() {
        @Override
        public int compare(AggregatedMetric a, AggregatedMetric b) {
            int cmp = a.getName().compareTo(b.getName());
            return cmp != 0 ? cmp : a.getAttributes().toString().compareTo(b.getAttributes().toString());
        }
    };

    private final Meter meter;
    private final ObservationBuffer buffer;
    private final AggregationTemporality temporality;
    private final long startTimeUnixNano;

    // Guarded by this
    private final Map<SeriesKey, Series> totals;
    private long lastWindowEnd;

    private volatile List<AggregatedMetric> latest;
    private CollectionThread collectionThread;

    /**
     * Creates an aggregator over the observations of a meter.
     *
     * @param meter the meter whose instruments are reduced
     * @param temporality cumulative or delta reporting
     */
    public MetricAggregator(Meter meter, AggregationTemporality temporality) {
        this.meter = meter;
        this.buffer = meter.getBuffer();
        this.temporality = temporality != null ? temporality : AggregationTemporality.CUMULATIVE;
        this.startTimeUnixNano = System.currentTimeMillis() * 1_000_000L;
        this.totals = new HashMap<SeriesKey, Series>();
        this.lastWindowEnd = startTimeUnixNano;
        this.latest = Collections.emptyList();
    }

    public AggregationTemporality getTemporality() {
        return temporality;
    }

    /**
     * Runs one aggregation pass and publishes its result.
     *
     * @return the published aggregates, sorted by name and attributes
     */
    public synchronized List<AggregatedMetric> collect() {
        List<MetricPoint> points = buffer.swap();
        if (points.isEmpty()) {
            return latest;
        }
        long windowEnd = System.currentTimeMillis() * 1_000_000L;
        if (windowEnd < lastWindowEnd) {
            windowEnd = lastWindowEnd;
        }

        Map<SeriesKey, Series> window = new HashMap<SeriesKey, Series>();
        int skipped = 0;
        for (MetricPoint point : points) {
            Instrument instrument = meter.getInstrument(point.getInstrumentName());
            if (instrument == null) {
                skipped++;
                continue;
            }
            SeriesKey key = new SeriesKey(instrument, point.getAttributes());
            Series series = window.get(key);
            if (series == null) {
                series = new Series(instrument);
                window.put(key, series);
            }
            series.observe(point);
        }

        List<AggregatedMetric> result = new ArrayList<AggregatedMetric>();
        if (temporality == AggregationTemporality.DELTA) {
            for (Map.Entry<SeriesKey, Series> entry : window.entrySet()) {
                result.add(entry.getValue().toMetric(temporality, entry.getKey().attributes,
                        lastWindowEnd, windowEnd));
            }
        } else {
            for (Map.Entry<SeriesKey, Series> entry : window.entrySet()) {
                Series total = totals.get(entry.getKey());
                if (total == null) {
                    totals.put(entry.getKey(), entry.getValue());
                } else {
                    total.merge(entry.getValue());
                }
            }
            for (Map.Entry<SeriesKey, Series> entry : totals.entrySet()) {
                result.add(entry.getValue().toMetric(temporality, entry.getKey().attributes,
                        startTimeUnixNano, windowEnd));
            }
        }
        Collections.sort(result, BY_SERIES);
        lastWindowEnd = windowEnd;
        latest = Collections.unmodifiableList(result);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(Meter.L10N.getString("metrics.window_reduced"),
                    points.size(), result.size(), temporality));
        }
        if (skipped > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(Meter.L10N.getString("metrics.unknown_instrument"), skipped));
        }
        return latest;
    }

    /**
     * Reduces pending observations on demand and returns the result.
     * Used by scrapers; equivalent to {@link #collect()}.
     */
    public List<AggregatedMetric> pull() {
        return collect();
    }

    /**
     * Returns the result of the last completed pass without reducing
     * anything.
     */
    public List<AggregatedMetric> latest() {
        return latest;
    }

    /**
     * Finds the aggregate of one series in a published list.
     *
     * @param metrics a published list
     * @param name the instrument name
     * @param attributes the series attributes
     * @return the aggregate, or null
     */
    public static AggregatedMetric find(List<AggregatedMetric> metrics, String name, Attributes attributes) {
        Attributes attrs = attributes != null ? attributes : Attributes.empty();
        for (AggregatedMetric metric : metrics) {
            if (metric.getName().equals(name) && metric.getAttributes().equals(attrs)) {
                return metric;
            }
        }
        return null;
    }

    /**
     * Starts periodic collection.
     *
     * @param intervalMs the window length in milliseconds
     */
    public synchronized void start(long intervalMs) {
        if (collectionThread != null) {
            return;
        }
        collectionThread = new CollectionThread(Math.max(1L, intervalMs));
        collectionThread.start();
    }

    /**
     * Stops periodic collection and runs a last pass so that nothing
     * observed before shutdown is left unreduced.
     */
    public void shutdown() {
        CollectionThread thread;
        synchronized (this) {
            thread = collectionThread;
            collectionThread = null;
        }
        if (thread != null) {
            thread.shutdown();
        }
        collect();
    }

    /**
     * Identity of a time series: instrument name and attribute set.
     */
    private static final class SeriesKey {

        final String name;
        final Attributes attributes;

        SeriesKey(Instrument instrument, Attributes attributes) {
            this.name = instrument.getName();
            this.attributes = attributes;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof SeriesKey)) {
                return false;
            }
            SeriesKey other = (SeriesKey) obj;
            return name.equals(other.name) && attributes.equals(other.attributes);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 31 + attributes.hashCode();
        }
    }

    /**
     * Mutable reduction state of one series, confined to a pass.
     */
    private static final class Series {

        private final Instrument instrument;
        private final double[] boundaries;
        private final long[] counts;
        private long count;
        private double sum;
        private long longSum;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        Series(Instrument instrument) {
            this.instrument = instrument;
            if (instrument instanceof DoubleHistogram) {
                this.boundaries = ((DoubleHistogram) instrument).getBoundaries();
                this.counts = new long[boundaries.length + 1];
            } else {
                this.boundaries = null;
                this.counts = null;
            }
        }

        void observe(MetricPoint point) {
            double value = point.getValue();
            count++;
            sum += value;
            longSum += point.getLongValue();
            if (value < min) min = value;
            if (value > max) max = value;
            if (counts != null) {
                counts[((DoubleHistogram) instrument).findBucket(value)]++;
            }
        }

        void merge(Series other) {
            count += other.count;
            sum += other.sum;
            longSum += other.longSum;
            min = Math.min(min, other.min);
            max = Math.max(max, other.max);
            if (counts != null) {
                for (int i = 0; i < counts.length; i++) {
                    counts[i] += other.counts[i];
                }
            }
        }

        AggregatedMetric toMetric(AggregationTemporality temporality, Attributes attributes,
                                  long windowStart, long windowEnd) {
            return new AggregatedMetric(instrument, temporality, attributes, windowStart, windowEnd,
                    count, sum, longSum, min, max, boundaries, counts);
        }
    }

    /**
     * Background thread running a pass at each interval.
     */
    private class CollectionThread extends Thread {

        private final long intervalMs;
        private volatile boolean running = true;

        CollectionThread(long intervalMs) {
            super("MetricAggregator");
            setDaemon(true);
            this.intervalMs = intervalMs;
        }

        @Override
        public void run() {
            while (running) {
                try {
                    Thread.sleep(intervalMs);
                } catch (InterruptedException e) {
                    if (!running) {
                        return;
                    }
                    continue;
                }
                try {
                    collect();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, Meter.L10N.getString("metrics.collection_failed"), e);
                }
            }
        }

        void shutdown() {
            running = false;
            interrupt();
            try {
                join(1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

}
