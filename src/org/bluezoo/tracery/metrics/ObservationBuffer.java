/*
 * ObservationBuffer.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded buffer of raw observations shared by all instruments of a
 * meter. Recording threads append under a short lock; the aggregator
 * takes the whole content by swapping in a fresh list, so no observation
 * is lost or counted twice between two passes. When full, the oldest
 * observation is evicted and counted.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObservationBuffer {

    private final int capacity;
    private final TelemetryDiagnostics diagnostics;
    private final Lock lock = new ReentrantLock();

    private Deque<MetricPoint> points;

    public ObservationBuffer(int capacity, TelemetryDiagnostics diagnostics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.diagnostics = diagnostics;
        this.points = new ArrayDeque<MetricPoint>();
    }

    /**
     * Appends an observation, evicting the oldest one if the buffer is
     * full.
     *
     * @param point the observation
     */
    public void add(MetricPoint point) {
        boolean evicted = false;
        lock.lock();
        try {
            if (points.size() >= capacity) {
                points.pollFirst();
                evicted = true;
            }
            points.addLast(point);
        } finally {
            lock.unlock();
        }
        if (evicted) {
            diagnostics.observationsDropped(1);
        }
    }

    /**
     * Takes every pending observation, oldest first, leaving the buffer
     * empty.
     *
     * @return the observations
     */
    public List<MetricPoint> swap() {
        Deque<MetricPoint> taken;
        lock.lock();
        try {
            taken = points;
            points = new ArrayDeque<MetricPoint>();
        } finally {
            lock.unlock();
        }
        return new ArrayList<MetricPoint>(taken);
    }

    /**
     * Returns the number of pending observations.
     */
    public int size() {
        lock.lock();
        try {
            return points.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

}
