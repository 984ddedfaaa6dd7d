/*
 * AggregationTemporality.java
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
 * Defines how aggregated values relate to earlier windows.
 *
 * <ul>
 *   <li>DELTA - values cover only the last aggregation window
 *   <li>CUMULATIVE - values are totals since the aggregator started
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum AggregationTemporality {

    /**
     * Delta temporality: values represent the change over the last window.
     * Suited to push-based collectors that add windows up themselves.
     */
    DELTA,

    /**
     * Cumulative temporality: values represent the total since start.
     * Suited to Prometheus-style scrapers and pull-based systems.
     */
    CUMULATIVE

}
