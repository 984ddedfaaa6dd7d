/*
 * package-info.java
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

/**
 * Metric instruments and their aggregation.
 *
 * <p>Instruments are obtained from a {@link org.bluezoo.tracery.metrics.Meter}
 * by name. Every observation becomes a
 * {@link org.bluezoo.tracery.metrics.MetricPoint} in a bounded
 * {@link org.bluezoo.tracery.metrics.ObservationBuffer}, which a
 * {@link org.bluezoo.tracery.metrics.MetricAggregator} swaps out and
 * reduces at each window. Aggregates can be rendered for a Prometheus
 * scraper with {@link org.bluezoo.tracery.metrics.TextExposition}.
 *
 * <h2>Instruments</h2>
 * <ul>
 *   <li>{@link org.bluezoo.tracery.metrics.LongCounter} - monotonic sums
 *       such as request counts</li>
 *   <li>{@link org.bluezoo.tracery.metrics.DoubleHistogram} - distributions
 *       such as request or job durations</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.tracery.metrics;
