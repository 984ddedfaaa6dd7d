/*
 * InstrumentKind.java
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
 * The kind of an instrument, fixed when its name is first registered.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum InstrumentKind {

    /**
     * A monotonically increasing sum.
     */
    COUNTER,

    /**
     * A distribution of recorded values over fixed buckets.
     */
    HISTOGRAM

}
