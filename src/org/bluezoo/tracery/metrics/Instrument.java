/*
 * Instrument.java
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
 * Base interface for all metric instruments.
 * An instrument is a named tool for recording observations; its identity
 * is its name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface Instrument {

    /**
     * Returns the instrument name.
     */
    String getName();

    /**
     * Returns the instrument kind.
     */
    InstrumentKind getKind();

    /**
     * Returns the instrument description.
     */
    String getDescription();

    /**
     * Returns the unit of measurement.
     */
    String getUnit();

    /**
     * Returns false if this instrument was refused at registration and
     * rejects every observation.
     */
    boolean isRegistered();

}
