/*
 * SpanKind.java
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

package org.bluezoo.tracery;

/**
 * Indicates the role of a span in a trace.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SpanKind {

    /**
     * Default value. An operation internal to the application.
     */
    INTERNAL,

    /**
     * Server-side handling of a request.
     */
    SERVER,

    /**
     * A request to some remote service.
     */
    CLIENT,

    /**
     * A producer handing work to a queue or background worker.
     */
    PRODUCER,

    /**
     * A consumer running queued or background work.
     */
    CONSUMER

}
