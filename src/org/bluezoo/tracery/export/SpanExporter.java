/*
 * SpanExporter.java
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

package org.bluezoo.tracery.export;

import org.bluezoo.tracery.Resource;
import org.bluezoo.tracery.SpanData;

import java.util.List;

/**
 * Sink receiving batches of finished spans, such as a collector client.
 * Implementations may send data over the network, log it, or keep it in
 * memory.
 *
 * <p>The order of spans within a batch carries no meaning, and a batch
 * may contain spans of a trace whose other spans were exported earlier.
 * A sink may fail a whole batch by throwing {@link ExportException}; the
 * {@link BatchSpanExporter} retries and eventually drops it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface SpanExporter {

    /**
     * Exports a batch of spans. Called from the export thread only.
     *
     * @param resource the identity of the emitting process
     * @param spans the spans, immutable
     * @throws ExportException if the batch was not accepted
     */
    void export(Resource resource, List<SpanData> spans) throws ExportException;

    /**
     * Releases any resources held by this sink.
     */
    void shutdown();

}
