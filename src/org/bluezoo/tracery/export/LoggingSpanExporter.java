/*
 * LoggingSpanExporter.java
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

import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes one log line per finished span.
 * This is the sink used when no other exporter is configured.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LoggingSpanExporter implements SpanExporter {

    private static final Logger LOGGER = Logger.getLogger(LoggingSpanExporter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.tracery.export.L10N");

    private final Level level;

    public LoggingSpanExporter() {
        this(Level.INFO);
    }

    /**
     * @param level the level spans are logged at
     */
    public LoggingSpanExporter(Level level) {
        this.level = level;
    }

    @Override
    public void export(Resource resource, List<SpanData> spans) {
        if (!LOGGER.isLoggable(level)) {
            return;
        }
        for (SpanData span : spans) {
            LOGGER.log(level, MessageFormat.format(L10N.getString("export.span"),
                    resource.getServiceName(),
                    span.getTraceIdHex(),
                    span.getSpanIdHex(),
                    span.getParentSpanIdHex() != null ? span.getParentSpanIdHex() : "-",
                    span.getName(),
                    String.format("%.3f", span.getDurationMillis()),
                    span.getStatus(),
                    span.getAttributes()));
        }
    }

    @Override
    public void shutdown() {
        // Nothing held
    }

}
