/*
 * LoggingSpanExporterTest.java
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
import org.bluezoo.tracery.Span;
import org.bluezoo.tracery.SpanData;
import org.bluezoo.tracery.Telemetry;
import org.bluezoo.tracery.TelemetryConfig;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Unit tests for {@link LoggingSpanExporter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LoggingSpanExporterTest {

    private final List<LogRecord> records = new ArrayList<LogRecord>();
    private Logger logger;
    private Handler handler;
    private Level savedLevel;

    @Before
    public void setUp() {
        logger = Logger.getLogger(LoggingSpanExporter.class.getName());
        savedLevel = logger.getLevel();
        logger.setLevel(Level.ALL);
        handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
    }

    @After
    public void tearDown() {
        logger.removeHandler(handler);
        logger.setLevel(savedLevel);
    }

    @Test
    public void testOneLinePerSpan() {
        TelemetryConfig config = new TelemetryConfig();
        config.setMetricsEnabled(false);
        Telemetry telemetry = new Telemetry(config, new RecordingSpanExporter());
        SpanData parent;
        SpanData child;
        try {
            Span outer = telemetry.getTracer("t").startSpan("outer");
            Span inner = telemetry.getTracer("t").startSpan("inner");
            inner.end();
            outer.end();
            parent = outer.getData();
            child = inner.getData();
        } finally {
            telemetry.shutdown();
        }

        Resource resource = Resource.of(Collections.singletonMap(Resource.SERVICE_NAME, "logged"));
        new LoggingSpanExporter(Level.FINE).export(resource, Arrays.asList(parent, child));

        assertEquals(2, records.size());
        assertEquals(Level.FINE, records.get(0).getLevel());
        String first = records.get(0).getMessage();
        String second = records.get(1).getMessage();
        assertTrue(first, first.startsWith("[logged] trace=" + parent.getTraceIdHex()));
        assertTrue(first, first.contains(" parent=- outer "));
        assertTrue(second, second.contains(" parent=" + parent.getSpanIdHex() + " inner "));
    }

}
