/*
 * TextExpositionTest.java
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

import org.bluezoo.tracery.Resource;
import org.bluezoo.tracery.TelemetryDiagnostics;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit tests for {@link TextExposition}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TextExpositionTest {

    private Meter meter;
    private MetricAggregator aggregator;

    @Before
    public void setUp() {
        TelemetryDiagnostics diagnostics = new TelemetryDiagnostics();
        meter = new Meter("test", new ObservationBuffer(1024, diagnostics), diagnostics);
        aggregator = new MetricAggregator(meter, AggregationTemporality.CUMULATIVE);
    }

    @Test
    public void testEmpty() {
        assertEquals("", TextExposition.render(null, Collections.<AggregatedMetric>emptyList()));
    }

    @Test
    public void testCounter() {
        LongCounter counter = meter.counterBuilder("http.requests")
                .setDescription("Handled requests")
                .build();
        counter.add(3, Attributes.of("route", "/items/{item_id}"));

        String text = TextExposition.render(null, aggregator.pull());
        assertEquals("# HELP http_requests_total Handled requests\n"
                + "# TYPE http_requests_total counter\n"
                + "http_requests_total{route=\"/items/{item_id}\"} 3\n", text);
    }

    @Test
    public void testHistogram() {
        DoubleHistogram histogram = meter.histogramBuilder("background.job.duration")
                .setDescription("Background job duration")
                .setExplicitBuckets(250.0, 1000.0)
                .build();
        Attributes slow = Attributes.of("task.type", "slow");
        histogram.record(200.0, slow);
        histogram.record(1200.0, slow);
        histogram.record(1000.0, slow);

        String text = TextExposition.render(null, aggregator.pull());
        assertEquals("# HELP background_job_duration Background job duration\n"
                + "# TYPE background_job_duration histogram\n"
                + "background_job_duration_bucket{task_type=\"slow\",le=\"250.0\"} 1\n"
                + "background_job_duration_bucket{task_type=\"slow\",le=\"1000.0\"} 2\n"
                + "background_job_duration_bucket{task_type=\"slow\",le=\"+Inf\"} 3\n"
                + "background_job_duration_sum{task_type=\"slow\"} 2400.0\n"
                + "background_job_duration_count{task_type=\"slow\"} 3\n", text);
    }

    @Test
    public void testFamilyHeaderOncePerInstrument() {
        LongCounter counter = meter.counterBuilder("jobs").build();
        counter.add(1, Attributes.of("mode", "optimized"));
        counter.add(1, Attributes.of("mode", "bottlenecks"));

        String text = TextExposition.render(null, aggregator.pull());
        assertEquals(text.indexOf("# TYPE jobs_total"), text.lastIndexOf("# TYPE jobs_total"));
        assertTrue(text.contains("jobs_total{mode=\"bottlenecks\"} 1\n"));
        assertTrue(text.contains("jobs_total{mode=\"optimized\"} 1\n"));
        // Without a description the name is used as help text
        assertTrue(text.startsWith("# HELP jobs_total jobs_total\n"));
    }

    @Test
    public void testTargetInfo() {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put(Resource.SERVICE_NAME, "items-service");
        attrs.put(Resource.DEPLOYMENT_ENVIRONMENT, "dev");
        String text = TextExposition.render(Resource.of(attrs), Collections.<AggregatedMetric>emptyList());
        assertEquals("# HELP target_info Target metadata\n"
                + "# TYPE target_info gauge\n"
                + "target_info{deployment_environment=\"dev\",service_name=\"items-service\"} 1\n", text);
    }

    @Test
    public void testNames() {
        assertEquals("http_server_request_duration", TextExposition.metricName("http.server.request_duration"));
        assertEquals("_9lives", TextExposition.metricName("9lives"));
        assertEquals("ns:name", TextExposition.metricName("ns:name"));
        assertEquals("ns_name", TextExposition.labelName("ns:name"));
    }

    @Test
    public void testEscapeLabelValue() {
        assertEquals("a\\\"b\\\\c\\nd", TextExposition.escapeLabelValue("a\"b\\c\nd"));
    }

    @Test
    public void testFormatDouble() {
        assertEquals("1.5", TextExposition.formatDouble(1.5));
        assertEquals("+Inf", TextExposition.formatDouble(Double.POSITIVE_INFINITY));
        assertEquals("-Inf", TextExposition.formatDouble(Double.NEGATIVE_INFINITY));
    }

}
