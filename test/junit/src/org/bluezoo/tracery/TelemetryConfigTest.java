/*
 * TelemetryConfigTest.java
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

import org.bluezoo.tracery.metrics.AggregationTemporality;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Unit tests for {@link TelemetryConfig}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TelemetryConfigTest {

    @Test
    public void testDefaults() {
        TelemetryConfig config = new TelemetryConfig();
        assertTrue(config.isTracesEnabled());
        assertTrue(config.isMetricsEnabled());
        assertEquals("tracery", config.getServiceName());
        assertEquals(512, config.getBatchSize());
        assertEquals(5000L, config.getFlushIntervalMs());
        assertEquals(2048, config.getMaxQueueSize());
        assertEquals(3, config.getExportMaxRetries());
        assertEquals(1024, config.getMaxQueuedJobs());
        assertEquals(AggregationTemporality.CUMULATIVE, config.getMetricsTemporality());
        assertTrue(config.getResourceAttributes().isEmpty());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty("tracery.service-name", "items-service");
        props.setProperty("tracery.service-version", "1.2.0");
        props.setProperty("tracery.batch-size", " 64 ");
        props.setProperty("tracery.max-queued-jobs", "16");
        props.setProperty("tracery.metrics-temporality", "delta");
        props.setProperty("tracery.traces-enabled", "false");
        props.setProperty("tracery.resource-attributes", "team=core,region=eu");
        props.setProperty("tracery.no-such-setting", "x");
        props.setProperty("other.batch-size", "1");

        TelemetryConfig config = TelemetryConfig.fromProperties(props);
        assertEquals("items-service", config.getServiceName());
        assertEquals("1.2.0", config.getServiceVersion());
        assertEquals(64, config.getBatchSize());
        assertEquals(16, config.getMaxQueuedJobs());
        assertEquals(AggregationTemporality.DELTA, config.getMetricsTemporality());
        assertFalse(config.isTracesEnabled());
        assertEquals("core", config.getResourceAttributes().get("team"));
        assertEquals("eu", config.getResourceAttributes().get("region"));
    }

    @Test
    public void testInvalidNumber() {
        Properties props = new Properties();
        props.setProperty("tracery.batch-size", "lots");
        try {
            TelemetryConfig.fromProperties(props);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("tracery.batch-size"));
        }
    }

    @Test
    public void testTemporalityName() {
        TelemetryConfig config = new TelemetryConfig();
        config.setMetricsTemporalityName("DELTA");
        assertEquals(AggregationTemporality.DELTA, config.getMetricsTemporality());
        config.setMetricsTemporalityName("cumulative");
        assertEquals(AggregationTemporality.CUMULATIVE, config.getMetricsTemporality());
        try {
            config.setMetricsTemporalityName("sometimes");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyServiceName() {
        new TelemetryConfig().setServiceName("");
    }

    @Test
    public void testApplyEnvironment() {
        Map<String, String> env = new HashMap<String, String>();
        env.put("OTEL_RESOURCE_ATTRIBUTES", "service.name=from-attrs, deployment.environment=prod,bad");
        TelemetryConfig config = new TelemetryConfig().applyEnvironment(env);
        assertEquals("from-attrs", config.getServiceName());
        assertEquals("prod", config.getResourceAttributes().get("deployment.environment"));
        assertEquals(1, config.getResourceAttributes().size());

        env.put("OTEL_SERVICE_NAME", "from-name");
        config = new TelemetryConfig().applyEnvironment(env);
        assertEquals("from-name", config.getServiceName());
    }

    @Test
    public void testResourceFromConfig() {
        TelemetryConfig config = new TelemetryConfig();
        config.setServiceName("svc");
        config.setDeploymentEnvironment("test");
        config.addResourceAttribute("team", "core");
        Resource resource = Resource.fromConfig(config);
        assertEquals("svc", resource.getServiceName());
        assertEquals("test", resource.get(Resource.DEPLOYMENT_ENVIRONMENT));
        assertEquals("core", resource.get("team"));
    }

}
