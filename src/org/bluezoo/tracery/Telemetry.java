/*
 * Telemetry.java
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

import org.bluezoo.tracery.background.BackgroundTaskBridge;
import org.bluezoo.tracery.export.BatchSpanExporter;
import org.bluezoo.tracery.export.LoggingSpanExporter;
import org.bluezoo.tracery.export.SpanExporter;
import org.bluezoo.tracery.metrics.MetricAggregator;
import org.bluezoo.tracery.metrics.Meter;
import org.bluezoo.tracery.metrics.ObservationBuffer;
import org.bluezoo.tracery.metrics.TextExposition;

import java.text.MessageFormat;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * The telemetry pipeline of one process.
 *
 * <p>A {@code Telemetry} is constructed once at startup from a
 * {@link TelemetryConfig} and passed to the components that need it;
 * there is no global instance. It owns the frozen {@link Resource}, the
 * {@link ContextPropagator}, the batching span exporter, the metric
 * {@link Meter} and its {@link MetricAggregator}, the
 * {@link BackgroundTaskBridge} and the {@link TelemetryDiagnostics}.
 *
 * <pre>
 * TelemetryConfig config = new TelemetryConfig();
 * config.setServiceName("items-service");
 * Telemetry telemetry = new Telemetry(config);
 * telemetry.registerShutdownHook();
 *
 * Tracer tracer = telemetry.getTracer("items.handler");
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Telemetry {

    private static final Logger LOGGER = Logger.getLogger(Telemetry.class.getName());

    static final int ISSUED_SPAN_ID_CAPACITY = 65536;

    private final TelemetryConfig config;
    private final TelemetryDiagnostics diagnostics;
    private final Resource resource;
    private final ContextPropagator propagator;
    private final BatchSpanExporter exporter;
    private final Tracer.IssuedSpanIds issuedSpanIds;
    private final ConcurrentMap<String, Tracer> tracers;
    private final Meter meter;
    private final MetricAggregator aggregator;
    private final BackgroundTaskBridge backgroundTasks;

    private volatile boolean shutdownHookRegistered = false;
    private volatile boolean shuttingDown = false;

    /**
     * Creates a pipeline exporting spans through a
     * {@link LoggingSpanExporter}.
     *
     * @param config the configuration
     */
    public Telemetry(TelemetryConfig config) {
        this(config, new LoggingSpanExporter());
    }

    /**
     * Creates a pipeline exporting spans to the given sink.
     *
     * @param config the configuration
     * @param sink the span sink
     */
    public Telemetry(TelemetryConfig config, SpanExporter sink) {
        this.config = config;
        this.diagnostics = new TelemetryDiagnostics();
        this.resource = Resource.fromConfig(config);
        this.propagator = new ContextPropagator(diagnostics);
        this.exporter = new BatchSpanExporter(sink, resource, config, diagnostics);
        this.issuedSpanIds = new Tracer.IssuedSpanIds(ISSUED_SPAN_ID_CAPACITY);
        this.tracers = new ConcurrentHashMap<String, Tracer>();

        ObservationBuffer buffer = new ObservationBuffer(config.getMaxPendingObservations(), diagnostics);
        this.meter = new Meter(resource.getServiceName(), buffer, diagnostics);
        this.aggregator = new MetricAggregator(meter, config.getMetricsTemporality());
        if (config.isMetricsEnabled()) {
            aggregator.start(config.getMetricsIntervalMs());
        }
        this.backgroundTasks = new BackgroundTaskBridge(propagator, diagnostics,
                config.getBackgroundThreads(), config.getMaxQueuedJobs());

        LOGGER.config(MessageFormat.format(TelemetryDiagnostics.L10N.getString("telemetry.started"),
                resource.getServiceName(), config));
    }

    /**
     * Returns the tracer for a component. The same tracer is returned for
     * the same name.
     *
     * @param name the component name, used as instrumentation scope
     * @return the tracer
     */
    public Tracer getTracer(String name) {
        Tracer tracer = tracers.get(name);
        if (tracer == null) {
            tracer = new Tracer(name, propagator, exporter, diagnostics, issuedSpanIds,
                    config.isTracesEnabled());
            Tracer existing = tracers.putIfAbsent(name, tracer);
            if (existing != null) {
                tracer = existing;
            }
        }
        return tracer;
    }

    public Meter getMeter() {
        return meter;
    }

    public MetricAggregator getAggregator() {
        return aggregator;
    }

    public ContextPropagator getPropagator() {
        return propagator;
    }

    public BackgroundTaskBridge getBackgroundTasks() {
        return backgroundTasks;
    }

    public TelemetryDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public Resource getResource() {
        return resource;
    }

    BatchSpanExporter getExporter() {
        return exporter;
    }

    /**
     * Exports every span ended so far and waits for it, up to the
     * configured timeout.
     *
     * @return true if the flush completed in time
     */
    public boolean flush() {
        return exporter.flush();
    }

    /**
     * Reduces pending observations and renders all metrics in the
     * Prometheus text format.
     *
     * @return the exposition text
     */
    public String scrapeMetrics() {
        return TextExposition.render(resource, aggregator.pull());
    }

    // -- Shutdown handling --

    /**
     * Registers a JVM shutdown hook that shuts this pipeline down, so
     * that pending telemetry is exported before the JVM terminates.
     */
    public void registerShutdownHook() {
        if (shutdownHookRegistered) {
            return;
        }
        shutdownHookRegistered = true;

        final Telemetry telemetry = this;
        Thread shutdownHook = new Thread(new Runnable() {
            @Override
            public void run() {
                telemetry.shutdown();
            }
        }, "TelemetryShutdownHook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Shuts the pipeline down. Background jobs are given the configured
     * timeout to finish, then ended spans get a final bounded flush and
     * pending observations a final reduction.
     */
    public void shutdown() {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;

        backgroundTasks.shutdown(config.getTimeoutMs());
        exporter.shutdown();
        aggregator.shutdown();
        LOGGER.config(MessageFormat.format(TelemetryDiagnostics.L10N.getString("telemetry.stopped"),
                resource.getServiceName(), diagnostics));
    }

    /**
     * Returns true if shutdown has been initiated.
     */
    public boolean isShuttingDown() {
        return shuttingDown;
    }

    @Override
    public String toString() {
        return "Telemetry[" + resource.getServiceName() + ", " + diagnostics + "]";
    }

}
