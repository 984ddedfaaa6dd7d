/*
 * TelemetryConfig.java
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

import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Telemetry configuration, set once at process start and then passed to
 * {@link Telemetry#Telemetry(TelemetryConfig)}.
 *
 * <p>Settings can be applied through the setters, from a properties file
 * with {@link #fromProperties(Properties)} (keys prefixed
 * {@code tracery.}), and from the standard OpenTelemetry environment
 * variables with {@link #applyEnvironment(Map)}.
 *
 * <pre>
 * tracery.service-name=items-service
 * tracery.service-version=1.2.0
 * tracery.deployment-environment=staging
 * tracery.batch-size=256
 * tracery.metrics-temporality=delta
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TelemetryConfig {

    private static final Logger LOGGER = Logger.getLogger(TelemetryConfig.class.getName());

    static final String PREFIX = "tracery.";

    // Feature flags
    private boolean tracesEnabled = true;
    private boolean metricsEnabled = true;

    // Resource attributes
    private String serviceName = "tracery";
    private String serviceVersion;
    private String serviceNamespace;
    private String serviceInstanceId;
    private String deploymentEnvironment;
    private final Map<String, String> resourceAttributes;

    // Export settings
    private int timeoutMs = 10000;
    private int batchSize = 512;
    private long flushIntervalMs = 5000;
    private int maxQueueSize = 2048;
    private int exportMaxRetries = 3;
    private long exportRetryBackoffMs = 100;

    // Metrics configuration
    private AggregationTemporality metricsTemporality = AggregationTemporality.CUMULATIVE;
    private long metricsIntervalMs = 60000;
    private int maxPendingObservations = 65536;

    // Background work
    private int backgroundThreads = 2;
    private int maxQueuedJobs = 1024;

    /**
     * Creates a new telemetry configuration with default values.
     */
    public TelemetryConfig() {
        this.resourceAttributes = new HashMap<String, String>();
    }

    /**
     * Creates a configuration from properties. Unknown keys are ignored;
     * a malformed number fails with {@link IllegalArgumentException}
     * naming the key.
     *
     * @param properties the properties
     * @return the configuration
     */
    public static TelemetryConfig fromProperties(Properties properties) {
        TelemetryConfig config = new TelemetryConfig();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                config.setProperty(name.substring(PREFIX.length()), properties.getProperty(name).trim());
            }
        }
        return config;
    }

    private void setProperty(String key, String value) {
        try {
            switch (key) {
                case "traces-enabled":
                    setTracesEnabled(Boolean.parseBoolean(value));
                    break;
                case "metrics-enabled":
                    setMetricsEnabled(Boolean.parseBoolean(value));
                    break;
                case "service-name":
                    setServiceName(value);
                    break;
                case "service-version":
                    setServiceVersion(value);
                    break;
                case "service-namespace":
                    setServiceNamespace(value);
                    break;
                case "service-instance-id":
                    setServiceInstanceId(value);
                    break;
                case "deployment-environment":
                    setDeploymentEnvironment(value);
                    break;
                case "resource-attributes":
                    parseResourceAttributes(value);
                    break;
                case "timeout-ms":
                    setTimeoutMs(Integer.parseInt(value));
                    break;
                case "batch-size":
                    setBatchSize(Integer.parseInt(value));
                    break;
                case "flush-interval-ms":
                    setFlushIntervalMs(Long.parseLong(value));
                    break;
                case "max-queue-size":
                    setMaxQueueSize(Integer.parseInt(value));
                    break;
                case "export-max-retries":
                    setExportMaxRetries(Integer.parseInt(value));
                    break;
                case "export-retry-backoff-ms":
                    setExportRetryBackoffMs(Long.parseLong(value));
                    break;
                case "metrics-temporality":
                    setMetricsTemporalityName(value);
                    break;
                case "metrics-interval-ms":
                    setMetricsIntervalMs(Long.parseLong(value));
                    break;
                case "max-pending-observations":
                    setMaxPendingObservations(Integer.parseInt(value));
                    break;
                case "background-threads":
                    setBackgroundThreads(Integer.parseInt(value));
                    break;
                case "max-queued-jobs":
                    setMaxQueuedJobs(Integer.parseInt(value));
                    break;
                default:
                    LOGGER.fine(MessageFormat.format(TelemetryDiagnostics.L10N.getString("config.unknown_property"),
                            PREFIX + key));
            }
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(TelemetryDiagnostics.L10N.getString("config.invalid_number"),
                    PREFIX + key, value);
            throw new IllegalArgumentException(msg, e);
        }
    }

    /**
     * Applies {@code OTEL_SERVICE_NAME} and {@code OTEL_RESOURCE_ATTRIBUTES}
     * from an environment map, usually {@code System.getenv()}. An
     * explicit service name wins over a {@code service.name} entry in the
     * resource attributes.
     *
     * @param environment the environment variables
     * @return this configuration
     */
    public TelemetryConfig applyEnvironment(Map<String, String> environment) {
        String attrs = environment.get("OTEL_RESOURCE_ATTRIBUTES");
        if (attrs != null) {
            parseResourceAttributes(attrs);
        }
        String name = environment.get("OTEL_SERVICE_NAME");
        if (name != null && !name.trim().isEmpty()) {
            setServiceName(name.trim());
        }
        return this;
    }

    private void parseResourceAttributes(String value) {
        for (String pair : value.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            String val = pair.substring(eq + 1).trim();
            if (Resource.SERVICE_NAME.equals(key)) {
                setServiceName(val);
            } else {
                addResourceAttribute(key, val);
            }
        }
    }

    // -- Feature flags --

    /**
     * Returns true if new traces are sampled and exported.
     */
    public boolean isTracesEnabled() {
        return tracesEnabled;
    }

    /**
     * Enables or disables trace export. Spans are still created and
     * propagated when disabled, but new traces are unsampled.
     *
     * @param tracesEnabled true to enable traces
     */
    public void setTracesEnabled(boolean tracesEnabled) {
        this.tracesEnabled = tracesEnabled;
    }

    /**
     * Returns true if periodic metrics collection is enabled.
     */
    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /**
     * Enables or disables periodic metrics collection. Pull-based
     * collection is always available.
     *
     * @param metricsEnabled true to enable the collection thread
     */
    public void setMetricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }

    // -- Resource attributes --

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        if (serviceName == null || serviceName.isEmpty()) {
            throw new IllegalArgumentException("serviceName cannot be empty");
        }
        this.serviceName = serviceName;
    }

    public String getServiceVersion() {
        return serviceVersion;
    }

    public void setServiceVersion(String serviceVersion) {
        this.serviceVersion = serviceVersion;
    }

    public String getServiceNamespace() {
        return serviceNamespace;
    }

    public void setServiceNamespace(String serviceNamespace) {
        this.serviceNamespace = serviceNamespace;
    }

    public String getServiceInstanceId() {
        return serviceInstanceId;
    }

    public void setServiceInstanceId(String serviceInstanceId) {
        this.serviceInstanceId = serviceInstanceId;
    }

    public String getDeploymentEnvironment() {
        return deploymentEnvironment;
    }

    public void setDeploymentEnvironment(String deploymentEnvironment) {
        this.deploymentEnvironment = deploymentEnvironment;
    }

    /**
     * Returns a copy of the additional resource attributes.
     */
    public Map<String, String> getResourceAttributes() {
        return new HashMap<String, String>(resourceAttributes);
    }

    /**
     * Adds a resource attribute.
     *
     * @param key the attribute key
     * @param value the attribute value
     */
    public void addResourceAttribute(String key, String value) {
        resourceAttributes.put(key, value);
    }

    // -- Span export --

    /**
     * Returns the bound on a flush, including the final flush at
     * shutdown, in milliseconds.
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    /**
     * Returns the number of buffered spans that triggers an export.
     */
    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Returns the maximum time a span waits in the buffer before export.
     */
    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    /**
     * Returns the capacity of the span buffer. Beyond it the oldest
     * span is dropped.
     */
    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public void setMaxQueueSize(int maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
    }

    /**
     * Returns how many times a failed batch is retried before it is
     * dropped.
     */
    public int getExportMaxRetries() {
        return exportMaxRetries;
    }

    public void setExportMaxRetries(int exportMaxRetries) {
        this.exportMaxRetries = exportMaxRetries;
    }

    /**
     * Returns the delay before the first retry; it doubles per attempt.
     */
    public long getExportRetryBackoffMs() {
        return exportRetryBackoffMs;
    }

    public void setExportRetryBackoffMs(long exportRetryBackoffMs) {
        this.exportRetryBackoffMs = exportRetryBackoffMs;
    }

    // -- Metrics --

    public AggregationTemporality getMetricsTemporality() {
        return metricsTemporality;
    }

    public void setMetricsTemporality(AggregationTemporality temporality) {
        this.metricsTemporality = temporality;
    }

    /**
     * Sets the temporality by name: "cumulative" or "delta".
     *
     * @param temporality the temporality name
     */
    public void setMetricsTemporalityName(String temporality) {
        if ("delta".equalsIgnoreCase(temporality)) {
            this.metricsTemporality = AggregationTemporality.DELTA;
        } else if ("cumulative".equalsIgnoreCase(temporality)) {
            this.metricsTemporality = AggregationTemporality.CUMULATIVE;
        } else {
            String msg = MessageFormat.format(TelemetryDiagnostics.L10N.getString("config.invalid_temporality"),
                    temporality);
            throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Returns the aggregation window length in milliseconds.
     */
    public long getMetricsIntervalMs() {
        return metricsIntervalMs;
    }

    public void setMetricsIntervalMs(long metricsIntervalMs) {
        this.metricsIntervalMs = metricsIntervalMs;
    }

    /**
     * Returns the capacity of the raw observation buffer between two
     * aggregation passes.
     */
    public int getMaxPendingObservations() {
        return maxPendingObservations;
    }

    public void setMaxPendingObservations(int maxPendingObservations) {
        this.maxPendingObservations = maxPendingObservations;
    }

    // -- Background work --

    public int getBackgroundThreads() {
        return backgroundThreads;
    }

    public void setBackgroundThreads(int backgroundThreads) {
        this.backgroundThreads = backgroundThreads;
    }

    /**
     * Returns how many background jobs may wait for a worker. Jobs
     * enqueued beyond this are rejected and counted.
     */
    public int getMaxQueuedJobs() {
        return maxQueuedJobs;
    }

    public void setMaxQueuedJobs(int maxQueuedJobs) {
        this.maxQueuedJobs = maxQueuedJobs;
    }

    @Override
    public String toString() {
        return "TelemetryConfig[serviceName=" + serviceName +
               ", tracesEnabled=" + tracesEnabled +
               ", metricsEnabled=" + metricsEnabled +
               ", batchSize=" + batchSize +
               ", flushIntervalMs=" + flushIntervalMs +
               ", metricsTemporality=" + metricsTemporality + "]";
    }

}
