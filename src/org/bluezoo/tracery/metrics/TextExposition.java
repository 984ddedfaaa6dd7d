/*
 * TextExposition.java
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

import org.bluezoo.tracery.Attribute;
import org.bluezoo.tracery.Resource;

import java.util.List;
import java.util.Map;

/**
 * Renders aggregated metrics in the Prometheus text exposition format.
 *
 * <p>Counters are rendered as {@code name_total}; histograms as
 * cumulative {@code name_bucket{le="..."}} lines followed by
 * {@code name_sum} and {@code name_count}. Every family is preceded by
 * its {@code # HELP} and {@code # TYPE} lines, and the resource is
 * rendered first as a {@code target_info} gauge. Instrument and
 * attribute names are mapped to the Prometheus character set by
 * replacing anything else with an underscore.
 *
 * <pre>
 * # HELP background_job_duration Background job duration
 * # TYPE background_job_duration histogram
 * background_job_duration_bucket{task_type="slow",le="1000.0"} 0
 * background_job_duration_bucket{task_type="slow",le="+Inf"} 3
 * background_job_duration_sum{task_type="slow"} 3600.4
 * background_job_duration_count{task_type="slow"} 3
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextExposition {

    /**
     * Content type of the rendered text.
     */
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private TextExposition() {
    }

    /**
     * Renders a published list of aggregates.
     *
     * @param resource the process identity, or null to omit target_info
     * @param metrics the aggregates, grouped by instrument name
     * @return the exposition text
     */
    public static String render(Resource resource, List<AggregatedMetric> metrics) {
        StringBuilder buf = new StringBuilder();
        if (resource != null) {
            renderTargetInfo(buf, resource);
        }
        String family = null;
        for (AggregatedMetric metric : metrics) {
            String base = metricName(metric.getName());
            if (metric.getKind() == InstrumentKind.COUNTER) {
                String sample = base.endsWith("_total") ? base : base + "_total";
                if (!metric.getName().equals(family)) {
                    header(buf, sample, metric.getDescription(), "counter");
                    family = metric.getName();
                }
                sample(buf, sample, labels(metric.getAttributes(), null), Long.toString(metric.getLongValue()));
            } else {
                if (!metric.getName().equals(family)) {
                    header(buf, base, metric.getDescription(), "histogram");
                    family = metric.getName();
                }
                renderHistogram(buf, base, metric);
            }
        }
        return buf.toString();
    }

    private static void renderTargetInfo(StringBuilder buf, Resource resource) {
        header(buf, "target_info", "Target metadata", "gauge");
        StringBuilder labels = new StringBuilder();
        for (Map.Entry<String, String> entry : resource.getAttributes().entrySet()) {
            appendLabel(labels, labelName(entry.getKey()), entry.getValue());
        }
        sample(buf, "target_info", labels.toString(), "1");
    }

    private static void renderHistogram(StringBuilder buf, String base, AggregatedMetric metric) {
        double[] bounds = metric.getBoundaries();
        long[] counts = metric.getBucketCounts();
        long cumulative = 0L;
        for (int i = 0; i < counts.length; i++) {
            cumulative += counts[i];
            String le = i < bounds.length ? formatDouble(bounds[i]) : "+Inf";
            sample(buf, base + "_bucket", labels(metric.getAttributes(), le), Long.toString(cumulative));
        }
        String labels = labels(metric.getAttributes(), null);
        sample(buf, base + "_sum", labels, formatDouble(metric.getSum()));
        sample(buf, base + "_count", labels, Long.toString(metric.getCount()));
    }

    private static void header(StringBuilder buf, String name, String help, String type) {
        buf.append("# HELP ").append(name).append(' ');
        buf.append(escapeHelp(help != null && !help.isEmpty() ? help : name)).append('\n');
        buf.append("# TYPE ").append(name).append(' ').append(type).append('\n');
    }

    private static void sample(StringBuilder buf, String name, String labels, String value) {
        buf.append(name);
        if (!labels.isEmpty()) {
            buf.append('{').append(labels).append('}');
        }
        buf.append(' ').append(value).append('\n');
    }

    private static String labels(Attributes attributes, String le) {
        StringBuilder labels = new StringBuilder();
        for (Attribute attr : attributes.asList()) {
            appendLabel(labels, labelName(attr.getKey()), attr.getValueAsString());
        }
        if (le != null) {
            appendLabel(labels, "le", le);
        }
        return labels.toString();
    }

    private static void appendLabel(StringBuilder labels, String name, String value) {
        if (labels.length() > 0) {
            labels.append(',');
        }
        labels.append(name).append("=\"").append(escapeLabelValue(value)).append('"');
    }

    /**
     * Maps an instrument name to a valid metric name.
     */
    static String metricName(String name) {
        return sanitize(name, true);
    }

    /**
     * Maps an attribute key to a valid label name.
     */
    static String labelName(String key) {
        return sanitize(key, false);
    }

    private static String sanitize(String name, boolean allowColon) {
        StringBuilder buf = new StringBuilder(name.length() + 1);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
                    || (allowColon && c == ':') || (i > 0 && c >= '0' && c <= '9');
            if (valid) {
                buf.append(c);
            } else if (i == 0 && c >= '0' && c <= '9') {
                buf.append('_').append(c);
            } else {
                buf.append('_');
            }
        }
        return buf.toString();
    }

    static String escapeLabelValue(String value) {
        StringBuilder buf = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    buf.append("\\\\");
                    break;
                case '"':
                    buf.append("\\\"");
                    break;
                case '\n':
                    buf.append("\\n");
                    break;
                default:
                    buf.append(c);
            }
        }
        return buf.toString();
    }

    private static String escapeHelp(String help) {
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }

    static String formatDouble(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        return Double.toString(value);
    }

}
