/*
 * TelemetryDiagnostics.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Counts and logs every telemetry degradation.
 * Nothing reported here is ever thrown into application code: usage
 * errors, drops and export failures are absorbed, counted and logged.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TelemetryDiagnostics {

    private static final Logger LOGGER = Logger.getLogger(TelemetryDiagnostics.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.tracery.L10N");

    private final LongAdder usageErrors = new LongAdder();
    private final LongAdder invalidObservations = new LongAdder();
    private final LongAdder droppedSpans = new LongAdder();
    private final LongAdder exportFailures = new LongAdder();
    private final LongAdder droppedObservations = new LongAdder();
    private final LongAdder failedBackgroundJobs = new LongAdder();
    private final LongAdder rejectedBackgroundJobs = new LongAdder();

    /**
     * Reports API misuse. Execution continues.
     *
     * @param key the L10N message key
     * @param args the message arguments
     */
    public void usageError(String key, Object... args) {
        usageErrors.increment();
        if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.warning(MessageFormat.format(L10N.getString(key), args));
        }
    }

    /**
     * Reports a rejected metric observation.
     */
    public void invalidObservation(String instrumentName, Object value) {
        invalidObservations.increment();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("metrics.invalid_observation"),
                    instrumentName, value));
        }
    }

    /**
     * Reports spans that will never reach the exporter sink.
     *
     * @param count the number of spans lost
     * @param key the L10N message key describing why
     */
    public void spansDropped(int count, String key) {
        if (count <= 0) {
            return;
        }
        droppedSpans.add(count);
        Level level = "export.dropped_overflow".equals(key) ? Level.FINE : Level.WARNING;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, MessageFormat.format(L10N.getString(key), count));
        }
    }

    /**
     * Reports one failed export attempt.
     */
    public void exportFailed(int batchSize, int attempt, Exception cause) {
        exportFailures.increment();
        if (LOGGER.isLoggable(Level.WARNING)) {
            String msg = MessageFormat.format(L10N.getString("export.attempt_failed"),
                    batchSize, attempt, cause.getMessage());
            LOGGER.log(Level.WARNING, msg, cause);
        }
    }

    /**
     * Reports raw metric observations evicted from a full buffer.
     */
    public void observationsDropped(int count) {
        droppedObservations.add(count);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("metrics.dropped_overflow"), count));
        }
    }

    /**
     * Reports a background job that completed abruptly.
     */
    public void backgroundJobFailed(String jobName, Throwable cause) {
        failedBackgroundJobs.increment();
        if (LOGGER.isLoggable(Level.WARNING)) {
            String msg = MessageFormat.format(L10N.getString("background.job_failed"), jobName);
            LOGGER.log(Level.WARNING, msg, cause);
        }
    }

    /**
     * Reports a background job discarded because the job queue was full.
     */
    public void backgroundJobRejected(String jobName) {
        rejectedBackgroundJobs.increment();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("background.job_rejected"), jobName));
        }
    }

    public long getUsageErrors() {
        return usageErrors.sum();
    }

    public long getInvalidObservations() {
        return invalidObservations.sum();
    }

    public long getDroppedSpans() {
        return droppedSpans.sum();
    }

    public long getExportFailures() {
        return exportFailures.sum();
    }

    public long getDroppedObservations() {
        return droppedObservations.sum();
    }

    public long getFailedBackgroundJobs() {
        return failedBackgroundJobs.sum();
    }

    public long getRejectedBackgroundJobs() {
        return rejectedBackgroundJobs.sum();
    }

    @Override
    public String toString() {
        return "TelemetryDiagnostics[usageErrors=" + getUsageErrors() +
               ", invalidObservations=" + getInvalidObservations() +
               ", droppedSpans=" + getDroppedSpans() +
               ", exportFailures=" + getExportFailures() +
               ", droppedObservations=" + getDroppedObservations() +
               ", failedBackgroundJobs=" + getFailedBackgroundJobs() +
               ", rejectedBackgroundJobs=" + getRejectedBackgroundJobs() + "]";
    }

}
