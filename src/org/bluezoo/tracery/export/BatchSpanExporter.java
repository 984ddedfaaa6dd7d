/*
 * BatchSpanExporter.java
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
import org.bluezoo.tracery.TelemetryConfig;
import org.bluezoo.tracery.TelemetryDiagnostics;

import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers finished spans and exports them in batches on a background
 * thread, so the latency or unavailability of the sink never reaches
 * the code that ends spans.
 *
 * <p>The buffer is bounded. When it is full the oldest span is evicted
 * and counted as dropped; {@link #submit} never waits for anything but
 * the buffer lock. Batches are exported when the buffer reaches the
 * batch size or when the flush interval expires, whichever is first.
 * A failed batch is retried with exponential backoff a bounded number
 * of times, then dropped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BatchSpanExporter {

    private static final Logger LOGGER = Logger.getLogger(BatchSpanExporter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.tracery.export.L10N");

    private static final long MAX_BACKOFF_MS = 5000L;

    private final SpanExporter sink;
    private final Resource resource;
    private final TelemetryDiagnostics diagnostics;

    private final int batchSize;
    private final int maxQueueSize;
    private final long flushIntervalMs;
    private final long timeoutMs;
    private final int maxRetries;
    private final long retryBackoffMs;

    private final Deque<SpanData> buffer;
    private final Lock lock;
    private final Condition workAvailable;
    private final Condition flushDone;
    private long flushRequested;
    private long flushCompleted;
    private boolean running;

    private final LongAdder exportedSpans;
    private final ExportThread exportThread;

    /**
     * Creates a batch exporter and starts its export thread.
     *
     * @param sink the exporter receiving batches
     * @param resource the process identity attached to every batch
     * @param config batching, retry and timeout settings
     * @param diagnostics where drops and failures are counted
     */
    public BatchSpanExporter(SpanExporter sink, Resource resource, TelemetryConfig config,
                             TelemetryDiagnostics diagnostics) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
        this.resource = resource;
        this.diagnostics = diagnostics;
        this.batchSize = Math.max(1, config.getBatchSize());
        this.maxQueueSize = Math.max(batchSize, config.getMaxQueueSize());
        this.flushIntervalMs = Math.max(1L, config.getFlushIntervalMs());
        this.timeoutMs = config.getTimeoutMs();
        this.maxRetries = Math.max(0, config.getExportMaxRetries());
        this.retryBackoffMs = Math.max(1L, config.getExportRetryBackoffMs());

        this.buffer = new ArrayDeque<SpanData>();
        this.lock = new ReentrantLock();
        this.workAvailable = lock.newCondition();
        this.flushDone = lock.newCondition();
        this.exportedSpans = new LongAdder();
        this.running = true;

        this.exportThread = new ExportThread();
        this.exportThread.start();
    }

    /**
     * Enqueues a finished span for export.
     *
     * @param span the span
     */
    public void submit(SpanData span) {
        if (span == null) {
            return;
        }
        boolean evicted = false;
        boolean accepted;
        lock.lock();
        try {
            accepted = running;
            if (accepted) {
                if (buffer.size() >= maxQueueSize) {
                    buffer.pollFirst();
                    evicted = true;
                }
                buffer.addLast(span);
                if (buffer.size() >= batchSize) {
                    workAvailable.signal();
                }
            }
        } finally {
            lock.unlock();
        }
        if (!accepted) {
            diagnostics.spansDropped(1, "export.dropped_after_shutdown");
        } else if (evicted) {
            diagnostics.spansDropped(1, "export.dropped_overflow");
        }
    }

    /**
     * Exports everything buffered now and waits for it, up to the
     * configured timeout.
     *
     * @return true if the flush completed within the timeout
     */
    public boolean flush() {
        return flush(timeoutMs);
    }

    /**
     * Exports everything buffered now and waits for it.
     *
     * @param timeout the maximum time to wait, in milliseconds
     * @return true if the flush completed within the timeout
     */
    public boolean flush(long timeout) {
        lock.lock();
        try {
            if (!running) {
                return buffer.isEmpty();
            }
            long ticket = ++flushRequested;
            workAvailable.signal();
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeout);
            while (flushCompleted < ticket) {
                if (remaining <= 0L) {
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine(MessageFormat.format(L10N.getString("export.flush_timeout"), timeout));
                    }
                    return false;
                }
                remaining = flushDone.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting spans, makes a final attempt to export the buffer
     * within the configured timeout, and shuts the sink down. Spans that
     * could not be exported in time are counted as dropped.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            workAvailable.signal();
        } finally {
            lock.unlock();
        }
        try {
            exportThread.join(Math.max(1L, timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (exportThread.isAlive()) {
            exportThread.interrupt();
        }
        int remaining;
        lock.lock();
        try {
            remaining = buffer.size();
            buffer.clear();
            flushCompleted = flushRequested;
            flushDone.signalAll();
        } finally {
            lock.unlock();
        }
        diagnostics.spansDropped(remaining, "export.dropped_shutdown_timeout");
        sink.shutdown();
    }

    /**
     * Returns the number of spans currently waiting for export.
     */
    public int getBufferedSpans() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of spans the sink has accepted.
     */
    public long getExportedSpans() {
        return exportedSpans.sum();
    }

    private void exportBatch(List<SpanData> batch) {
        long backoff = retryBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                sink.export(resource, batch);
                exportedSpans.add(batch.size());
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Exported batch of " + batch.size() + " spans");
                }
                return;
            } catch (ExportException | RuntimeException e) {
                diagnostics.exportFailed(batch.size(), attempt, e);
            }
            if (attempt > maxRetries) {
                break;
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            backoff = Math.min(backoff * 2L, MAX_BACKOFF_MS);
        }
        diagnostics.spansDropped(batch.size(), "export.dropped_failed");
    }

    /**
     * Background thread that batches and exports spans.
     */
    private class ExportThread extends Thread {

        ExportThread() {
            super("BatchSpanExporter");
            setDaemon(true);
        }

        @Override
        public void run() {
            long lastExport = System.currentTimeMillis();
            while (true) {
                List<SpanData> batch = new ArrayList<SpanData>();
                long flushTicket;
                boolean stopping;
                boolean drainAll;
                lock.lock();
                try {
                    long deadline = lastExport + flushIntervalMs;
                    while (running && buffer.size() < batchSize && flushRequested == flushCompleted) {
                        long wait = deadline - System.currentTimeMillis();
                        if (wait <= 0L) {
                            break;
                        }
                        workAvailable.await(wait, TimeUnit.MILLISECONDS);
                    }
                    stopping = !running;
                    flushTicket = flushRequested;
                    drainAll = stopping || flushTicket != flushCompleted;
                    drain(batch, drainAll ? buffer.size() : batchSize);
                } catch (InterruptedException e) {
                    if (!isStopping()) {
                        continue;
                    }
                    return;
                } finally {
                    lock.unlock();
                }

                for (int i = 0; i < batch.size(); i += batchSize) {
                    exportBatch(batch.subList(i, Math.min(batch.size(), i + batchSize)));
                }
                lastExport = System.currentTimeMillis();

                if (drainAll) {
                    lock.lock();
                    try {
                        if (flushCompleted < flushTicket) {
                            flushCompleted = flushTicket;
                        }
                        flushDone.signalAll();
                    } finally {
                        lock.unlock();
                    }
                }
                if (stopping || isInterrupted()) {
                    return;
                }
            }
        }

        private void drain(List<SpanData> batch, int max) {
            SpanData span;
            while (batch.size() < max && (span = buffer.pollFirst()) != null) {
                batch.add(span);
            }
        }

        private boolean isStopping() {
            lock.lock();
            try {
                return !running;
            } finally {
                lock.unlock();
            }
        }
    }

}
