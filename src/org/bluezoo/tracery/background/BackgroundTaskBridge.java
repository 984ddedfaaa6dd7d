/*
 * BackgroundTaskBridge.java
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

package org.bluezoo.tracery.background;

import org.bluezoo.tracery.ContextPropagator;
import org.bluezoo.tracery.DetachedHandle;
import org.bluezoo.tracery.TelemetryDiagnostics;

import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs work after the request that scheduled it has returned, on the
 * bridge's own worker pool, under the trace identity captured when the
 * work was scheduled.
 *
 * <p>The enqueuer captures its context with
 * {@link ContextPropagator#detach()} and hands the resulting
 * {@link DetachedHandle} over with the job. When a worker picks the job
 * up, the handle's context is made current for the duration of the job,
 * so spans the job opens join the original trace even though the
 * request span has long been closed and exported. The job's failures
 * are logged and counted here; the enqueuer never observes them.
 *
 * <pre>
 * DetachedHandle handle = propagator.detach();
 * bridge.enqueue(handle, "reindex", new Runnable() {
 *     public void run() {
 *         tracer.inSpan("background.job", ...);
 *     }
 * });
 * return response;
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BackgroundTaskBridge {

    private static final Logger LOGGER = Logger.getLogger(BackgroundTaskBridge.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.tracery.background.L10N");

    private final ContextPropagator propagator;
    private final TelemetryDiagnostics diagnostics;
    private final ExecutorService workers;
    private final LongAdder completedJobs;

    /**
     * Creates a bridge with its worker pool.
     *
     * @param propagator the propagator used to bind job contexts
     * @param diagnostics where failed jobs are counted
     * @param threads the number of worker threads
     * @param maxQueuedJobs how many jobs may wait for a worker
     */
    public BackgroundTaskBridge(ContextPropagator propagator, TelemetryDiagnostics diagnostics,
                                int threads, int maxQueuedJobs) {
        this.propagator = propagator;
        this.diagnostics = diagnostics;
        int poolSize = Math.max(1, threads);
        this.workers = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<Runnable>(Math.max(1, maxQueuedJobs)), new WorkerThreadFactory());
        this.completedJobs = new LongAdder();
    }

    /**
     * Schedules a job under the context of a handle and returns at once.
     *
     * @param handle the captured trace identity
     * @param job the job
     * @return false if the bridge has been shut down and the job was not
     * accepted
     */
    public boolean enqueue(DetachedHandle handle, Runnable job) {
        return enqueue(handle, "background", job);
    }

    /**
     * Schedules a named job under the context of a handle and returns at
     * once. The name appears in log messages about the job.
     *
     * @param handle the captured trace identity
     * @param jobName the job name
     * @param job the job
     * @return false if the job was not accepted, because the bridge has
     * been shut down or its job queue is full
     */
    public boolean enqueue(DetachedHandle handle, String jobName, Runnable job) {
        if (handle == null) {
            handle = propagator.detach(null);
        }
        try {
            workers.execute(new Job(handle, jobName, job));
            return true;
        } catch (RejectedExecutionException e) {
            if (workers.isShutdown()) {
                diagnostics.usageError("usage.enqueue_after_shutdown", jobName);
            } else {
                diagnostics.backgroundJobRejected(jobName);
            }
            return false;
        }
    }

    /**
     * Schedules a named job under the context current in the caller.
     *
     * @param jobName the job name
     * @param job the job
     * @return false if the job was not accepted
     */
    public boolean enqueue(String jobName, Runnable job) {
        return enqueue(propagator.detach(), jobName, job);
    }

    /**
     * Returns the number of jobs that have run to completion, including
     * failed ones.
     */
    public long getCompletedJobs() {
        return completedJobs.sum();
    }

    /**
     * Stops accepting jobs and waits for queued and running ones.
     *
     * @param timeoutMs the maximum time to wait, in milliseconds
     * @return true if every job finished within the timeout
     */
    public boolean shutdown(long timeoutMs) {
        workers.shutdown();
        try {
            boolean terminated = workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            if (!terminated) {
                LOGGER.warning(MessageFormat.format(L10N.getString("background.shutdown_timeout"), timeoutMs));
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * A queued job with the context it runs under.
     */
    private class Job implements Runnable {

        private final DetachedHandle handle;
        private final String name;
        private final Runnable body;

        Job(DetachedHandle handle, String name, Runnable body) {
            this.handle = handle;
            this.name = name;
            this.body = body;
        }

        @Override
        public void run() {
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest(MessageFormat.format(L10N.getString("background.job_started"), name, handle));
            }
            try {
                propagator.withContext(handle.getContext(), body);
            } catch (RuntimeException e) {
                diagnostics.backgroundJobFailed(name, e);
            } catch (Error e) {
                diagnostics.backgroundJobFailed(name, e);
                throw e;
            } finally {
                completedJobs.increment();
            }
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "BackgroundTaskBridge-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

}
