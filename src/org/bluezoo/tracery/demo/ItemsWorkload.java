/*
 * ItemsWorkload.java
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

package org.bluezoo.tracery.demo;

import org.bluezoo.tracery.Context;
import org.bluezoo.tracery.ContextPropagator;
import org.bluezoo.tracery.DetachedHandle;
import org.bluezoo.tracery.Span;
import org.bluezoo.tracery.SpanKind;
import org.bluezoo.tracery.Telemetry;
import org.bluezoo.tracery.TelemetryConfig;
import org.bluezoo.tracery.Tracer;
import org.bluezoo.tracery.background.BackgroundTaskBridge;
import org.bluezoo.tracery.metrics.Attributes;
import org.bluezoo.tracery.metrics.DoubleHistogram;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * An items service workload instrumented end to end, in two modes.
 *
 * <p>{@link Mode#BOTTLENECKS} has a slow database call, runs its CPU
 * work on the request thread and has a slow background job.
 * {@link Mode#OPTIMIZED} has a faster database call, offloads a smaller
 * amount of CPU work to a worker executor and has a fast background job.
 * Both produce the same trace shapes and the same two histograms, so
 * their traces and metrics can be compared directly.
 *
 * <p>Request and job durations are read from the spans that measure
 * them; there is no second stopwatch.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ItemsWorkload {

    private static final Logger LOGGER = Logger.getLogger(ItemsWorkload.class.getName());

    static final String ROUTE = "/items/{item_id}";

    /**
     * The two variants of the workload.
     */
    public enum Mode {

        BOTTLENECKS("bottlenecks", "slow", 400L, 100L, 1200L, 7_000_000L),
        OPTIMIZED("optimized", "fast", 80L, 20L, 200L, 1_000_000L);

        private final String label;
        private final String taskType;
        final long dbQueryMs;
        final long postProcessingMs;
        final long backgroundJobMs;
        final long cpuIterations;

        Mode(String label, String taskType, long dbQueryMs, long postProcessingMs,
             long backgroundJobMs, long cpuIterations) {
            this.label = label;
            this.taskType = taskType;
            this.dbQueryMs = dbQueryMs;
            this.postProcessingMs = postProcessingMs;
            this.backgroundJobMs = backgroundJobMs;
            this.cpuIterations = cpuIterations;
        }

        public String getLabel() {
            return label;
        }

        /**
         * Returns the {@code task.type} attribute of background job
         * durations recorded in this mode.
         */
        public String getTaskType() {
            return taskType;
        }
    }

    private final Mode mode;
    private final Tracer tracer;
    private final ContextPropagator propagator;
    private final BackgroundTaskBridge backgroundTasks;
    private final Executor cpuExecutor;
    private final DoubleHistogram requestDuration;
    private final DoubleHistogram jobDuration;

    private long dbQueryMs;
    private long postProcessingMs;
    private long backgroundJobMs;
    private long cpuIterations;

    /**
     * Creates a workload.
     *
     * @param telemetry the telemetry pipeline
     * @param mode the variant
     * @param cpuExecutor where offloaded CPU work runs in optimized mode
     */
    public ItemsWorkload(Telemetry telemetry, Mode mode, Executor cpuExecutor) {
        this.mode = mode;
        this.tracer = telemetry.getTracer(ItemsWorkload.class.getName());
        this.propagator = telemetry.getPropagator();
        this.backgroundTasks = telemetry.getBackgroundTasks();
        this.cpuExecutor = cpuExecutor;
        this.requestDuration = telemetry.getMeter().histogramBuilder("http.server.request_duration")
                .setDescription("End-to-end request duration measured in handler")
                .setUnit("ms")
                .build();
        this.jobDuration = telemetry.getMeter().histogramBuilder("background.job.duration")
                .setDescription("Background job duration")
                .setUnit("ms")
                .build();
        this.dbQueryMs = mode.dbQueryMs;
        this.postProcessingMs = mode.postProcessingMs;
        this.backgroundJobMs = mode.backgroundJobMs;
        this.cpuIterations = mode.cpuIterations;
    }

    public Mode getMode() {
        return mode;
    }

    public void setDbQueryMs(long dbQueryMs) {
        this.dbQueryMs = dbQueryMs;
    }

    public void setPostProcessingMs(long postProcessingMs) {
        this.postProcessingMs = postProcessingMs;
    }

    public void setBackgroundJobMs(long backgroundJobMs) {
        this.backgroundJobMs = backgroundJobMs;
    }

    public void setCpuIterations(long cpuIterations) {
        this.cpuIterations = cpuIterations;
    }

    /**
     * Handles a request for an item.
     *
     * @param itemId the item ID
     * @return the response body
     * @throws InterruptedException if the request thread is interrupted
     * @throws ExecutionException if offloaded CPU work fails
     */
    public Map<String, Object> getItem(long itemId) throws InterruptedException, ExecutionException {
        Span span = tracer.startSpan("handler.get_item", SpanKind.SERVER);
        span.setAttribute("item.id", itemId);
        try {
            queryDatabase();
            if (mode == Mode.BOTTLENECKS) {
                cpuWorkBlocking();
            } else {
                cpuWorkOffloaded();
            }
            postProcess();
        } catch (InterruptedException e) {
            span.cancel();
            throw e;
        } catch (ExecutionException e) {
            span.recordError(e.getCause() != null ? e.getCause() : e);
            throw e;
        } catch (RuntimeException e) {
            span.recordError(e);
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
        requestDuration.record(span.getData().getDurationMillis(), Attributes.of("route", ROUTE));

        Map<String, Object> response = new LinkedHashMap<String, Object>();
        response.put("item_id", itemId);
        response.put("status", "ok");
        response.put("mode", mode.getLabel());
        return response;
    }

    private void queryDatabase() throws InterruptedException {
        Span span = tracer.startSpan("db.query", SpanKind.CLIENT);
        try {
            Thread.sleep(dbQueryMs);
        } catch (InterruptedException e) {
            span.cancel();
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
    }

    private void cpuWorkBlocking() {
        Span span = tracer.startSpan("cpu.work.blocking");
        try {
            burn(cpuIterations);
        } finally {
            span.end();
        }
    }

    private void cpuWorkOffloaded() throws InterruptedException, ExecutionException {
        Span span = tracer.startSpan("cpu.work.offloaded");
        try {
            Context context = propagator.current();
            CompletableFuture<Long> work = propagator.supplyAsync(context, new Supplier<Long>() {
                @Override
                public Long get() {
                    Span worker = tracer.startSpan("cpu.work");
                    try {
                        return burn(cpuIterations);
                    } finally {
                        worker.end();
                    }
                }
            }, cpuExecutor);
            work.get();
        } catch (InterruptedException e) {
            span.cancel();
            throw e;
        } catch (ExecutionException e) {
            span.recordError(e.getCause() != null ? e.getCause() : e);
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
    }

    private void postProcess() throws InterruptedException {
        Span span = tracer.startSpan("post.processing");
        try {
            Thread.sleep(postProcessingMs);
        } catch (InterruptedException e) {
            span.cancel();
            throw e;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
    }

    static long burn(long iterations) {
        long total = 0L;
        for (long i = 0; i < iterations; i++) {
            total += i;
        }
        return total;
    }

    /**
     * Queues a background job for a task and returns at once. The job
     * runs in the trace of the caller's current span.
     *
     * @param taskId the task ID
     * @return the response body
     */
    public Map<String, Object> process(final String taskId) {
        DetachedHandle handle = propagator.detach();
        boolean queued = backgroundTasks.enqueue(handle, "background.job", new Runnable() {
            @Override
            public void run() {
                runBackgroundJob(taskId);
            }
        });

        Map<String, Object> response = new LinkedHashMap<String, Object>();
        response.put("status", queued ? "queued" : "rejected");
        response.put("task_id", taskId);
        response.put("mode", mode.getLabel());
        return response;
    }

    void runBackgroundJob(String taskId) {
        Span span = tracer.startSpan("background.job", SpanKind.CONSUMER);
        span.setAttribute("task.id", taskId);
        try {
            Thread.sleep(backgroundJobMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.cancel();
            return;
        } finally {
            if (!span.isEnded()) {
                span.end();
            }
        }
        jobDuration.record(span.getData().getDurationMillis(), Attributes.of("task.type", mode.getTaskType()));
    }

    /**
     * Runs a few requests and background jobs in the given mode and
     * prints the resulting metrics.
     *
     * @param args optional mode name, {@code bottlenecks} or {@code optimized}
     * @throws Exception if a request fails
     */
    public static void main(String[] args) throws Exception {
        Mode mode = args.length > 0 && "optimized".equalsIgnoreCase(args[0])
                ? Mode.OPTIMIZED : Mode.BOTTLENECKS;
        TelemetryConfig config = new TelemetryConfig();
        config.setServiceName("items-demo-" + mode.getLabel());
        config.applyEnvironment(System.getenv());
        Telemetry telemetry = new Telemetry(config);
        ExecutorService cpuPool = Executors.newFixedThreadPool(2);
        try {
            ItemsWorkload workload = new ItemsWorkload(telemetry, mode, cpuPool);
            Tracer server = telemetry.getTracer("items.server");
            for (int i = 1; i <= 3; i++) {
                workload.getItem(i);
                Span request = server.startSpan("POST /process/{task_id}", SpanKind.SERVER);
                try {
                    workload.process("task-" + i);
                } finally {
                    request.end();
                }
            }
        } finally {
            telemetry.shutdown();
            cpuPool.shutdown();
        }
        LOGGER.info(telemetry.getDiagnostics().toString());
        System.out.print(telemetry.scrapeMetrics());
    }

}
