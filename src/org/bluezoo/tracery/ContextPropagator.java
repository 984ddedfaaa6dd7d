/*
 * ContextPropagator.java
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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Carries the active span identity across scopes, suspension points and
 * task hand-offs.
 *
 * <p>A context is bound only to the thread that is executing a task, and
 * only for the duration of a scope. Work handed to another task, whether
 * a continuation on a shared executor or a job on a background pool,
 * receives its context explicitly through one of the {@code wrap}
 * methods, {@link #propagating(Executor)} or a {@link DetachedHandle}.
 * A continuation therefore always runs with the context of the task that
 * scheduled it, whichever worker thread picks it up, and cooperative
 * tasks interleaved on one thread never see each other's spans.
 *
 * <pre>
 * Context ctx = propagator.current();
 * propagator.supplyAsync(ctx, loader, pool)
 *     .thenAcceptAsync(rows -&gt; propagator.withContext(ctx, () -&gt; render(rows)), pool);
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContextPropagator {

    private final ThreadLocal<Scope> binding = new ThreadLocal<Scope>();
    private final TelemetryDiagnostics diagnostics;

    public ContextPropagator(TelemetryDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Returns the context bound to the executing task, or the empty
     * context.
     */
    public Context current() {
        Scope scope = bound();
        return scope != null ? scope.getContext() : Context.root();
    }

    /**
     * Returns the innermost open scope of this thread. Scopes closed
     * from another thread are unwound here, on the owning thread.
     */
    private Scope bound() {
        Scope scope = binding.get();
        if (scope != null && scope.isClosed()) {
            scope = scope.openPredecessor();
            if (scope == null) {
                binding.remove();
            } else {
                binding.set(scope);
            }
        }
        return scope;
    }

    /**
     * Returns the span context of the active span, or null.
     */
    public SpanContext currentSpanContext() {
        return current().getSpanContext();
    }

    /**
     * Binds a context until the returned scope is closed.
     *
     * @param context the context to make current
     * @return the scope guarding the binding
     */
    public Scope attach(Context context) {
        if (context == null) {
            context = Context.root();
        }
        Scope scope = new Scope(this, context, bound());
        binding.set(scope);
        return scope;
    }

    void restore(Scope scope, boolean reportForeign) {
        scope.markClosed();
        Thread owner = scope.getOwner();
        if (owner != Thread.currentThread()) {
            // The owning thread unwinds the binding on its next access
            if (reportForeign) {
                diagnostics.usageError("usage.scope_foreign_thread", scope.getContext(), owner.getName());
            }
            return;
        }
        Scope bound = binding.get();
        if (bound != scope) {
            if (!encloses(scope, bound)) {
                // Already unwound when an enclosing scope was closed
                return;
            }
            if (hasOpenScopeWithin(scope, bound)) {
                diagnostics.usageError("usage.scope_out_of_order", scope.getContext());
            }
        }
        Scope restored = scope.openPredecessor();
        if (restored == null) {
            binding.remove();
        } else {
            binding.set(restored);
        }
    }

    private static boolean hasOpenScopeWithin(Scope outer, Scope inner) {
        for (Scope s = inner; s != outer; s = s.getPrevious()) {
            if (!s.isClosed()) {
                return true;
            }
        }
        return false;
    }

    private static boolean encloses(Scope outer, Scope inner) {
        for (Scope s = inner; s != null; s = s.getPrevious()) {
            if (s == outer) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs a callable with the given context current, restoring the
     * previous context however the callable exits.
     *
     * @param context the context
     * @param fn the scope body
     * @return the result of the body
     * @throws Exception whatever the body throws
     */
    public <T> T withContext(Context context, Callable<T> fn) throws Exception {
        try (Scope scope = attach(context)) {
            return fn.call();
        }
    }

    /**
     * Runs a runnable with the given context current.
     */
    public void withContext(Context context, Runnable fn) {
        try (Scope scope = attach(context)) {
            fn.run();
        }
    }

    /**
     * Returns a runnable that runs {@code task} with {@code context}
     * current, on whatever thread eventually executes it.
     */
    public Runnable wrap(final Context context, final Runnable task) {
        return new Runnable() {
            @Override
            public void run() {
                withContext(context, task);
            }
        };
    }

    /**
     * Returns a callable that runs {@code task} with {@code context}
     * current.
     */
    public <T> Callable<T> wrap(final Context context, final Callable<T> task) {
        return new Callable<T>() {
            @Override
            public T call() throws Exception {
                return withContext(context, task);
            }
        };
    }

    /**
     * Returns a supplier that runs {@code task} with {@code context}
     * current.
     */
    public <T> Supplier<T> wrapSupplier(final Context context, final Supplier<T> task) {
        return new Supplier<T>() {
            @Override
            public T get() {
                try (Scope scope = attach(context)) {
                    return task.get();
                }
            }
        };
    }

    /**
     * Captures the current context now and returns a runnable that
     * re-establishes it when run.
     */
    public Runnable wrap(Runnable task) {
        return wrap(current(), task);
    }

    /**
     * Returns an executor that captures the submitter's context for each
     * task and runs the task under it.
     */
    public Executor propagating(final Executor executor) {
        return new Executor() {
            @Override
            public void execute(Runnable command) {
                executor.execute(wrap(current(), command));
            }
        };
    }

    /**
     * Like {@link CompletableFuture#supplyAsync(Supplier, Executor)}, with
     * the supplier running under an explicit context.
     */
    public <T> CompletableFuture<T> supplyAsync(Context context, Supplier<T> supplier, Executor executor) {
        return CompletableFuture.supplyAsync(wrapSupplier(context, supplier), executor);
    }

    /**
     * Captures the current span context for work that will run later on
     * a different schedule.
     */
    public DetachedHandle detach() {
        return detach(current());
    }

    /**
     * Captures the span context of an explicit context.
     */
    public DetachedHandle detach(Context context) {
        return new DetachedHandle(context != null ? context.getSpanContext() : null);
    }

    /**
     * Returns the W3C traceparent value for a context, or null if the
     * context has no active span.
     */
    public String inject(Context context) {
        SpanContext spanContext = context != null ? context.getSpanContext() : null;
        return spanContext != null ? spanContext.toTraceparent() : null;
    }

    /**
     * Parses a W3C traceparent value into a remote parent context.
     * An absent or invalid header yields the empty context, so the next
     * span starts a new trace.
     */
    public Context extract(String traceparent) {
        return Context.of(SpanContext.fromTraceparent(traceparent));
    }

}
