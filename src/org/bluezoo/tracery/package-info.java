/*
 * package-info.java
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

/**
 * Causally-correct tracing for concurrent and asynchronous services.
 *
 * <p>A {@link org.bluezoo.tracery.Telemetry} is built once per process
 * from a {@link org.bluezoo.tracery.TelemetryConfig}. Components obtain a
 * {@link org.bluezoo.tracery.Tracer} from it and open
 * {@link org.bluezoo.tracery.Span}s, which parent themselves on the span
 * current in the executing task.
 *
 * <h2>Context propagation</h2>
 *
 * <p>The current span is held by a {@link org.bluezoo.tracery.Context}
 * that the {@link org.bluezoo.tracery.ContextPropagator} binds to the
 * executing task only for the duration of a scope. Any hand-off to
 * another task carries the context explicitly:
 *
 * <pre>
 * Context ctx = propagator.current();
 * executor.execute(propagator.wrap(ctx, task));
 *
 * DetachedHandle handle = propagator.detach();
 * telemetry.getBackgroundTasks().enqueue(handle, "reindex", job);
 * </pre>
 *
 * <h2>Failure policy</h2>
 *
 * <p>Telemetry never fails the code it observes. API misuse, dropped
 * spans and export failures are logged and counted by
 * {@link org.bluezoo.tracery.TelemetryDiagnostics}; the only exception
 * thrown at a call site is
 * {@link org.bluezoo.tracery.metrics.InvalidObservationException} for an
 * invalid metric value.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.tracery;
