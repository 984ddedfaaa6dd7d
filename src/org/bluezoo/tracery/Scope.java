/*
 * Scope.java
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

/**
 * Binds a context to the current thread until closed.
 * Closing restores the binding that was in place when the scope was
 * opened. Use with try-with-resources so the restore happens on every
 * exit path.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Scope implements AutoCloseable {

    private final ContextPropagator propagator;
    private final Context context;
    private final Scope previous;
    private final Thread owner;
    private volatile boolean closed;

    Scope(ContextPropagator propagator, Context context, Scope previous) {
        this.propagator = propagator;
        this.context = context;
        this.previous = previous;
        this.owner = Thread.currentThread();
    }

    Context getContext() {
        return context;
    }

    Thread getOwner() {
        return owner;
    }

    Scope getPrevious() {
        return previous;
    }

    /**
     * Returns the nearest enclosing scope that is still open, or null.
     */
    Scope openPredecessor() {
        Scope scope = previous;
        while (scope != null && scope.closed) {
            scope = scope.previous;
        }
        return scope;
    }

    void markClosed() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * Closes this scope and restores the previous context.
     * Closing twice has no further effect. A close from a thread other
     * than the one that opened the scope is reported as a usage error;
     * the opening thread drops the binding the next time it reads or
     * attaches a context.
     */
    @Override
    public void close() {
        if (!closed) {
            propagator.restore(this, true);
        }
    }

    /**
     * Closes the scope a span was bound in when the span ends. A span
     * may legitimately end on another thread, such as in a completion
     * callback, so that case is not reported.
     */
    void release() {
        if (!closed) {
            propagator.restore(this, false);
        }
    }

}
