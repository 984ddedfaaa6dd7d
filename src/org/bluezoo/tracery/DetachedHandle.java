/*
 * DetachedHandle.java
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
 * A captured span context handed to work that runs on a different
 * schedule, such as a background job enqueued by a request that has
 * already returned. Only the identity crosses the boundary, never the
 * open span object itself.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ContextPropagator#detach()
 */
public final class DetachedHandle {

    private final SpanContext spanContext;

    DetachedHandle(SpanContext spanContext) {
        this.spanContext = spanContext;
    }

    /**
     * Returns the context to re-establish when the detached work runs.
     */
    public Context getContext() {
        return Context.of(spanContext);
    }

    /**
     * Returns the captured span context, or null if nothing was active
     * when the handle was created.
     */
    public SpanContext getSpanContext() {
        return spanContext;
    }

    @Override
    public String toString() {
        return "DetachedHandle[" + spanContext + "]";
    }

}
