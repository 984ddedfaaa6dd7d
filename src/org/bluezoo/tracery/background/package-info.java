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
 * Background work that outlives the request that scheduled it.
 *
 * <p>{@link org.bluezoo.tracery.background.BackgroundTaskBridge} runs
 * jobs on its own worker pool under a
 * {@link org.bluezoo.tracery.DetachedHandle} captured by the enqueuer, so
 * spans opened by a job stay in the trace of the request even when the
 * job starts after the request span has been exported.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.tracery.background;
