/*
 * BlockingSpanExporter.java
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

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Span sink for tests that blocks every export until released.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BlockingSpanExporter implements SpanExporter {

    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final RecordingSpanExporter delegate = new RecordingSpanExporter();

    @Override
    public void export(Resource resource, List<SpanData> spans) throws ExportException {
        entered.countDown();
        try {
            release.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportException("interrupted", e);
        }
        delegate.export(resource, spans);
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    public boolean awaitEntered(long timeoutMs) throws InterruptedException {
        return entered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void release() {
        release.countDown();
    }

    public RecordingSpanExporter getDelegate() {
        return delegate;
    }

}
