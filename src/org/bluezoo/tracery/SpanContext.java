/*
 * SpanContext.java
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

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Immutable identity of a span within a trace.
 * This is the unit that crosses scope, task and process boundaries:
 * trace ID, span ID, the parent's span ID (if any) and the sampled flag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SpanContext {

    /**
     * Trace ID size in bytes (128-bit).
     */
    public static final int TRACE_ID_LENGTH = 16;

    /**
     * Span ID size in bytes (64-bit).
     */
    public static final int SPAN_ID_LENGTH = 8;

    /**
     * Trace flag indicating the trace is sampled.
     */
    public static final int FLAG_SAMPLED = 0x01;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    private final byte[] traceId;
    private final byte[] spanId;
    private final byte[] parentSpanId;
    private final boolean sampled;
    private final boolean remote;

    /**
     * Creates a span context with the given identifiers.
     *
     * @param traceId the 16-byte trace ID
     * @param spanId the 8-byte span ID
     * @param parentSpanId the 8-byte parent span ID, or null for a root
     * @param sampled whether this trace is sampled
     * @param remote whether this context was received from another process
     */
    public SpanContext(byte[] traceId, byte[] spanId, byte[] parentSpanId,
                       boolean sampled, boolean remote) {
        if (traceId == null || traceId.length != TRACE_ID_LENGTH) {
            throw new IllegalArgumentException("traceId must be 16 bytes");
        }
        if (spanId == null || spanId.length != SPAN_ID_LENGTH) {
            throw new IllegalArgumentException("spanId must be 8 bytes");
        }
        if (parentSpanId != null && parentSpanId.length != SPAN_ID_LENGTH) {
            throw new IllegalArgumentException("parentSpanId must be 8 bytes");
        }
        if (isZero(traceId) || isZero(spanId)) {
            throw new IllegalArgumentException("trace and span IDs must not be all zero");
        }
        this.traceId = traceId.clone();
        this.spanId = spanId.clone();
        this.parentSpanId = parentSpanId != null ? parentSpanId.clone() : null;
        this.sampled = sampled;
        this.remote = remote;
    }

    /**
     * Creates the context of a new root span with a fresh trace ID.
     *
     * @param sampled whether the new trace is sampled
     */
    public static SpanContext newRoot(boolean sampled) {
        return new SpanContext(randomId(TRACE_ID_LENGTH), randomId(SPAN_ID_LENGTH), null, sampled, false);
    }

    /**
     * Creates the context of a new child of this span.
     * The child shares the trace ID and sampled flag.
     */
    public SpanContext newChild() {
        return new SpanContext(traceId, randomId(SPAN_ID_LENGTH), spanId, sampled, false);
    }

    static byte[] randomId(int length) {
        byte[] id = new byte[length];
        do {
            RANDOM.nextBytes(id);
        } while (isZero(id));
        return id;
    }

    private static boolean isZero(byte[] id) {
        for (byte b : id) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of the trace ID bytes.
     */
    public byte[] getTraceId() {
        return traceId.clone();
    }

    /**
     * Returns a copy of the span ID bytes.
     */
    public byte[] getSpanId() {
        return spanId.clone();
    }

    /**
     * Returns a copy of the parent span ID bytes, or null for a root span.
     */
    public byte[] getParentSpanId() {
        return parentSpanId != null ? parentSpanId.clone() : null;
    }

    public boolean hasParent() {
        return parentSpanId != null;
    }

    public boolean isSampled() {
        return sampled;
    }

    /**
     * Returns true if this context was extracted from another process
     * rather than created by a local tracer.
     */
    public boolean isRemote() {
        return remote;
    }

    /**
     * Returns the trace ID as a lowercase hexadecimal string.
     */
    public String getTraceIdHex() {
        return bytesToHex(traceId);
    }

    /**
     * Returns the span ID as a lowercase hexadecimal string.
     */
    public String getSpanIdHex() {
        return bytesToHex(spanId);
    }

    /**
     * Returns the parent span ID as hex, or null for a root span.
     */
    public String getParentSpanIdHex() {
        return parentSpanId != null ? bytesToHex(parentSpanId) : null;
    }

    /**
     * Returns true if this context belongs to the same trace as another.
     */
    public boolean sameTrace(SpanContext other) {
        return other != null && Arrays.equals(traceId, other.traceId);
    }

    /**
     * Returns the W3C traceparent header value.
     * Format: 00-{traceId}-{spanId}-{flags}
     */
    public String toTraceparent() {
        int flags = sampled ? FLAG_SAMPLED : 0;
        StringBuilder sb = new StringBuilder(55);
        sb.append("00-");
        sb.append(getTraceIdHex());
        sb.append('-');
        sb.append(getSpanIdHex());
        sb.append('-');
        sb.append(HEX_CHARS[(flags >> 4) & 0x0F]);
        sb.append(HEX_CHARS[flags & 0x0F]);
        return sb.toString();
    }

    /**
     * Parses a W3C traceparent header value.
     * The result is a remote context: the span it names lives in the
     * caller's process.
     *
     * @param traceparent the header value
     * @return the parsed span context, or null if invalid
     */
    public static SpanContext fromTraceparent(String traceparent) {
        if (traceparent == null) {
            return null;
        }
        traceparent = traceparent.trim();
        if (traceparent.length() != 55) {
            return null;
        }
        // Format: 00-<32 hex traceId>-<16 hex spanId>-<2 hex flags>
        if (traceparent.charAt(2) != '-' || traceparent.charAt(35) != '-' || traceparent.charAt(52) != '-') {
            return null;
        }
        if (!"00".equals(traceparent.substring(0, 2))) {
            return null;
        }
        try {
            byte[] traceId = hexToBytes(traceparent.substring(3, 35));
            byte[] spanId = hexToBytes(traceparent.substring(36, 52));
            int flags = hexToBytes(traceparent.substring(53, 55))[0] & 0xFF;
            return new SpanContext(traceId, spanId, null, (flags & FLAG_SAMPLED) != 0, true);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String bytesToHex(byte[] bytes) {
        char[] result = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            result[i * 2] = HEX_CHARS[v >>> 4];
            result[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(result);
    }

    private static byte[] hexToBytes(String hex) {
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("Invalid hex string length");
        }
        byte[] result = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = hexValue(hex.charAt(i));
            int low = hexValue(hex.charAt(i + 1));
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("Invalid hex character");
            }
            result[i / 2] = (byte) ((high << 4) + low);
        }
        return result;
    }

    // Lowercase only, as in the header
    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SpanContext)) {
            return false;
        }
        SpanContext other = (SpanContext) obj;
        return Arrays.equals(traceId, other.traceId)
                && Arrays.equals(spanId, other.spanId)
                && Arrays.equals(parentSpanId, other.parentSpanId)
                && sampled == other.sampled
                && remote == other.remote;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(traceId) + Arrays.hashCode(spanId);
    }

    @Override
    public String toString() {
        return "SpanContext[traceId=" + getTraceIdHex() + ", spanId=" + getSpanIdHex() +
               ", parent=" + getParentSpanIdHex() + ", sampled=" + sampled + "]";
    }

}
