/*
 * SpanStatus.java
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
 * The outcome of a span: unset while open, then OK or ERROR.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SpanStatus {

    /**
     * Status codes. The ordinal matches the OTLP StatusCode enum.
     */
    public enum Code {
        UNSET,
        OK,
        ERROR
    }

    public static final SpanStatus UNSET = new SpanStatus(Code.UNSET, null);

    public static final SpanStatus OK = new SpanStatus(Code.OK, null);

    private final Code code;
    private final String message;

    private SpanStatus(Code code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Creates an error status with a description message.
     *
     * @param message the error description, may be null
     * @return a new error status
     */
    public static SpanStatus error(String message) {
        return new SpanStatus(Code.ERROR, message);
    }

    public Code getCode() {
        return code;
    }

    /**
     * Returns the status message, if any.
     */
    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return code == Code.ERROR;
    }

    public boolean isOk() {
        return code == Code.OK;
    }

    @Override
    public String toString() {
        return message != null ? code + "(" + message + ")" : code.toString();
    }

}
