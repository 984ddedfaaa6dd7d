/*
 * Attribute.java
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

import java.util.Objects;

/**
 * A key-value attribute for spans, events, metric series or resources.
 * Values are scalars: string, boolean, long or double.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attribute {

    /**
     * Scalar value types.
     */
    public enum Type {
        STRING,
        BOOL,
        INT,
        DOUBLE
    }

    private final String key;
    private final Type type;
    private final Object value;

    private Attribute(String key, Type type, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null for " + key);
        }
        this.key = key;
        this.type = type;
        this.value = value;
    }

    /**
     * Creates a string attribute.
     */
    public static Attribute string(String key, String value) {
        return new Attribute(key, Type.STRING, value);
    }

    /**
     * Creates a boolean attribute.
     */
    public static Attribute bool(String key, boolean value) {
        return new Attribute(key, Type.BOOL, Boolean.valueOf(value));
    }

    /**
     * Creates an integer attribute.
     */
    public static Attribute integer(String key, long value) {
        return new Attribute(key, Type.INT, Long.valueOf(value));
    }

    /**
     * Creates a double attribute.
     */
    public static Attribute doubleValue(String key, double value) {
        return new Attribute(key, Type.DOUBLE, Double.valueOf(value));
    }

    /**
     * Creates an attribute from an arbitrary object.
     * Integral numbers become {@link Type#INT}, other numbers
     * {@link Type#DOUBLE}; anything that is not a number or boolean is
     * stored as its string form.
     *
     * @param key the attribute key
     * @param value the value, not null
     * @return the attribute
     */
    public static Attribute of(String key, Object value) {
        if (value instanceof String) {
            return string(key, (String) value);
        } else if (value instanceof Boolean) {
            return bool(key, (Boolean) value);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return integer(key, ((Number) value).longValue());
        } else if (value instanceof Number) {
            return doubleValue(key, ((Number) value).doubleValue());
        } else if (value == null) {
            throw new IllegalArgumentException("value cannot be null for " + key);
        }
        return string(key, value.toString());
    }

    public String getKey() {
        return key;
    }

    public Type getType() {
        return type;
    }

    /**
     * Returns the raw value object.
     * The type can be determined using {@link #getType()}.
     */
    public Object getValue() {
        return value;
    }

    /**
     * Returns the string value.
     *
     * @throws IllegalStateException if the type is not STRING
     */
    public String getStringValue() {
        if (type != Type.STRING) {
            throw new IllegalStateException("Not a string attribute: " + key);
        }
        return (String) value;
    }

    /**
     * Returns the long value.
     *
     * @throws IllegalStateException if the type is not INT
     */
    public long getIntValue() {
        if (type != Type.INT) {
            throw new IllegalStateException("Not an integer attribute: " + key);
        }
        return ((Long) value).longValue();
    }

    /**
     * Returns the value as text, as used in log lines and exposition labels.
     */
    public String getValueAsString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Attribute)) {
            return false;
        }
        Attribute other = (Attribute) obj;
        return key.equals(other.key) && type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, type, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }

}
