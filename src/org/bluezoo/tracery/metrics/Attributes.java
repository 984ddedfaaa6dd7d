/*
 * Attributes.java
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

package org.bluezoo.tracery.metrics;

import org.bluezoo.tracery.Attribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable set of attributes identifying one time series of an
 * instrument. Two sets are equal exactly when they map the same keys to
 * the same values; the order in which they were given does not matter.
 *
 * <p>Example usage:
 * <pre>
 * Attributes attrs = Attributes.of(
 *     "route", "/items/{item_id}",
 *     "status", 200
 * );
 * histogram.record(span.getData().getDurationMillis(), attrs);
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Attributes {

    private static final Attributes EMPTY = new Attributes(Collections.<Attribute>emptyList());

    private static final Comparator<Attribute> BY_KEY = new Comparator<Attribute>() {
        @Override
        public int compare(Attribute a, Attribute b) {
            return a.getKey().compareTo(b.getKey());
        }
    };

    private final List<Attribute> attributes;
    private final int hashCode;

    private Attributes(List<Attribute> attributes) {
        this.attributes = attributes;
        this.hashCode = computeHashCode();
    }

    /**
     * Returns an empty attributes instance.
     */
    public static Attributes empty() {
        return EMPTY;
    }

    /**
     * Creates attributes from key-value pairs.
     * Values may be String, Long, Integer, Double, Float or Boolean;
     * anything else is stored as its string form. A later duplicate key
     * replaces an earlier one.
     *
     * @param keyValuePairs alternating keys and values
     * @return the attributes
     */
    public static Attributes of(Object... keyValuePairs) {
        if (keyValuePairs == null || keyValuePairs.length == 0) {
            return EMPTY;
        }
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must have even length");
        }
        List<Attribute> attrs = new ArrayList<Attribute>(keyValuePairs.length / 2);
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            Object value = keyValuePairs[i + 1];
            if (value != null) {
                attrs.add(Attribute.of(String.valueOf(keyValuePairs[i]), value));
            }
        }
        return of(attrs);
    }

    /**
     * Creates attributes from a list of Attribute objects.
     */
    public static Attributes of(List<Attribute> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return EMPTY;
        }
        List<Attribute> sorted = new ArrayList<Attribute>(attributes.size());
        for (Attribute attribute : attributes) {
            int existing = indexOf(sorted, attribute.getKey());
            if (existing >= 0) {
                sorted.set(existing, attribute);
            } else {
                sorted.add(attribute);
            }
        }
        // Sorted by key so that equal sets compare and hash equally
        Collections.sort(sorted, BY_KEY);
        return new Attributes(Collections.unmodifiableList(sorted));
    }

    private static int indexOf(List<Attribute> list, String key) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getKey().equals(key)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the attributes sorted by key.
     */
    public List<Attribute> asList() {
        return attributes;
    }

    /**
     * Returns the attribute value for a key, or null.
     */
    public Object get(String key) {
        for (Attribute attr : attributes) {
            if (attr.getKey().equals(key)) {
                return attr.getValue();
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    private int computeHashCode() {
        int result = 1;
        for (Attribute attr : attributes) {
            result = 31 * result + attr.getKey().hashCode();
            Object value = attr.getValue();
            result = 31 * result + (value != null ? value.hashCode() : 0);
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Attributes other = (Attributes) obj;
        if (hashCode != other.hashCode) return false;
        if (attributes.size() != other.attributes.size()) return false;

        for (int i = 0; i < attributes.size(); i++) {
            Attribute a = attributes.get(i);
            Attribute b = other.attributes.get(i);
            if (!a.getKey().equals(b.getKey())) return false;
            if (a.getType() != b.getType()) return false;
            if (!Objects.equals(a.getValue(), b.getValue())) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (attributes.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < attributes.size(); i++) {
            if (i > 0) sb.append(", ");
            Attribute attr = attributes.get(i);
            sb.append(attr.getKey()).append("=").append(attr.getValue());
        }
        sb.append("}");
        return sb.toString();
    }

}
