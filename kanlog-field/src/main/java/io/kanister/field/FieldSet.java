/*
 * The MIT License
 *
 * Copyright 2025 The Kanister Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.kanister.field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered sequence of fields.
 * Appending returns a new set and never changes the receiver, so a set can be
 * shared freely between threads and call chains.
 */
public final class FieldSet {

    private static final FieldSet EMPTY = new FieldSet(List.of());

    private final List<Field> fields;

    private FieldSet(List<Field> fields) {
        this.fields = fields;
    }

    public static FieldSet empty() {
        return EMPTY;
    }

    public static FieldSet of(String key, Object value) {
        return EMPTY.add(key, value);
    }

    /**
     * Build a set from alternating keys and values, for example
     * {@code FieldSet.of("user", "alice", "attempt", 3)}.
     */
    public static FieldSet of(Object... keysAndValues) {
        if (keysAndValues == null || keysAndValues.length == 0) {
            return EMPTY;
        }
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key / value pairs, got " + keysAndValues.length + " arguments");
        }
        List<Field> list = new ArrayList<>(keysAndValues.length / 2);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (!(keysAndValues[i] instanceof String key)) {
                throw new IllegalArgumentException("field key at position " + i + " is not a string: " + keysAndValues[i]);
            }
            list.add(new Field(key, keysAndValues[i + 1]));
        }
        return new FieldSet(Collections.unmodifiableList(list));
    }

    public static FieldSet of(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        List<Field> list = new ArrayList<>(map.size());
        map.forEach((k, v) -> list.add(new Field(k, v)));
        return new FieldSet(Collections.unmodifiableList(list));
    }

    public FieldSet add(String key, Object value) {
        return append(List.of(new Field(key, value)));
    }

    public FieldSet add(Field field) {
        return append(List.of(field));
    }

    public FieldSet addAll(FieldSet other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return append(other.fields);
    }

    private FieldSet append(List<Field> more) {
        List<Field> list = new ArrayList<>(fields.size() + more.size());
        list.addAll(fields);
        list.addAll(more);
        return new FieldSet(Collections.unmodifiableList(list));
    }

    public List<Field> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Flatten to a mapping. On duplicate keys the later field wins, the key
     * keeps the position of its first occurrence.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(fields.size());
        for (Field field : fields) {
            map.put(field.key(), field.value());
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldSet other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

}
