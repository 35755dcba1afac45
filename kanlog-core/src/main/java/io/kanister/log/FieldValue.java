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
package io.kanister.log;

import java.io.File;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A field value classified for rendering.
 * <p>
 * Hierarchy:
 * <pre>
 * FieldValue (sealed)
 * ├── Text       - strings and values with a natural textual form
 * ├── Error      - a Throwable, split into message and stack trace
 * └── Structured - containers, records and plain objects, deep-rendered
 * </pre>
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Error, FieldValue.Structured {

    Object value();

    record Text(Object value) implements FieldValue {
    }

    record Error(Throwable value) implements FieldValue {
    }

    record Structured(Object value) implements FieldValue {
    }

    static FieldValue of(Object value) {
        if (value instanceof Throwable t) {
            return new Error(t);
        }
        if (isTextual(value)) {
            return new Text(value);
        }
        return new Structured(value);
    }

    /**
     * True for values that already read well as text: strings, scalars,
     * {@link Renderable} values and any object whose class provides its own
     * {@code toString()}. Containers, arrays and records are never textual.
     */
    static boolean isTextual(Object value) {
        if (value == null
                || value instanceof CharSequence
                || value instanceof Renderable
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum
                || value instanceof UUID
                || value instanceof TemporalAccessor
                || value instanceof URI
                || value instanceof URL
                || value instanceof Path
                || value instanceof File) {
            return true;
        }
        if (value instanceof Map
                || value instanceof Collection
                || value instanceof Optional
                || value.getClass().isArray()
                || value.getClass().isRecord()) {
            return false;
        }
        return overridesToString(value.getClass());
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

}
