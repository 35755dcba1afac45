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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One JSON document per line with the fixed keys {@code Message},
 * {@code Level} and {@code Time} plus every field as given:
 * <pre>
 * {"Level":"info","Message":"login","Time":"2024-05-01T10:15:30.123456789Z","user":"alice"}
 * </pre>
 * Keys are sorted. A field with the same name as a fixed key replaces it.
 * Errors are written as their message, other objects with their own
 * {@code toString()} as that text, and remaining objects as a JSON object of
 * their instance fields. Values that have no JSON form (non-finite numbers,
 * self-referencing containers or objects) fail the whole entry.
 */
public class JsonFormatter implements EntryFormatter {

    public static final String MESSAGE_KEY = "Message";
    public static final String LEVEL_KEY = "Level";
    public static final String TIME_KEY = "Time";

    private static final JSONStyle JSON_STYLE = JSONStyle.NO_COMPRESS;

    @Override
    public byte[] format(LogEntry entry) {
        return (toJson(entry) + "\n").getBytes(StandardCharsets.UTF_8);
    }

    public static String toJson(LogEntry entry) {
        Map<String, Object> data = new TreeMap<>();
        data.put(MESSAGE_KEY, entry.message());
        data.put(LEVEL_KEY, entry.level().toString());
        data.put(TIME_KEY, Timestamps.format(entry.time()));
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        entry.fields().forEach((k, v) -> data.put(k, toJsonValue(v, seen)));
        try {
            return JSONValue.toJSONString(data, JSON_STYLE);
        } catch (RuntimeException e) {
            throw new LogException(LogException.Type.SERIALIZATION, "unable to encode log entry: " + e.getMessage(), e);
        }
    }

    private static Object toJsonValue(Object value, Set<Object> seen) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())
                || value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new LogException(LogException.Type.SERIALIZATION, "unsupported value: " + value);
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof Throwable t) {
            return ErrorFormatter.shortMessage(t);
        }
        if (value instanceof Renderable r) {
            return r.render();
        }
        if (value instanceof OffsetDateTime odt) {
            return Timestamps.format(odt);
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof TemporalAccessor
                || value instanceof UUID || value instanceof URI || value instanceof URL || value instanceof Path) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Optional<?> o) {
            return o.isPresent() ? toJsonValue(o.get(), seen) : null;
        }
        boolean container = value instanceof Map || value instanceof Collection
                || value.getClass().isArray() || value.getClass().isRecord();
        if (!container && FieldValue.isTextual(value)) {
            return value.toString();
        }
        if (!seen.add(value)) {
            throw new LogException(LogException.Type.SERIALIZATION, "cyclic value: " + value.getClass().getName());
        }
        try {
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>(map.size());
                map.forEach((k, v) -> copy.put(String.valueOf(k), toJsonValue(v, seen)));
                return copy;
            }
            if (value instanceof Collection<?> c) {
                List<Object> copy = new ArrayList<>(c.size());
                for (Object item : c) {
                    copy.add(toJsonValue(item, seen));
                }
                return copy;
            }
            if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> copy = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    copy.add(toJsonValue(Array.get(value, i), seen));
                }
                return copy;
            }
            if (!value.getClass().isRecord()) {
                return beanToMap(value, seen);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (RecordComponent component : value.getClass().getRecordComponents()) {
                try {
                    component.getAccessor().setAccessible(true);
                    copy.put(component.getName(), toJsonValue(component.getAccessor().invoke(value), seen));
                } catch (ReflectiveOperationException e) {
                    throw new LogException(LogException.Type.SERIALIZATION,
                            "unable to read " + component.getName() + " of " + value.getClass().getName(), e);
                }
            }
            return copy;
        } finally {
            seen.remove(value);
        }
    }

    // walked here so that self references hit the seen set
    private static Map<String, Object> beanToMap(Object value, Set<Object> seen) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Class<?> c = value.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()
                        || copy.containsKey(field.getName())) {
                    continue;
                }
                Object fieldValue;
                try {
                    field.setAccessible(true);
                    fieldValue = field.get(value);
                } catch (ReflectiveOperationException | RuntimeException e) {
                    // module encapsulated, not part of the document
                    continue;
                }
                copy.put(field.getName(), toJsonValue(fieldValue, seen));
            }
        }
        return copy;
    }

}
