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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands arbitrary values into a readable one-line form.
 * <pre>
 * {"sku": "a-1", "qty": 2}
 * ["x", "y"]
 * Order{id: 7, customer: "bob", lines: [Line{sku: "a-1"}]}
 * </pre>
 * Strings are quoted, nested containers and object fields are expanded, and a
 * value that refers back to one of its parents is shown as {@code <cycle Type>}.
 */
public final class ValueRenderer {

    private ValueRenderer() {
        // only static methods
    }

    public static String render(Object value) {
        StringBuilder sb = new StringBuilder();
        // anti recursion / back-references
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        render(sb, value, seen);
        return sb.toString();
    }

    private static void render(StringBuilder sb, Object value, Set<Object> seen) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof CharSequence || value instanceof Character) {
            quote(sb, value.toString());
        } else if (value instanceof Renderable r) {
            sb.append(r.render());
        } else if (value instanceof Enum<?> e) {
            sb.append(e.name());
        } else if (value instanceof Throwable t) {
            sb.append(ErrorFormatter.format(t).message());
        } else if (value instanceof Map<?, ?> map) {
            if (enter(sb, value, seen)) {
                renderMap(sb, map, seen);
                seen.remove(value);
            }
        } else if (value instanceof Collection<?> c) {
            if (enter(sb, value, seen)) {
                renderSequence(sb, c, seen);
                seen.remove(value);
            }
        } else if (value.getClass().isArray()) {
            if (enter(sb, value, seen)) {
                int length = Array.getLength(value);
                List<Object> list = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    list.add(Array.get(value, i));
                }
                renderSequence(sb, list, seen);
                seen.remove(value);
            }
        } else if (value instanceof Optional<?> o) {
            if (o.isPresent()) {
                sb.append("Optional[");
                render(sb, o.get(), seen);
                sb.append(']');
            } else {
                sb.append("Optional.empty");
            }
        } else if (FieldValue.isTextual(value)) {
            sb.append(value);
        } else if (value.getClass().isRecord()) {
            if (enter(sb, value, seen)) {
                renderRecord(sb, value, seen);
                seen.remove(value);
            }
        } else {
            if (enter(sb, value, seen)) {
                renderObject(sb, value, seen);
                seen.remove(value);
            }
        }
    }

    private static boolean enter(StringBuilder sb, Object value, Set<Object> seen) {
        if (seen.add(value)) {
            return true;
        }
        sb.append("<cycle ").append(value.getClass().getSimpleName()).append('>');
        return false;
    }

    private static void renderMap(StringBuilder sb, Map<?, ?> map, Set<Object> seen) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            render(sb, entry.getKey(), seen);
            sb.append(": ");
            render(sb, entry.getValue(), seen);
        }
        sb.append('}');
    }

    private static void renderSequence(StringBuilder sb, Collection<?> items, Set<Object> seen) {
        sb.append('[');
        boolean first = true;
        for (Object item : items) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            render(sb, item, seen);
        }
        sb.append(']');
    }

    private static void renderRecord(StringBuilder sb, Object value, Set<Object> seen) {
        sb.append(value.getClass().getSimpleName()).append('{');
        RecordComponent[] components = value.getClass().getRecordComponents();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(components[i].getName()).append(": ");
            try {
                components[i].getAccessor().setAccessible(true);
                render(sb, components[i].getAccessor().invoke(value), seen);
            } catch (ReflectiveOperationException | RuntimeException e) {
                sb.append('?');
            }
        }
        sb.append('}');
    }

    private static void renderObject(StringBuilder sb, Object value, Set<Object> seen) {
        List<Field> fields = new ArrayList<>();
        for (Class<?> c = value.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        String name = value.getClass().getSimpleName();
        sb.append(name.isEmpty() ? value.getClass().getName() : name).append('{');
        boolean first = true;
        for (Field field : fields) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(field.getName()).append(": ");
            try {
                field.setAccessible(true);
                render(sb, field.get(value), seen);
            } catch (ReflectiveOperationException | RuntimeException e) {
                // inaccessible (module encapsulation), show the field without its value
                sb.append('?');
            }
        }
        sb.append('}');
    }

    static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        quote(sb, s);
        return sb.toString();
    }

}
