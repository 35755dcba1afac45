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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Expands field values into text before an entry reaches a text formatter.
 * <ul>
 *   <li>errors become their message, with the trace in a sibling {@value #STACK_TRACE_KEY} field</li>
 *   <li>textual values pass through ({@link Renderable} values are rendered)</li>
 *   <li>everything else is deep-rendered with {@link ValueRenderer}, except
 *   timestamp keys which keep their value for the formatter</li>
 * </ul>
 */
public final class EntryRenderer {

    public static final String STACK_TRACE_KEY = "stackTrace";

    static final Set<String> TIME_KEYS = Set.of("time", "field.time", "fields.time");

    private EntryRenderer() {
        // only static methods
    }

    public static Map<String, Object> render(Map<String, Object> fields) {
        Map<String, Object> data = new LinkedHashMap<>(fields.size() + 1);
        fields.forEach((k, v) -> {
            FieldValue fv = FieldValue.of(v);
            if (fv instanceof FieldValue.Error e) {
                ErrorFormatter.ErrorParts parts = ErrorFormatter.format(e.value());
                data.put(k, parts.message());
                data.put(STACK_TRACE_KEY, parts.stackTrace());
            } else if (fv instanceof FieldValue.Text t) {
                data.put(k, t.value() instanceof Renderable r ? r.render() : t.value());
            } else if (TIME_KEYS.contains(k)) {
                data.put(k, v);
            } else {
                data.put(k, ValueRenderer.render(v));
            }
        });
        return data;
    }

    public static LogEntry render(LogEntry entry) {
        if (entry == null || !entry.hasFields()) {
            return entry;
        }
        return entry.withFields(render(entry.fields()));
    }

}
