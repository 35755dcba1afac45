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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Human readable key=value lines:
 * <pre>
 * time="2024-05-01T10:15:30.123456789Z" level=info msg=login user=alice
 * </pre>
 * Fields follow the fixed keys in key order. A value is quoted only when it
 * contains characters other than letters, digits and {@code -._/@^+}. Fields
 * named like a fixed key are written as {@code fields.<key>}.
 */
public class TextFormatter implements EntryFormatter {

    static final String TIME_KEY = "time";
    static final String LEVEL_KEY = "level";
    static final String MSG_KEY = "msg";

    private static final Set<String> FIXED_KEYS = Set.of(TIME_KEY, LEVEL_KEY, MSG_KEY);

    @Override
    public byte[] format(LogEntry entry) {
        StringBuilder sb = new StringBuilder(128);
        appendKeyValue(sb, TIME_KEY, Timestamps.format(entry.time()));
        appendKeyValue(sb, LEVEL_KEY, entry.level().toString());
        appendKeyValue(sb, MSG_KEY, entry.message());
        Map<String, Object> fields = entry.fields();
        List<String> keys = new ArrayList<>(fields.keySet());
        Collections.sort(keys);
        for (String key : keys) {
            String name = FIXED_KEYS.contains(key) ? "fields." + key : key;
            appendKeyValue(sb, name, stringify(fields.get(key)));
        }
        sb.append('\n');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String stringify(Object value) {
        if (value instanceof Renderable r) {
            return r.render();
        }
        if (value instanceof Throwable t) {
            return ErrorFormatter.shortMessage(t);
        }
        return String.valueOf(value);
    }

    private static void appendKeyValue(StringBuilder sb, String key, String value) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(key).append('=');
        if (needsQuoting(value)) {
            ValueRenderer.quote(sb, value);
        } else {
            sb.append(value);
        }
    }

    static boolean needsQuoting(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '/' || c == '@' || c == '^' || c == '+';
            if (!safe) {
                return true;
            }
        }
        return false;
    }

}
