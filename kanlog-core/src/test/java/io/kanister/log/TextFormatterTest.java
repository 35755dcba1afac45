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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextFormatterTest {

    static final OffsetDateTime TIME = Instant.parse("2024-05-01T10:15:30.123456789Z").atOffset(ZoneOffset.UTC);

    private static String format(EntryFormatter formatter, String msg, Map<String, Object> fields) {
        return new String(formatter.format(new LogEntry(TIME, Level.INFO, msg, fields, null)), StandardCharsets.UTF_8);
    }

    @Test
    void testSimpleLine() {
        String line = format(new TextFormatter(), "login", Map.of("user", "alice"));
        assertEquals("time=\"2024-05-01T10:15:30.123456789Z\" level=info msg=login user=alice\n", line);
    }

    @Test
    void testFieldsSortedAndQuoted() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("zone", "eu west");
        fields.put("attempt", 3);
        fields.put("path", "/var/lib@x");
        String line = format(new TextFormatter(), "backup started", fields);
        assertEquals("time=\"2024-05-01T10:15:30.123456789Z\" level=info msg=\"backup started\""
                + " attempt=3 path=/var/lib@x zone=\"eu west\"\n", line);
    }

    @Test
    void testEmptyValueIsNotQuoted() {
        String line = format(new TextFormatter(), "", Map.of());
        assertTrue(line.endsWith("level=info msg=\n"));
    }

    @Test
    void testClashingKeysArePrefixed() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("msg", "mine");
        fields.put("level", "low");
        String line = format(new TextFormatter(), "x", fields);
        assertTrue(line.contains(" msg=x "));
        assertTrue(line.contains(" fields.level=low"));
        assertTrue(line.contains(" fields.msg=mine"));
    }

    @Test
    void testRenderedNestedValue() {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("sku", "a-1");
        order.put("qty", 2);
        String line = format(new RenderingFormatter(new TextFormatter()), "order", Map.of("order", order));
        assertTrue(line.contains(" order=\"{\\\"sku\\\": \\\"a-1\\\", \\\"qty\\\": 2}\""), line);
    }

    @Test
    void testReservedTimeFieldNotRendered() {
        String line = format(new RenderingFormatter(new TextFormatter()), "x", Map.of("time", Map.of("a", "b")));
        assertTrue(line.contains(" fields.time=\"{a=b}\""), line);
    }

    @Test
    void testErrorFieldSplitIntoStackTrace() {
        String line = format(new RenderingFormatter(new TextFormatter()), "failed",
                Map.of("error", new IllegalStateException("boom")));
        assertTrue(line.contains(" error=\"java.lang.IllegalStateException: boom\""), line);
        assertTrue(line.contains(" stackTrace=\""), line);
        assertTrue(line.contains("\\tat io.kanister.log.TextFormatterTest"), line);
        assertTrue(line.endsWith("\n"));
        assertEquals(1, line.split("\n", -1).length - 1, "single line");
    }

    @Test
    void testTimestampOffsetAndTrimmedFraction() {
        OffsetDateTime time = Instant.parse("2024-05-01T10:15:30.500Z").atOffset(ZoneOffset.ofHours(2));
        assertEquals("2024-05-01T12:15:30.5+02:00", Timestamps.format(time));
        OffsetDateTime whole = Instant.parse("2024-05-01T10:15:30Z").atOffset(ZoneOffset.UTC);
        assertEquals("2024-05-01T10:15:30Z", Timestamps.format(whole));
    }

}
