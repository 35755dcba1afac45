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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EntryRendererTest {

    record Point(int x, int y) {
    }

    static class Token {
        @Override
        public String toString() {
            return "token-1";
        }
    }

    static class Opaque {
        String name = "o";
    }

    @Test
    void testClassification() {
        assertInstanceOf(FieldValue.Text.class, FieldValue.of("s"));
        assertInstanceOf(FieldValue.Text.class, FieldValue.of(3));
        assertInstanceOf(FieldValue.Text.class, FieldValue.of(null));
        assertInstanceOf(FieldValue.Text.class, FieldValue.of(UUID.randomUUID()));
        assertInstanceOf(FieldValue.Text.class, FieldValue.of(Instant.EPOCH));
        assertInstanceOf(FieldValue.Text.class, FieldValue.of(new Token()));
        assertInstanceOf(FieldValue.Error.class, FieldValue.of(new RuntimeException("x")));
        assertInstanceOf(FieldValue.Structured.class, FieldValue.of(Map.of("a", 1)));
        assertInstanceOf(FieldValue.Structured.class, FieldValue.of(List.of(1)));
        assertInstanceOf(FieldValue.Structured.class, FieldValue.of(new int[]{1}));
        assertInstanceOf(FieldValue.Structured.class, FieldValue.of(new Point(1, 2)));
        assertInstanceOf(FieldValue.Structured.class, FieldValue.of(new Opaque()));
    }

    @Test
    void testErrorFieldSplit() {
        Map<String, Object> out = EntryRenderer.render(Map.of("error", new ErrorFormatterTest.WrappedError(
                "boom: root cause", "boom: root cause\ngoroutine 1 [running]:")));
        assertEquals("boom: root cause", out.get("error"));
        assertEquals("\ngoroutine 1 [running]:", out.get(EntryRenderer.STACK_TRACE_KEY));
    }

    @Test
    void testErrorWithoutTraceStillAddsStackTraceKey() {
        Map<String, Object> out = EntryRenderer.render(Map.of("error", new ErrorFormatterTest.WrappedError("boom", "boom")));
        assertEquals("boom", out.get("error"));
        assertEquals("", out.get(EntryRenderer.STACK_TRACE_KEY));
    }

    @Test
    void testTextPassesThrough() {
        Token token = new Token();
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("user", "alice");
        in.put("count", 3);
        in.put("token", token);
        Map<String, Object> out = EntryRenderer.render(in);
        assertEquals("alice", out.get("user"));
        assertEquals(3, out.get("count"));
        assertSame(token, out.get("token"));
    }

    @Test
    void testRenderableIsRendered() {
        Renderable r = () -> "rendered";
        assertEquals("rendered", EntryRenderer.render(Map.of("r", r)).get("r"));
    }

    @Test
    void testStructuredIsExpanded() {
        Map<String, Object> out = EntryRenderer.render(Map.of("point", new Point(1, 2), "opaque", new Opaque()));
        assertEquals("Point{x: 1, y: 2}", out.get("point"));
        assertEquals("Opaque{name: \"o\"}", out.get("opaque"));
    }

    @Test
    void testTimeKeysAreNotRendered() {
        Map<String, String> raw = Map.of("a", "b");
        Map<String, Object> out = EntryRenderer.render(Map.of("time", raw, "field.time", raw, "fields.time", raw, "other", raw));
        assertSame(raw, out.get("time"));
        assertSame(raw, out.get("field.time"));
        assertSame(raw, out.get("fields.time"));
        assertEquals("{\"a\": \"b\"}", out.get("other"));
    }

    @Test
    void testEntryWithoutFieldsIsUnchanged() {
        LogEntry entry = new LogEntry(Instant.EPOCH.atOffset(java.time.ZoneOffset.UTC), Level.INFO, "m", Map.of(), null);
        assertSame(entry, EntryRenderer.render(entry));
    }

}
