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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldSetTest {

    @Test
    void testEmpty() {
        FieldSet set = FieldSet.empty();
        assertTrue(set.isEmpty());
        assertEquals(0, set.size());
        assertTrue(set.toMap().isEmpty());
    }

    @Test
    void testKeyValuePairs() {
        FieldSet set = FieldSet.of("user", "alice", "attempt", 3);
        assertEquals(2, set.size());
        assertEquals(new Field("user", "alice"), set.fields().get(0));
        assertEquals(new Field("attempt", 3), set.fields().get(1));
    }

    @Test
    void testOddArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldSet.of("user", "alice", "attempt"));
    }

    @Test
    void testNonStringKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldSet.of(1, "one", "two", 2));
    }

    @Test
    void testNullKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Field(null, "x"));
    }

    @Test
    void testNullValueAllowed() {
        FieldSet set = FieldSet.of("missing", null);
        assertTrue(set.toMap().containsKey("missing"));
        assertNull(set.toMap().get("missing"));
    }

    @Test
    void testAddIsImmutable() {
        FieldSet base = FieldSet.of("a", 1);
        FieldSet more = base.add("b", 2);
        assertEquals(1, base.size());
        assertEquals(2, more.size());
        assertThrows(UnsupportedOperationException.class, () -> more.fields().add(new Field("c", 3)));
    }

    @Test
    void testFromMapKeepsOrder() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("z", 1);
        map.put("a", 2);
        FieldSet set = FieldSet.of(map);
        assertEquals(List.of("z", "a"), set.toMap().keySet().stream().toList());
    }

    @Test
    void testToMapLastWriterWins() {
        FieldSet set = FieldSet.of("k", "first", "other", 1).add("k", "second");
        Map<String, Object> map = set.toMap();
        assertEquals("second", map.get("k"));
        // position of the first occurrence is kept
        assertEquals(List.of("k", "other"), map.keySet().stream().toList());
    }

    @Test
    void testAddAll() {
        FieldSet a = FieldSet.of("a", 1);
        FieldSet b = FieldSet.of("b", 2);
        FieldSet both = a.addAll(b);
        assertEquals(2, both.size());
        assertSame(a, a.addAll(FieldSet.empty()));
        assertSame(b, FieldSet.empty().addAll(b));
    }

}
