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

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldContextTest {

    @Test
    void testNullContextHasNoFields() {
        assertNull(FieldContext.fields(null));
    }

    @Test
    void testEmptyContext() {
        FieldSet fields = FieldContext.fields(FieldContext.empty());
        assertNotNull(fields);
        assertTrue(fields.isEmpty());
    }

    @Test
    void testChildSeesParentFields() {
        FieldContext parent = FieldContext.empty().with("requestId", "r-1");
        FieldContext child = parent.with("user", "alice");
        assertEquals(Map.of("requestId", "r-1"), parent.fields().toMap());
        assertEquals(Map.of("requestId", "r-1", "user", "alice"), child.fields().toMap());
    }

    @Test
    void testChildOverridesParentKey() {
        FieldContext ctx = FieldContext.empty().with("stage", "init").with(Map.of("stage", "run"));
        assertEquals("run", ctx.fields().toMap().get("stage"));
        assertEquals(2, ctx.fields().size());
    }

    @Test
    void testWithEmptySetReturnsSameContext() {
        FieldContext ctx = FieldContext.empty().with("a", 1);
        assertSame(ctx, ctx.with(FieldSet.empty()));
    }

    @Test
    void testOfFieldSet() {
        FieldContext ctx = FieldContext.of(FieldSet.of("a", 1));
        assertEquals(1, FieldContext.fields(ctx).size());
        assertSame(FieldContext.empty(), FieldContext.of(null));
    }

}
