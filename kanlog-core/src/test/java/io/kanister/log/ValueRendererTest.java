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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ValueRendererTest {

    record Line(String sku, int qty) {
    }

    static class Order {
        int id = 7;
        String customer = "bob";
        List<Line> lines = List.of(new Line("a-1", 2));
    }

    enum Color {
        RED
    }

    @Test
    void testScalars() {
        assertEquals("null", ValueRenderer.render(null));
        assertEquals("42", ValueRenderer.render(42));
        assertEquals("true", ValueRenderer.render(true));
        assertEquals("\"hi\"", ValueRenderer.render("hi"));
        assertEquals("RED", ValueRenderer.render(Color.RED));
    }

    @Test
    void testMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sku", "a-1");
        map.put("qty", 2);
        assertEquals("{\"sku\": \"a-1\", \"qty\": 2}", ValueRenderer.render(map));
    }

    @Test
    void testSequences() {
        assertEquals("[\"x\", \"y\"]", ValueRenderer.render(List.of("x", "y")));
        assertEquals("[1, 2, 3]", ValueRenderer.render(new int[]{1, 2, 3}));
        assertEquals("[]", ValueRenderer.render(new String[0]));
    }

    @Test
    void testRecord() {
        assertEquals("Line{sku: \"a-1\", qty: 2}", ValueRenderer.render(new Line("a-1", 2)));
    }

    @Test
    void testPlainObject() {
        assertEquals("Order{id: 7, customer: \"bob\", lines: [Line{sku: \"a-1\", qty: 2}]}",
                ValueRenderer.render(new Order()));
    }

    @Test
    void testOptional() {
        assertEquals("Optional[\"x\"]", ValueRenderer.render(Optional.of("x")));
        assertEquals("Optional.empty", ValueRenderer.render(Optional.empty()));
    }

    @Test
    void testEscaping() {
        assertEquals("\"a \\\"b\\\"\\n\"", ValueRenderer.render("a \"b\"\n"));
    }

    @Test
    void testCycle() {
        List<Object> list = new ArrayList<>();
        list.add("a");
        list.add(list);
        assertEquals("[\"a\", <cycle ArrayList>]", ValueRenderer.render(list));
    }

    @Test
    void testSharedValueIsNotACycle() {
        List<String> shared = List.of("s");
        assertEquals("[[\"s\"], [\"s\"]]", ValueRenderer.render(List.of(shared, shared)));
    }

    @Test
    void testNestedError() {
        Map<String, Object> map = Map.of("cause", new IllegalStateException("boom"));
        assertEquals("{\"cause\": java.lang.IllegalStateException: boom}", ValueRenderer.render(map));
    }

    @Test
    void testRenderable() {
        Renderable r = () -> "custom";
        assertEquals("[custom]", ValueRenderer.render(List.of(r)));
    }

}
