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

import java.util.Map;

/**
 * Carries a field set along a call chain. Contexts are immutable: attaching
 * fields derives a child context that sees the parent's fields followed by
 * the new ones, the parent stays as it was.
 * <p>
 * Usage:
 * <pre>
 * FieldContext ctx = FieldContext.empty().with("requestId", id);
 * handle(ctx.with("user", user));
 * </pre>
 */
public final class FieldContext {

    private static final FieldContext EMPTY = new FieldContext(FieldSet.empty());

    private final FieldSet fields;

    private FieldContext(FieldSet fields) {
        this.fields = fields;
    }

    public static FieldContext empty() {
        return EMPTY;
    }

    public static FieldContext of(FieldSet fields) {
        return fields == null || fields.isEmpty() ? EMPTY : new FieldContext(fields);
    }

    /**
     * Read the field set attached to a context.
     *
     * @return the fields, or null when no context is given
     */
    public static FieldSet fields(FieldContext ctx) {
        return ctx == null ? null : ctx.fields;
    }

    public FieldContext with(String key, Object value) {
        return new FieldContext(fields.add(key, value));
    }

    public FieldContext with(Map<String, ?> map) {
        return with(FieldSet.of(map));
    }

    public FieldContext with(FieldSet more) {
        if (more == null || more.isEmpty()) {
            return this;
        }
        return new FieldContext(fields.addAll(more));
    }

    public FieldSet fields() {
        return fields;
    }

    @Override
    public String toString() {
        return "FieldContext" + fields;
    }

}
