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

import io.kanister.field.FieldContext;
import io.kanister.field.FieldSet;

import java.util.Map;

/**
 * A handle bound to one level. {@code withContext} and {@code withError}
 * return new handles, a handle never changes once created and can be shared
 * between threads.
 * <pre>
 * Log.error().withContext(ctx).withError(e).print("backup failed", FieldSet.of("bucket", name));
 * </pre>
 */
public interface Logger {

    Level getLevel();

    /**
     * Bind the context whose fields are added to every entry.
     */
    Logger withContext(FieldContext ctx);

    /**
     * Bind an error, written as the {@value LogEntry#ERROR_KEY} field.
     */
    Logger withError(Throwable error);

    /**
     * Emit an entry. Fields are merged in this order, later values replacing
     * earlier ones with the same key: context fields, each of {@code fields}
     * in argument order, then the bound error. Never throws.
     */
    void print(String msg, FieldSet... fields);

    default void print(String msg, Map<String, ?> fields) {
        print(msg, FieldSet.of(fields));
    }

}
