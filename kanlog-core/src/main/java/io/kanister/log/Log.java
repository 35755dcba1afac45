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

/**
 * Static shortcuts over a process-wide default {@link LogEngine}.
 * <p>
 * The default engine writes text to standard error at {@link Level#INFO}
 * (or the level in {@value LogConfig#LOG_LEVEL_ENV}). Applications that own
 * their engine can install it with {@link #setEngine(LogEngine)}.
 * <pre>
 * Log.print("started", FieldSet.of("port", 9876));
 * Log.withError(e).print("request failed");
 * </pre>
 */
public final class Log {

    private static volatile LogEngine engine = LogEngine.fromEnv();

    private Log() {
    }

    public static LogEngine engine() {
        return engine;
    }

    /**
     * Replace the default engine. The previous engine is not closed.
     */
    public static void setEngine(LogEngine replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("engine must not be null");
        }
        engine = replacement;
    }

    // ========== Handles ==========

    public static Logger debug() {
        return engine.debug();
    }

    public static Logger info() {
        return engine.info();
    }

    public static Logger warn() {
        return engine.warn();
    }

    public static Logger error() {
        return engine.error();
    }

    /**
     * Same as {@code Log.info().print(msg, fields)}, the most common case.
     */
    public static void print(String msg, FieldSet... fields) {
        info().print(msg, fields);
    }

    public static Logger withContext(FieldContext ctx) {
        return info().withContext(ctx);
    }

    public static Logger withError(Throwable error) {
        return info().withError(error);
    }

    // ========== Configuration ==========

    public static void setOutput(OutputSink sink) {
        engine.setOutput(sink);
    }

    public static void setFormatter(OutputFormat format) {
        engine.setFormatter(format);
    }

    public static void setLevel(Level level) {
        engine.setLevel(level);
    }

}
