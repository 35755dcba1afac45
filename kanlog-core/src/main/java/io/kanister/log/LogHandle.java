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

import java.util.LinkedHashMap;
import java.util.Map;

final class LogHandle implements Logger {

    private final LogEngine engine;
    private final Level level;
    private final FieldContext ctx;
    private final Throwable error;

    LogHandle(LogEngine engine, Level level, FieldContext ctx, Throwable error) {
        this.engine = engine;
        this.level = level;
        this.ctx = ctx;
        this.error = error;
    }

    @Override
    public Level getLevel() {
        return level;
    }

    @Override
    public Logger withContext(FieldContext ctx) {
        return new LogHandle(engine, level, ctx, error);
    }

    @Override
    public Logger withError(Throwable error) {
        return new LogHandle(engine, level, ctx, error);
    }

    @Override
    public void print(String msg, FieldSet... fields) {
        if (!engine.isEnabled(level)) {
            return;
        }
        try {
            engine.emit(new LogEntry(engine.now(), level, msg, merge(fields), error));
        } catch (RuntimeException e) {
            LogEngine.RUNTIME_LOGGER.debug("failed to log '{}': {}", msg, e.getMessage());
        }
    }

    Map<String, Object> merge(FieldSet... fields) {
        Map<String, Object> merged = new LinkedHashMap<>();
        FieldSet ctxFields = FieldContext.fields(ctx);
        if (ctxFields != null) {
            merged.putAll(ctxFields.toMap());
        }
        if (fields != null) {
            for (FieldSet set : fields) {
                if (set != null) {
                    merged.putAll(set.toMap());
                }
            }
        }
        if (error != null) {
            merged.put(LogEntry.ERROR_KEY, error);
        }
        return merged;
    }

    @Override
    public String toString() {
        return "Logger[" + level + (ctx == null ? "" : ", " + ctx) + (error == null ? "" : ", " + error) + "]";
    }

}
