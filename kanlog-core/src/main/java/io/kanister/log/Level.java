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

import java.util.Locale;

/**
 * Log severity, ordered from least to most severe.
 */
public enum Level {

    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    private final String label = name().toLowerCase(Locale.ROOT);

    /**
     * True when an entry at this level passes the given threshold.
     */
    public boolean isEnabled(Level threshold) {
        return ordinal() >= threshold.ordinal();
    }

    public static Level parse(String name) {
        if (name != null) {
            String key = name.trim();
            for (Level level : values()) {
                if (level.name().equalsIgnoreCase(key)) {
                    return level;
                }
            }
            if ("warning".equalsIgnoreCase(key)) {
                return WARN;
            }
        }
        throw new LogException(LogException.Type.UNSUPPORTED_LEVEL, "unknown log level: " + name);
    }

    @Override
    public String toString() {
        return label;
    }

}
