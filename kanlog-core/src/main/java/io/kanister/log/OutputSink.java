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

/**
 * Where log output goes.
 */
public enum OutputSink {

    /**
     * The process standard error stream.
     */
    STDERR,

    /**
     * A Fluent Bit collector, located through {@link LogConfig#LOGGING_SERVICE_HOST_ENV}
     * and {@link LogConfig#LOGGING_SERVICE_PORT_ENV}. Local output continues.
     */
    FLUENTBIT;

    public static OutputSink parse(String name) {
        if (name != null) {
            for (OutputSink sink : values()) {
                if (sink.name().equalsIgnoreCase(name.trim())) {
                    return sink;
                }
            }
        }
        throw new LogException(LogException.Type.UNSUPPORTED_SINK, "not implemented: " + name);
    }

}
