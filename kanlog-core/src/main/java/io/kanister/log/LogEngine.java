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

import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Owns the log configuration: formatter, local output, optional remote hook
 * and level threshold. Create one at the composition root and hand out
 * {@link Logger} handles from it, or use the process-wide default behind
 * {@link Log}.
 * <p>
 * Reconfiguration is meant for startup. The fields are volatile so a change
 * is seen by other threads, but a {@code print} racing with
 * {@link #setOutput(OutputSink)} may still go to the old sink.
 */
public class LogEngine implements AutoCloseable {

    /** Diagnostics of the logging layer itself (dropped entries, sink failures) */
    public static final org.slf4j.Logger RUNTIME_LOGGER = LoggerFactory.getLogger("kanlog.runtime");

    private final Clock clock;
    private final Map<String, String> env;
    private final Object writeLock = new Object();

    private volatile EntryFormatter formatter;
    private volatile OutputStream output;
    private volatile LogHook hook;
    private volatile Level threshold;

    private LogEngine(Builder builder) {
        this.clock = builder.clock;
        this.env = builder.env;
        this.formatter = builder.format.newFormatter();
        this.output = builder.output;
        this.threshold = builder.level;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Text format on standard error at {@link Level#INFO}, or the level named
     * by {@value LogConfig#LOG_LEVEL_ENV}.
     */
    public static LogEngine fromEnv() {
        return builder().build();
    }

    // ========== Handles ==========

    public Logger at(Level level) {
        return new LogHandle(this, level, null, null);
    }

    public Logger trace() {
        return at(Level.TRACE);
    }

    public Logger debug() {
        return at(Level.DEBUG);
    }

    public Logger info() {
        return at(Level.INFO);
    }

    public Logger warn() {
        return at(Level.WARN);
    }

    public Logger error() {
        return at(Level.ERROR);
    }

    // ========== Configuration ==========

    /**
     * Select the output destination. On failure the current configuration is
     * kept as it was.
     *
     * @throws LogException when the sink is null, or the environment does not
     *                      name the remote collector
     */
    public void setOutput(OutputSink sink) {
        if (sink == null) {
            throw new LogException(LogException.Type.UNSUPPORTED_SINK, "not implemented");
        }
        switch (sink) {
            case STDERR -> {
                replaceHook(null);
                output = System.err;
            }
            case FLUENTBIT -> {
                LogConfig config = LogConfig.fromEnv(env);
                int port = config.requireFluentbitPort();
                replaceHook(new FluentbitForwarder(config.fluentbitHost(), port));
                RUNTIME_LOGGER.debug("forwarding log entries to fluentbit {}:{}", config.fluentbitHost(), port);
            }
        }
    }

    /**
     * Write local output to the given stream instead of standard error.
     */
    public void setOutput(OutputStream out) {
        if (out == null) {
            throw new LogException(LogException.Type.UNSUPPORTED_SINK, "output stream must not be null");
        }
        output = out;
    }

    /**
     * Install the formatter for the given format. A missing format leaves
     * logging in an unknown state, callers should treat the exception as fatal.
     *
     * @throws LogException when the format is null
     */
    public void setFormatter(OutputFormat format) {
        if (format == null) {
            throw new LogException(LogException.Type.UNSUPPORTED_FORMAT, "not implemented");
        }
        formatter = format.newFormatter();
    }

    public void setFormatter(EntryFormatter formatter) {
        if (formatter == null) {
            throw new LogException(LogException.Type.UNSUPPORTED_FORMAT, "formatter must not be null");
        }
        this.formatter = formatter;
    }

    public void setLevel(Level level) {
        if (level == null) {
            throw new LogException(LogException.Type.UNSUPPORTED_LEVEL, "level must not be null");
        }
        threshold = level;
    }

    public void setHook(LogHook hook) {
        replaceHook(hook);
    }

    private void replaceHook(LogHook replacement) {
        LogHook previous = hook;
        hook = replacement;
        if (previous != null && previous != replacement) {
            previous.close();
        }
    }

    public Level getLevel() {
        return threshold;
    }

    public EntryFormatter getFormatter() {
        return formatter;
    }

    public OutputStream getOutput() {
        return output;
    }

    public LogHook getHook() {
        return hook;
    }

    public boolean isEnabled(Level level) {
        return level.isEnabled(threshold);
    }

    OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    // ========== Emit ==========

    /**
     * Format and write one entry. Never throws: an entry that cannot be
     * encoded is dropped without output, write failures are left to the sink.
     */
    public void emit(LogEntry entry) {
        if (!isEnabled(entry.level())) {
            return;
        }
        LogHook h = hook;
        if (h != null) {
            try {
                h.fire(entry);
            } catch (RuntimeException | StackOverflowError e) {
                RUNTIME_LOGGER.debug("log hook failed: {}", e.getMessage());
            }
        }
        byte[] bytes;
        try {
            bytes = formatter.format(entry);
        } catch (RuntimeException | StackOverflowError e) {
            RUNTIME_LOGGER.debug("dropping log entry '{}': {}", entry.message(), e.getMessage());
            return;
        }
        if (bytes == null || bytes.length == 0) {
            return;
        }
        OutputStream out = output;
        synchronized (writeLock) {
            try {
                out.write(bytes);
                out.flush();
            } catch (IOException e) {
                RUNTIME_LOGGER.debug("failed to write log entry: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        replaceHook(null);
    }

    public static class Builder {

        private Clock clock = Clock.systemDefaultZone();
        private Map<String, String> env = System.getenv();
        private OutputStream output = System.err;
        private OutputFormat format = OutputFormat.TEXT;
        private Level level;

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder output(OutputStream output) {
            this.output = output;
            return this;
        }

        public Builder format(OutputFormat format) {
            if (format == null) {
                throw new LogException(LogException.Type.UNSUPPORTED_FORMAT, "not implemented");
            }
            this.format = format;
            return this;
        }

        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        public LogEngine build() {
            if (level == null) {
                Level configured = LogConfig.fromEnv(env).level();
                level = configured == null ? Level.INFO : configured;
            }
            return new LogEngine(this);
        }

    }

}
