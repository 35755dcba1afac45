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

import java.util.Map;

/**
 * Settings read from the environment.
 *
 * @param fluentbitHost value of {@value #LOGGING_SERVICE_HOST_ENV}, null when unset
 * @param fluentbitPort value of {@value #LOGGING_SERVICE_PORT_ENV}, null when unset
 * @param level         value of {@value #LOG_LEVEL_ENV}, null when unset or not a level
 */
public record LogConfig(String fluentbitHost, String fluentbitPort, Level level) {

    public static final String LOGGING_SERVICE_HOST_ENV = "LOGGING_SVC_SERVICE_HOST";
    public static final String LOGGING_SERVICE_PORT_ENV = "LOGGING_SVC_SERVICE_PORT_LOGGING";
    public static final String LOG_LEVEL_ENV = "LOG_LEVEL";

    public static LogConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static LogConfig fromEnv(Map<String, String> env) {
        String host = env.get(LOGGING_SERVICE_HOST_ENV);
        String port = env.get(LOGGING_SERVICE_PORT_ENV);
        Level level = null;
        String raw = env.get(LOG_LEVEL_ENV);
        if (raw != null && !raw.isBlank()) {
            try {
                level = Level.parse(raw);
            } catch (LogException e) {
                LogEngine.RUNTIME_LOGGER.warn("ignoring {}: {}", LOG_LEVEL_ENV, e.getMessage());
            }
        }
        return new LogConfig(host, port, level);
    }

    /**
     * Resolve the collector port.
     *
     * @throws LogException when the host or the port is missing, or the port is not a number
     */
    public int requireFluentbitPort() {
        if (fluentbitHost == null) {
            throw new LogException(LogException.Type.MISSING_ENV, "Unable to find Fluentbit host address");
        }
        if (fluentbitPort == null) {
            throw new LogException(LogException.Type.MISSING_ENV, "Unable to find Fluentbit logging port");
        }
        try {
            int port = Integer.parseInt(fluentbitPort.trim());
            if (port < 1 || port > 65535) {
                throw new NumberFormatException("out of range");
            }
            return port;
        } catch (NumberFormatException e) {
            throw new LogException(LogException.Type.MISSING_ENV,
                    "Invalid Fluentbit logging port " + LOGGING_SERVICE_PORT_ENV + "=" + fluentbitPort, e);
        }
    }

}
