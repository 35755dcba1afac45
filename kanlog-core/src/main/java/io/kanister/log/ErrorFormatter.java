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

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Splits an error into a message and a separate stack trace.
 * <p>
 * The detailed rendering of the error is cut right after the first place its
 * short message appears: text up to and including that match is the message,
 * everything that follows is the stack trace, later occurrences of the
 * message included. Older producers of this field kept only the text between
 * the first and second occurrence, so a trace that repeats the message reads
 * longer here. This is a plain string heuristic, log consumers rely on the
 * {@code stackTrace} field it produces.
 */
public final class ErrorFormatter {

    private ErrorFormatter() {
        // only static methods
    }

    public record ErrorParts(String message, String stackTrace) {

        static final ErrorParts EMPTY = new ErrorParts("", "");

    }

    public static ErrorParts format(Throwable t) {
        if (t == null) {
            return ErrorParts.EMPTY;
        }
        return split(detail(t), shortMessage(t));
    }

    public static ErrorParts split(String detailed, String shortMessage) {
        if (detailed == null) {
            return ErrorParts.EMPTY;
        }
        if (shortMessage == null || shortMessage.isEmpty()) {
            return new ErrorParts(detailed, "");
        }
        int pos = detailed.indexOf(shortMessage);
        if (pos == -1) {
            return new ErrorParts(detailed, "");
        }
        int end = pos + shortMessage.length();
        return new ErrorParts(detailed.substring(0, end), detailed.substring(end));
    }

    static String detail(Throwable t) {
        if (t instanceof DetailedError de) {
            String detail = de.detail();
            if (detail != null) {
                return detail;
            }
        }
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    static String shortMessage(Throwable t) {
        String message = t.getMessage();
        if (message == null || message.isEmpty()) {
            return t.toString();
        }
        return message;
    }

}
