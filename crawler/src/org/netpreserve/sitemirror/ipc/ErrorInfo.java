package org.netpreserve.sitemirror.ipc;

import org.jetbrains.annotations.Nullable;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * A task failure as it crosses the process boundary.
 *
 * @param type the exception class name
 */
public record ErrorInfo(String type, @Nullable String message, @Nullable String stackTrace) {
    public ErrorInfo {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("error type is required");
    }

    public static ErrorInfo of(Throwable throwable) {
        var writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return new ErrorInfo(throwable.getClass().getName(), throwable.getMessage(), writer.toString());
    }

    public static ErrorInfo of(String type, String message) {
        return new ErrorInfo(type, message, null);
    }

    @Override
    public String toString() {
        return message == null ? type : type + ": " + message;
    }
}
