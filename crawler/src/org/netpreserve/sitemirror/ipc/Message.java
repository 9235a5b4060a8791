package org.netpreserve.sitemirror.ipc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.util.Url;

import java.nio.file.Path;
import java.util.List;

/**
 * Payloads of the worker protocol. Each record validates itself on construction, so a payload
 * that decodes is a payload that is well-formed.
 */
public sealed interface Message {
    MessageType type();

    private static String require(@Nullable String value, String name) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " is required");
        return value;
    }

    /**
     * @param browserOptions      extra browser command-line options
     * @param navigationTimeoutMs page load timeout for each download
     */
    record Init(String workerId, @Nullable String browserExecutable, List<String> browserOptions,
                long navigationTimeoutMs) implements Message {
        public Init {
            require(workerId, "workerId");
            browserOptions = browserOptions == null ? List.of() : List.copyOf(browserOptions);
            if (navigationTimeoutMs <= 0) throw new IllegalArgumentException("navigationTimeoutMs must be positive");
        }

        @Override
        public MessageType type() {
            return MessageType.INIT;
        }
    }

    record SetCookies(List<Cookie> cookies) implements Message {
        public SetCookies {
            if (cookies == null) throw new IllegalArgumentException("cookies is required");
            cookies = List.copyOf(cookies);
        }

        @Override
        public MessageType type() {
            return MessageType.SET_COOKIES;
        }
    }

    /**
     * @param savePath absolute path of the document to write
     */
    record Download(String taskId, Url url, String pageId, String savePath, List<Cookie> cookies) implements Message {
        public Download {
            require(taskId, "taskId");
            if (url == null || !url.isValid()) throw new IllegalArgumentException("url must be absolute: " + url);
            require(pageId, "pageId");
            require(savePath, "savePath");
            if (!Path.of(savePath).isAbsolute()) throw new IllegalArgumentException("savePath must be absolute: " + savePath);
            cookies = cookies == null ? List.of() : List.copyOf(cookies);
        }

        @Override
        public MessageType type() {
            return MessageType.DOWNLOAD;
        }
    }

    record Shutdown() implements Message {
        @Override
        public MessageType type() {
            return MessageType.SHUTDOWN;
        }
    }

    record Ready(String workerId, @Nullable String browserVersion) implements Message {
        public Ready {
            require(workerId, "workerId");
        }

        @Override
        public MessageType type() {
            return MessageType.READY;
        }
    }

    /**
     * Exactly one of {@code data} and {@code error} is present.
     */
    record Result(String taskId, MessageType taskType, @Nullable DownloadReport data,
                  @Nullable ErrorInfo error) implements Message {
        public Result {
            require(taskId, "taskId");
            if (taskType == null) throw new IllegalArgumentException("taskType is required");
            if ((data == null) == (error == null)) {
                throw new IllegalArgumentException("exactly one of data and error is required");
            }
        }

        public static Result success(String taskId, DownloadReport data) {
            return new Result(taskId, MessageType.DOWNLOAD, data, null);
        }

        public static Result failure(String taskId, ErrorInfo error) {
            return new Result(taskId, MessageType.DOWNLOAD, null, error);
        }

        @JsonIgnore
        public boolean isSuccess() {
            return error == null;
        }

        @Override
        public MessageType type() {
            return MessageType.RESULT;
        }
    }
}
