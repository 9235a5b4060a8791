package org.netpreserve.sitemirror.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.jackson.ShellCommandDeserializer;

import java.util.List;

/**
 * Browser used for both discovery and the workers.
 *
 * @param executable binary to invoke (e.g. "google-chrome-stable"), or null to search the usual names
 * @param options    command-line options, as a list or one shell-quoted string
 */
public record BrowserConfig(
        @Nullable String executable,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> options
) {
    public BrowserConfig {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
