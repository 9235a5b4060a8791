package org.netpreserve.sitemirror.discovery;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * @param links outbound links in page order
 */
public record ProbeResult(@Nullable String title, List<OutLink> links) {
    public ProbeResult {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
