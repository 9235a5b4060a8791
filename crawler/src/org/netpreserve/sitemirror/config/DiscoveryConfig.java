package org.netpreserve.sitemirror.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sitemirror.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * @param maxDepth     pages at this depth are kept but not expanded
 * @param probeTimeout how long to wait for a page to load while probing
 */
public record DiscoveryConfig(
        int maxDepth,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration probeTimeout
) {
    public DiscoveryConfig {
        if (maxDepth < 0) throw new IllegalArgumentException("discovery.maxDepth must not be negative");
        if (probeTimeout == null) probeTimeout = Duration.ofSeconds(60);
    }

    public DiscoveryConfig withMaxDepth(int maxDepth) {
        return new DiscoveryConfig(maxDepth, probeTimeout);
    }
}
