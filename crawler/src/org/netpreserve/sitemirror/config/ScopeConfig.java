package org.netpreserve.sitemirror.config;

import org.netpreserve.sitemirror.UrlMatcher;

import java.util.List;

/**
 * Which links discovery follows beyond the root URL's host.
 *
 * @param include rules for URLs to include
 * @param exclude rules for URLs to exclude (overrides includes)
 */
public record ScopeConfig(
        List<UrlMatcher> include,
        List<UrlMatcher> exclude
) {
    public ScopeConfig {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }
}
