package org.netpreserve.sitemirror.path;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Picks the first resolver in priority order that supports a link.
 */
public class PathResolverFactory {
    private static final Logger log = LoggerFactory.getLogger(PathResolverFactory.class);
    private final List<PathResolver> resolvers;

    public PathResolverFactory() {
        this(List.of(new IntraPageResolver(), new InterPageResolver(), new ExternalUrlResolver()));
    }

    public PathResolverFactory(List<PathResolver> resolvers) {
        for (PathResolver resolver : resolvers) {
            if (resolver.type() == ResolverType.FILESYSTEM) {
                throw new IllegalArgumentException("The filesystem resolver is only invoked explicitly");
            }
        }
        this.resolvers = List.copyOf(resolvers);
    }

    public @Nullable PathResolver select(PathContext context) {
        for (PathResolver resolver : resolvers) {
            if (resolver.supports(context)) return resolver;
        }
        return null;
    }

    /**
     * @return the resolved href, or null if no resolver claims the link
     */
    public @Nullable String resolve(PathContext context) {
        PathResolver resolver = select(context);
        if (resolver == null) {
            log.warn("No path resolver for link {} on page {}", context.href(), context.source().id());
            return null;
        }
        return resolver.resolve(context);
    }
}
