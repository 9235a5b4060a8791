package org.netpreserve.sitemirror.path;

/**
 * Computes the href a saved page should use for one link.
 */
public interface PathResolver {
    boolean supports(PathContext context);

    /**
     * Only called when {@link #supports(PathContext)} returned true.
     */
    String resolve(PathContext context);

    ResolverType type();
}
