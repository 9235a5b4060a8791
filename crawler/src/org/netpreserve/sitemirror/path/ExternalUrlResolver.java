package org.netpreserve.sitemirror.path;

/**
 * Links to anything outside the mirror pass through untouched.
 */
public class ExternalUrlResolver implements PathResolver {
    @Override
    public boolean supports(PathContext context) {
        return context.href() != null && (context.target() == null || context.target().id().isBlank());
    }

    @Override
    public String resolve(PathContext context) {
        return context.href();
    }

    @Override
    public ResolverType type() {
        return ResolverType.EXTERNAL;
    }
}
