package org.netpreserve.sitemirror.path;

import org.netpreserve.sitemirror.graph.PageNode;

import java.nio.file.Path;

/**
 * Where each page is saved: {@code <outputRoot>/<path segments>/index.html}.
 * <p>
 * Never chosen by {@link PathResolverFactory}; callers ask it directly. As a {@link PathResolver} it
 * resolves the source page's own file relative to the output root.
 */
public class FilesystemResolver implements PathResolver {
    public static final String INDEX_FILE = "index.html";
    private final Path outputRoot;

    public FilesystemResolver(Path outputRoot) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
    }

    public Path outputRoot() {
        return outputRoot;
    }

    public Path directoryOf(PageNode node) {
        Path dir = outputRoot;
        for (String segment : node.pathSegments()) {
            dir = dir.resolve(segment);
        }
        return dir;
    }

    public Path outputFile(PageNode node) {
        return directoryOf(node).resolve(INDEX_FILE);
    }

    @Override
    public boolean supports(PathContext context) {
        return context.source().hasPathSegments();
    }

    @Override
    public String resolve(PathContext context) {
        var path = new StringBuilder();
        for (String segment : context.source().pathSegments()) {
            path.append(segment).append('/');
        }
        return path.append(INDEX_FILE).toString();
    }

    @Override
    public ResolverType type() {
        return ResolverType.FILESYSTEM;
    }
}
