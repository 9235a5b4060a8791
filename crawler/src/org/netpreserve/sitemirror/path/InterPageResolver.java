package org.netpreserve.sitemirror.path;

import org.netpreserve.sitemirror.blockid.BlockIdMapper;
import org.netpreserve.sitemirror.graph.PageNode;

import java.util.List;

/**
 * Relative links between two different mirrored pages.
 * <p>
 * With source segments S and target segments T sharing a common prefix of length c, the result is
 * {@code "../" × (|S| - c)}, then {@code T[c..]} joined by "/", then {@code index.html}, then an
 * optional {@code #anchor}.
 */
public class InterPageResolver implements PathResolver {
    static final String UP = "../";

    @Override
    public boolean supports(PathContext context) {
        PageNode target = context.target();
        if (target == null) return false;
        return isInternal(context.source()) && isInternal(target)
               && !context.source().id().equals(target.id());
    }

    private static boolean isInternal(PageNode node) {
        return !node.id().isBlank() && node.hasPathSegments();
    }

    @Override
    public String resolve(PathContext context) {
        PageNode target = context.target();
        String path = relativePath(context.source().pathSegments(), target.pathSegments());
        if (context.blockId() != null) {
            path += "#" + BlockIdMapper.formattedId(context.blockId(), context.blockMapOf(target));
        }
        return path;
    }

    static int commonPrefixLength(List<String> a, List<String> b) {
        int c = 0;
        while (c < a.size() && c < b.size() && a.get(c).equals(b.get(c))) {
            c++;
        }
        return c;
    }

    static String relativePath(List<String> source, List<String> target) {
        int common = commonPrefixLength(source, target);
        var path = new StringBuilder();
        for (int i = common; i < source.size(); i++) {
            path.append(UP);
        }
        for (int i = common; i < target.size(); i++) {
            path.append(target.get(i)).append('/');
        }
        return path.append(FilesystemResolver.INDEX_FILE).toString();
    }

    @Override
    public ResolverType type() {
        return ResolverType.INTER;
    }
}
