package org.netpreserve.sitemirror.path;

import org.netpreserve.sitemirror.blockid.BlockIdMapper;
import org.netpreserve.sitemirror.blockid.BlockIds;
import org.netpreserve.sitemirror.graph.PageNode;

/**
 * Links within the same page: anchor-only hrefs, or links whose target is the source page.
 */
public class IntraPageResolver implements PathResolver {
    @Override
    public boolean supports(PathContext context) {
        if (context.isAnchorOnly()) return true;
        return context.target() != null && context.source().id().equals(context.target().id());
    }

    @Override
    public String resolve(PathContext context) {
        PageNode page = context.target() != null ? context.target() : context.source();
        if (context.isAnchorOnly()) {
            String fragment = context.href().substring(1);
            if (BlockIds.normalize(fragment) == null) {
                // ordinary named anchor
                return context.href();
            }
            return "#" + BlockIdMapper.formattedId(fragment, context.blockMapOf(page));
        }
        if (context.blockId() == null) return "";
        return "#" + BlockIdMapper.formattedId(context.blockId(), context.blockMapOf(page));
    }

    @Override
    public ResolverType type() {
        return ResolverType.INTRA;
    }
}
