package org.netpreserve.sitemirror.path;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.graph.PageNode;

import java.util.Map;
import java.util.Objects;

/**
 * One link to be resolved.
 *
 * @param source        the page containing the link
 * @param target        the registered page the link points to, or null if it isn't part of the mirror
 * @param href          the link as written (anchor-only) or its absolute URL
 * @param blockId       raw or dashed block ID to anchor to, if any
 * @param blockMapCache page ID to that page's block map
 */
public record PathContext(
        PageNode source,
        @Nullable PageNode target,
        @Nullable String href,
        @Nullable String blockId,
        Map<String, Map<String, String>> blockMapCache) {

    public PathContext {
        Objects.requireNonNull(source, "source");
        if (blockMapCache == null) blockMapCache = Map.of();
    }

    public PathContext(PageNode source, @Nullable PageNode target, @Nullable String href) {
        this(source, target, href, null, Map.of());
    }

    public boolean isAnchorOnly() {
        return href != null && href.startsWith("#");
    }

    public @Nullable Map<String, String> blockMapOf(@Nullable PageNode page) {
        return page == null ? null : blockMapCache.get(page.id());
    }
}
