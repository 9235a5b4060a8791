package org.netpreserve.sitemirror.rewrite;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.sitemirror.blockid.BlockIdMapper;
import org.netpreserve.sitemirror.blockid.BlockIds;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageIds;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.path.FilesystemResolver;
import org.netpreserve.sitemirror.path.PathContext;
import org.netpreserve.sitemirror.path.PathResolverFactory;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Rewrites the links in every saved page so the mirror browses offline. Links to other saved pages
 * become relative paths, same-page anchors are mapped to the IDs rendered on the page, and
 * everything else is made absolute so it still reaches the live site.
 */
public class LinkRewriter {
    private static final Logger log = LoggerFactory.getLogger(LinkRewriter.class);
    private final PageGraph graph;
    private final FilesystemResolver filesystem;
    private final PathResolverFactory resolvers;
    private final BlockIdMapper blockIdMapper;

    public LinkRewriter(PageGraph graph, FilesystemResolver filesystem) {
        this(graph, filesystem, new PathResolverFactory(), new BlockIdMapper());
    }

    public LinkRewriter(PageGraph graph, FilesystemResolver filesystem, PathResolverFactory resolvers,
                        BlockIdMapper blockIdMapper) {
        this.graph = graph;
        this.filesystem = filesystem;
        this.resolvers = resolvers;
        this.blockIdMapper = blockIdMapper;
    }

    public RewriteReport rewriteAll() {
        var blockMaps = new HashMap<String, Map<String, String>>();
        for (PageNode node : graph.nodes()) {
            if (isSaved(node)) {
                blockMaps.put(node.id(), blockIdMapper.load(filesystem.directoryOf(node)));
            }
        }

        int pages = 0;
        int rewritten = 0;
        var failed = new LinkedHashMap<String, String>();
        for (PageNode node : graph.nodes()) {
            if (!blockMaps.containsKey(node.id())) continue;
            try {
                rewritten += rewrite(node, blockMaps);
                pages++;
            } catch (IOException e) {
                log.warn("Failed to rewrite links in {}: {}", filesystem.outputFile(node), e.toString());
                failed.put(node.id(), e.toString());
            }
        }
        log.info("Rewrote {} links in {} pages", rewritten, pages);
        return new RewriteReport(pages, rewritten, failed);
    }

    /**
     * Rewrites one saved page in place.
     *
     * @return the number of hrefs changed
     */
    int rewrite(PageNode node, Map<String, Map<String, String>> blockMaps) throws IOException {
        Path file = filesystem.outputFile(node);
        Document doc = Jsoup.parse(file.toFile(), UTF_8.name(), node.url().toString());
        doc.outputSettings().prettyPrint(false);

        int changed = 0;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty()) continue;
            String replacement = resolve(node, href, a.absUrl("href"), blockMaps);
            if (replacement != null && !replacement.equals(href)) {
                log.trace("{}: {} -> {}", node.id(), href, replacement);
                a.attr("href", replacement);
                changed++;
            }
        }
        if (changed > 0) {
            Files.writeString(file, doc.outerHtml(), UTF_8);
        }
        return changed;
    }

    private @Nullable String resolve(PageNode source, String href, String absoluteHref,
                                     Map<String, Map<String, String>> blockMaps) {
        if (href.startsWith("#")) {
            return resolvers.resolve(new PathContext(source, null, href, null, blockMaps));
        }
        if (absoluteHref.isEmpty()) return null;
        Url url = new Url(absoluteHref);
        if (!url.isHttp() || !url.isValid()) return null;

        PageNode target = graph.node(PageIds.fromUrl(url));
        if (target != null && !blockMaps.containsKey(target.id())) {
            // never saved, so link to the live page instead
            target = null;
        }
        String fragment = url.fragment();
        String blockId = fragment != null && BlockIds.normalize(fragment) != null ? fragment : null;
        String resolved = resolvers.resolve(new PathContext(source, target,
                target == null ? url.toString() : href, blockId, blockMaps));
        if (resolved != null && target != null && fragment != null && blockId == null) {
            resolved += "#" + fragment;
        }
        return resolved;
    }

    private boolean isSaved(PageNode node) {
        return node.hasPathSegments() && Files.isRegularFile(filesystem.outputFile(node));
    }
}
