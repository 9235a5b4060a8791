package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.graph.EdgeClassification;
import org.netpreserve.sitemirror.graph.EdgeClassifier;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageIds;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the page tree by level-synchronous breadth-first search: every page at depth d is probed
 * before any page at depth d + 1.
 * <p>
 * A link to a page that is already registered, wherever it sits in the tree, only records a
 * classified edge. Only a link to an unregistered page creates a child, so the first link processed
 * wins and breadcrumb or navigation links can never re-parent a page.
 */
public class Discovery {
    private static final Logger log = LoggerFactory.getLogger(Discovery.class);
    private final PageProber prober;
    private final SiteScope scope;
    private final DiscoveryListener listener;

    public Discovery(PageProber prober, SiteScope scope, DiscoveryListener listener) {
        this.prober = prober;
        this.scope = scope;
        this.listener = listener;
    }

    /**
     * @param maxDepth pages at this depth are registered but not probed
     */
    public DiscoveryResult discover(Url rootUrl, int maxDepth) throws InterruptedException {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative");
        var graph = new PageGraph();
        var classifier = new EdgeClassifier(graph);
        var rootId = PageIds.fromUrl(rootUrl.withoutFragment());
        List<PageNode> level = List.of(graph.addRoot(rootId, rootUrl.withoutFragment()));

        for (int depth = 0; !level.isEmpty(); depth++) {
            if (depth >= maxDepth) {
                log.info("Reached max depth {}, leaving {} pages unexpanded", maxDepth, level.size());
                break;
            }
            listener.levelStarted(depth, level.size());
            log.info("Probing {} pages at depth {}", level.size(), depth);
            var nextLevel = new ArrayList<PageNode>();
            for (PageNode page : level) {
                expand(graph, classifier, page, nextLevel);
            }
            level = nextLevel;
        }

        graph.assignPathSegments();
        var stats = graph.stats();
        log.atInfo()
                .addKeyValue("pages", stats.pages())
                .addKeyValue("maxDepth", stats.maxDepth())
                .addKeyValue("edges", stats.edges())
                .log("Discovery finished");
        listener.discoveryFinished(graph);
        return new DiscoveryResult(graph, maxDepth);
    }

    private void expand(PageGraph graph, EdgeClassifier classifier, PageNode page, List<PageNode> nextLevel)
            throws InterruptedException {
        ProbeResult result;
        try {
            result = prober.probe(page.url());
        } catch (ProbeException e) {
            log.warn("Failed to probe {}: {}", page.url(), e.getMessage());
            page.setProbeError(e.getMessage());
            listener.probeFailed(page, e);
            return;
        }
        if (result.title() != null && !result.title().isBlank()) {
            page.setTitle(result.title().strip());
        }
        listener.pageProbed(page, result);

        for (OutLink link : result.links()) {
            Url url = link.url().withoutFragment();
            String id;
            try {
                if (!scope.inScope(url)) continue;
                id = PageIds.fromUrl(url);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed link {} on {}", link.url(), page.url());
                continue;
            }

            // the registry check comes first: links back to ancestors and already placed siblings
            // must only ever become edges
            PageNode existing = graph.node(id);
            if (existing != null) {
                recordEdge(graph, page, existing, classifier.classify(page, existing, false));
                continue;
            }

            PageNode child = graph.addChild(page, id, url, link.text());
            recordEdge(graph, page, child, classifier.classify(page, child, true));
            listener.pageDiscovered(child);
            log.debug("Discovered {} at depth {} under {}", url, child.depth(), page.id());
            nextLevel.add(child);
        }
    }

    private void recordEdge(PageGraph graph, PageNode source, PageNode target, EdgeClassification classification) {
        if (graph.addEdge(source, target, classification)) {
            listener.edgeRecorded(graph.edge(source.id(), target.id()));
        }
    }
}
