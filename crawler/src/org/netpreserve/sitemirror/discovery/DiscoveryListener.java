package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.graph.Edge;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageNode;

/**
 * Progress callbacks from {@link Discovery}. All methods default to no-ops.
 */
public interface DiscoveryListener {
    DiscoveryListener NONE = new DiscoveryListener() {
    };

    default void levelStarted(int depth, int pages) {
    }

    default void pageProbed(PageNode page, ProbeResult result) {
    }

    default void pageDiscovered(PageNode page) {
    }

    default void edgeRecorded(Edge edge) {
    }

    default void probeFailed(PageNode page, ProbeException e) {
    }

    default void discoveryFinished(PageGraph graph) {
    }
}
