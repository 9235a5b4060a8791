package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageNode;

/**
 * The outcome of discovery. Execution only accepts a result that has been {@link #confirm() confirmed}.
 */
public class DiscoveryResult {
    private final PageGraph graph;
    private final int maxDepth;
    private volatile boolean confirmed;

    public DiscoveryResult(PageGraph graph, int maxDepth) {
        this.graph = graph;
        this.maxDepth = maxDepth;
    }

    public PageGraph graph() {
        return graph;
    }

    public PageNode rootTree() {
        return graph.root();
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * True when not even the root page could be probed.
     */
    public boolean isEmpty() {
        return graph.size() <= 1 && graph.root().probeError() != null;
    }

    public void confirm() {
        if (isEmpty()) throw new IllegalStateException("Cannot confirm an empty discovery");
        confirmed = true;
    }

    public boolean isConfirmed() {
        return confirmed;
    }
}
