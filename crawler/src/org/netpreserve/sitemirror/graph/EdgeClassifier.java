package org.netpreserve.sitemirror.graph;

import java.util.Objects;

/**
 * Classifies links found during discovery. Classification is metadata only and never changes the
 * shape of the tree.
 */
public class EdgeClassifier {
    private final PageGraph graph;

    public EdgeClassifier(PageGraph graph) {
        this.graph = graph;
    }

    /**
     * @param introducesTarget true when this link is the one that registered {@code target}
     */
    public EdgeClassification classify(PageNode source, PageNode target, boolean introducesTarget) {
        int depthDelta = target.depth() - source.depth();
        if (source.id().equals(target.id())) {
            return new EdgeClassification(EdgeType.BACK, 0, false);
        }
        if (isAncestor(target, source)) {
            return new EdgeClassification(EdgeType.BACK, depthDelta, true);
        }
        if (introducesTarget) {
            return new EdgeClassification(EdgeType.FORWARD, depthDelta, false);
        }
        return new EdgeClassification(EdgeType.CROSS, depthDelta, false);
    }

    /**
     * Walks the parent chain of {@code node} looking for {@code candidate}.
     */
    boolean isAncestor(PageNode candidate, PageNode node) {
        String parentId = node.parentId();
        while (parentId != null) {
            if (parentId.equals(candidate.id())) return true;
            PageNode parent = graph.node(parentId);
            parentId = parent == null ? null : parent.parentId();
            if (Objects.equals(parentId, node.id())) {
                throw new IllegalStateException("Cycle in parent chain at " + node.id());
            }
        }
        return false;
    }
}
