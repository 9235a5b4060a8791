package org.netpreserve.sitemirror.graph;

/**
 * Classification of a discovered link relative to the discovery tree.
 */
public enum EdgeType {
    /**
     * The link that first introduced its target. Only these create tree edges.
     */
    FORWARD,
    /**
     * A link to the page itself or to one of its ancestors.
     */
    BACK,
    /**
     * A link to an already registered page that is neither the source nor an ancestor.
     */
    CROSS
}
