package org.netpreserve.sitemirror.graph;

/**
 * @param depthDelta target depth minus source depth
 * @param ancestor   whether the target is a proper ancestor of the source
 */
public record EdgeClassification(EdgeType type, int depthDelta, boolean ancestor) {
}
