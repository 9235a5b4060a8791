package org.netpreserve.sitemirror.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A classified link between two registered pages, identified by page ID.
 */
public record Edge(String source, String target, EdgeClassification classification) {
    @JsonIgnore
    public EdgeType type() {
        return classification.type();
    }
}
