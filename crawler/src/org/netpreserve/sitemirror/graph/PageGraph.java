package org.netpreserve.sitemirror.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.FileNames;
import org.netpreserve.sitemirror.util.Json;
import org.netpreserve.sitemirror.util.Url;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * All discovered pages plus every classified link between them.
 * <p>
 * Nodes are stored by ID and refer to each other by ID, so the graph serializes as a flat list of
 * nodes and edges and can be rebuilt in another process. Built by discovery, read-only afterwards
 * apart from title annotations.
 */
public class PageGraph {
    private final Map<String, PageNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, Edge>> edges = new LinkedHashMap<>();
    private @Nullable String rootId;

    public PageNode addRoot(String id, Url url) {
        if (rootId != null) throw new IllegalStateException("Graph already has a root");
        var root = new PageNode(id, url, 0, null, null);
        register(root);
        rootId = id;
        return root;
    }

    /**
     * Registers a new child of {@code parent}. The caller must have checked that {@code id} is not
     * already registered; existing nodes are never re-parented.
     */
    public PageNode addChild(PageNode parent, String id, Url url, @Nullable String linkText) {
        if (nodes.get(parent.id()) != parent) throw new IllegalArgumentException("Unknown parent " + parent.id());
        var child = new PageNode(id, url, parent.depth() + 1, parent.id(), linkText);
        register(child);
        parent.addChild(id);
        return child;
    }

    private void register(PageNode node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new IllegalStateException("Page already registered: " + node.id());
        }
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public @Nullable PageNode node(String id) {
        return nodes.get(id);
    }

    public PageNode root() {
        if (rootId == null) throw new IllegalStateException("Graph has no root");
        return nodes.get(rootId);
    }

    /**
     * Nodes in registration order, which for a discovered graph is BFS order.
     */
    public Collection<PageNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public List<PageNode> children(PageNode node) {
        var children = new ArrayList<PageNode>(node.childIds().size());
        for (String childId : node.childIds()) {
            children.add(nodes.get(childId));
        }
        return children;
    }

    public @Nullable PageNode parent(PageNode node) {
        return node.parentId() == null ? null : nodes.get(node.parentId());
    }

    /**
     * Records a classified link. The first classification recorded for a (source, target) pair wins.
     *
     * @return false if the pair was already recorded
     */
    public boolean addEdge(PageNode source, PageNode target, EdgeClassification classification) {
        if (!contains(source.id()) || !contains(target.id())) {
            throw new IllegalArgumentException("Edge endpoints must be registered: " + source.id() + " -> " + target.id());
        }
        return edges.computeIfAbsent(source.id(), k -> new LinkedHashMap<>())
                .putIfAbsent(target.id(), new Edge(source.id(), target.id(), classification)) == null;
    }

    /**
     * IDs of every page linked from {@code sourceId}, in the order the links were found.
     */
    public Set<String> targets(String sourceId) {
        var out = edges.get(sourceId);
        return out == null ? Set.of() : Collections.unmodifiableSet(out.keySet());
    }

    public @Nullable Edge edge(String sourceId, String targetId) {
        var out = edges.get(sourceId);
        return out == null ? null : out.get(targetId);
    }

    public List<Edge> edges() {
        var all = new ArrayList<Edge>();
        for (var out : edges.values()) {
            all.addAll(out.values());
        }
        return all;
    }

    /**
     * Fixes each node's title and computes its path segments. Parents are handled before children
     * and siblings in discovery order, so colliding sibling names are suffixed in that order.
     */
    public void assignPathSegments() {
        var root = root();
        root.setTitle(root.displayTitle());
        root.assignPathSegments(List.of());
        var queue = new ArrayDeque<PageNode>();
        queue.add(root);
        while (!queue.isEmpty()) {
            var parent = queue.remove();
            var taken = new HashSet<>(FileNames.OUTPUT_FILES);
            for (var child : children(parent)) {
                String title = child.displayTitle();
                child.setTitle(title);
                var segments = new ArrayList<>(parent.pathSegments());
                segments.add(FileNames.unique(FileNames.sanitize(title), taken));
                child.assignPathSegments(segments);
                queue.add(child);
            }
        }
    }

    public Stats stats() {
        var edgeCounts = new EnumMap<EdgeType, Integer>(EdgeType.class);
        for (EdgeType type : EdgeType.values()) edgeCounts.put(type, 0);
        for (Edge edge : edges()) edgeCounts.merge(edge.type(), 1, Integer::sum);
        int maxDepth = 0;
        int failed = 0;
        for (PageNode node : nodes.values()) {
            maxDepth = Math.max(maxDepth, node.depth());
            if (node.probeError() != null) failed++;
        }
        return new Stats(nodes.size(), maxDepth, failed, edgeCounts);
    }

    public record Stats(int pages, int maxDepth, int probeFailures, Map<EdgeType, Integer> edges) {
    }

    private record Snapshot(String rootId, List<PageNode> nodes, List<Edge> edges) {
        @JsonCreator
        Snapshot(@JsonProperty("rootId") String rootId,
                 @JsonProperty("nodes") List<PageNode> nodes,
                 @JsonProperty("edges") List<Edge> edges) {
            this.rootId = rootId;
            this.nodes = nodes == null ? List.of() : nodes;
            this.edges = edges == null ? List.of() : edges;
        }
    }

    public String toJson() throws IOException {
        return Json.MAPPER.writerWithDefaultPrettyPrinter()
                .writeValueAsString(new Snapshot(root().id(), List.copyOf(nodes.values()), edges()));
    }

    /**
     * Rebuilds a graph from {@link #toJson()} output, checking the tree invariants on the way.
     *
     * @throws IOException if the JSON is malformed or describes an inconsistent tree
     */
    public static PageGraph fromJson(String json) throws IOException {
        var snapshot = Json.MAPPER.readValue(json, Snapshot.class);
        var graph = new PageGraph();
        for (PageNode node : snapshot.nodes()) {
            if (graph.nodes.putIfAbsent(node.id(), node) != null) {
                throw new IOException("Duplicate page " + node.id());
            }
        }
        if (snapshot.rootId() == null || !graph.nodes.containsKey(snapshot.rootId())) {
            throw new IOException("Missing root page " + snapshot.rootId());
        }
        graph.rootId = snapshot.rootId();
        for (PageNode node : graph.nodes.values()) {
            if (node.isRoot()) {
                if (!node.id().equals(graph.rootId)) throw new IOException("Second root " + node.id());
                continue;
            }
            PageNode parent = graph.nodes.get(node.parentId());
            if (parent == null || !parent.childIds().contains(node.id())) {
                throw new IOException("Page " + node.id() + " is not a child of its parent " + node.parentId());
            }
            if (node.depth() != parent.depth() + 1) {
                throw new IOException("Page " + node.id() + " has depth " + node.depth() + " under parent at depth " + parent.depth());
            }
        }
        for (Edge edge : snapshot.edges()) {
            PageNode source = graph.nodes.get(edge.source());
            PageNode target = graph.nodes.get(edge.target());
            if (source == null || target == null) throw new IOException("Dangling edge " + edge);
            graph.addEdge(source, target, edge.classification());
        }
        return graph;
    }

    public void write(Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.writeString(file, toJson());
    }

    public static PageGraph read(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }
}
