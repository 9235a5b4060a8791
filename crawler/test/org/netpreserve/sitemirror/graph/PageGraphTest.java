package org.netpreserve.sitemirror.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sitemirror.util.Url;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PageGraphTest {
    private static final String ROOT_ID = "0123456789abcdef0123456789abcdef";

    private static PageGraph sampleGraph() {
        var graph = new PageGraph();
        var root = graph.addRoot(ROOT_ID, new Url("https://notes.test/Home-" + ROOT_ID));
        root.setTitle("Home");
        var week1 = graph.addChild(root, "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa",
                new Url("https://notes.test/Week-1-aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"), "Week 1");
        var lab = graph.addChild(week1, "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb",
                new Url("https://notes.test/Lab-bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"), null);
        lab.setTitle("Lab: Sockets?");
        graph.addEdge(root, week1, new EdgeClassification(EdgeType.FORWARD, 1, false));
        graph.addEdge(week1, lab, new EdgeClassification(EdgeType.FORWARD, 1, false));
        graph.addEdge(lab, root, new EdgeClassification(EdgeType.BACK, -2, true));
        return graph;
    }

    @Test
    public void testNodesAreInRegistrationOrder() {
        var graph = sampleGraph();
        assertEquals(List.of(ROOT_ID, "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"),
                graph.nodes().stream().map(PageNode::id).toList());
        assertEquals(3, graph.size());
        assertEquals(graph.root(), graph.parent(graph.node("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa")));
        assertNull(graph.parent(graph.root()));
    }

    @Test
    public void testRegisteringTwiceFails() {
        var graph = sampleGraph();
        assertThrows(IllegalStateException.class, () -> graph.addChild(graph.root(),
                "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", new Url("https://notes.test/other"), null));
        assertThrows(IllegalStateException.class, () -> graph.addRoot("x", new Url("https://notes.test/x")));
    }

    @Test
    public void testFirstEdgeClassificationWins() {
        var graph = sampleGraph();
        var root = graph.root();
        var week1 = graph.node("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa");
        assertFalse(graph.addEdge(root, week1, new EdgeClassification(EdgeType.CROSS, 1, false)));
        assertEquals(EdgeType.FORWARD, graph.edge(ROOT_ID, week1.id()).type());
        assertEquals(List.of(week1.id()), List.copyOf(graph.targets(ROOT_ID)));
        assertTrue(graph.targets("unknown").isEmpty());
    }

    @Test
    public void testAssignPathSegments() {
        var graph = sampleGraph();
        graph.assignPathSegments();
        assertEquals(List.of(), graph.root().pathSegments());
        assertEquals(List.of("Week_1"), graph.node("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa").pathSegments());
        assertEquals(List.of("Week_1", "Lab_Sockets"), graph.node("bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb").pathSegments());
        // link text is promoted to the title of a page that was never probed
        assertEquals("Week 1", graph.node("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa").title());
    }

    @Test
    public void testCollidingSiblingsAreSuffixedInDiscoveryOrder() {
        var graph = new PageGraph();
        var root = graph.addRoot("r", new Url("https://site.test/"));
        var first = graph.addChild(root, "1", new Url("https://site.test/a"), "Notes");
        var second = graph.addChild(root, "2", new Url("https://site.test/b"), "notes");
        var third = graph.addChild(root, "3", new Url("https://site.test/c"), "Notes");
        var nested = graph.addChild(first, "4", new Url("https://site.test/a/notes"), "Notes");
        graph.assignPathSegments();

        assertEquals(List.of("Notes"), first.pathSegments());
        assertEquals(List.of("notes_2"), second.pathSegments());
        assertEquals(List.of("Notes_3"), third.pathSegments());
        // names only need to be unique among siblings
        assertEquals(List.of("Notes", "Notes"), nested.pathSegments());
    }

    @Test
    public void testSegmentsNeverShadowOutputFiles() {
        var graph = new PageGraph();
        var root = graph.addRoot("r", new Url("https://site.test/"));
        root.setTitle("Home");
        var index = graph.addChild(root, "1", new Url("https://site.test/a"), "index.html");
        var upper = graph.addChild(root, "2", new Url("https://site.test/b"), "INDEX.HTML");
        var snapshot = graph.addChild(root, "3", new Url("https://site.test/c"), "site-graph.json");
        graph.assignPathSegments();

        assertEquals(List.of("index.html_2"), index.pathSegments());
        assertEquals(List.of("INDEX.HTML_3"), upper.pathSegments());
        assertEquals(List.of("site-graph.json_2"), snapshot.pathSegments());
    }

    @Test
    public void testTitleFallsBackToSlugThenUntitled() {
        var graph = new PageGraph();
        var root = graph.addRoot("r", new Url("https://site.test/"));
        var slugged = graph.addChild(root, "cccccccccccccccccccccccccccccccc",
                new Url("https://site.test/Getting-Started-cccccccccccccccccccccccccccccccc"), " ");
        var bare = graph.addChild(root, "dddddddddddddddddddddddddddddddd",
                new Url("https://site.test/dddddddddddddddddddddddddddddddd"), null);
        graph.assignPathSegments();

        assertEquals("Getting Started", slugged.title());
        assertEquals(List.of("Getting_Started"), slugged.pathSegments());
        assertEquals("Untitled", bare.title());
        assertEquals("Untitled", root.title());
    }

    @Test
    public void testPathSegmentsRequireAssignment() {
        var graph = sampleGraph();
        assertFalse(graph.root().hasPathSegments());
        assertThrows(IllegalStateException.class, () -> graph.root().pathSegments());
    }

    @Test
    public void testStats() {
        var graph = sampleGraph();
        graph.node("bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb").setProbeError("timeout");
        var stats = graph.stats();
        assertEquals(3, stats.pages());
        assertEquals(2, stats.maxDepth());
        assertEquals(1, stats.probeFailures());
        assertEquals(2, stats.edges().get(EdgeType.FORWARD));
        assertEquals(1, stats.edges().get(EdgeType.BACK));
        assertEquals(0, stats.edges().get(EdgeType.CROSS));
    }

    @Test
    public void testSnapshotRestoresTreeAndEdges(@TempDir Path tempDir) throws IOException {
        var graph = sampleGraph();
        graph.assignPathSegments();
        Path file = tempDir.resolve("graph/site-graph.json");
        graph.write(file);

        var copy = PageGraph.read(file);
        assertEquals(ROOT_ID, copy.root().id());
        assertEquals(3, copy.size());
        var lab = copy.node("bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb");
        assertEquals(2, lab.depth());
        assertEquals("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa", lab.parentId());
        assertEquals("Lab: Sockets?", lab.title());
        assertEquals(List.of("Week_1", "Lab_Sockets"), lab.pathSegments());
        assertEquals(new Url("https://notes.test/Lab-bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"), lab.url());
        assertEquals(List.of("bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb"),
                copy.node("aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa").childIds());

        var back = copy.edge(lab.id(), ROOT_ID);
        assertNotNull(back);
        assertEquals(new EdgeClassification(EdgeType.BACK, -2, true), back.classification());
        assertEquals(graph.edges(), copy.edges());
    }

    @Test
    public void testSnapshotWithInconsistentDepthIsRejected() throws IOException {
        String json = sampleGraph().toJson();
        String tampered = json.replaceFirst("\"depth\" : 1", "\"depth\" : 3");
        assertNotEquals(json, tampered);
        assertThrows(IOException.class, () -> PageGraph.fromJson(tampered));
    }

    @Test
    public void testSnapshotWithoutRootIsRejected() {
        assertThrows(IOException.class, () -> PageGraph.fromJson("{\"rootId\":\"x\",\"nodes\":[],\"edges\":[]}"));
    }
}
