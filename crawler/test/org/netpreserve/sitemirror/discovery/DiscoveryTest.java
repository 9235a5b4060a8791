package org.netpreserve.sitemirror.discovery;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitemirror.UrlMatcher;
import org.netpreserve.sitemirror.config.ScopeConfig;
import org.netpreserve.sitemirror.graph.EdgeType;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.util.Url;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class DiscoveryTest {
    private static final String R = "https://site.test/";
    private static final String A = "https://site.test/a";
    private static final String B = "https://site.test/b";
    private static final String C = "https://site.test/c";
    private static final String D = "https://site.test/d";

    /**
     * R links to A and B. A links back to R, across to B, and down to C. B links across to A and
     * down to D.
     */
    private static FakeProber site() {
        return new FakeProber()
                .page(R, "Root", "/a", "/b")
                .page(A, "Page A", "/", "/b", "/c")
                .page(B, "Page B", "/a", "/d")
                .page(C, "Page C")
                .page(D, "Page D");
    }

    private static DiscoveryResult discover(PageProber prober, int maxDepth) throws InterruptedException {
        var discovery = new Discovery(prober, new SiteScope(new Url(R), new ScopeConfig(null, null)),
                DiscoveryListener.NONE);
        return discovery.discover(new Url(R), maxDepth);
    }

    private static List<String> ids(List<PageNode> nodes) {
        return nodes.stream().map(PageNode::id).toList();
    }

    @Test
    public void testBreadthFirstTree() throws InterruptedException {
        var prober = site();
        PageGraph graph = discover(prober, 10).graph();

        assertEquals(List.of(R, A, B, C, D), prober.probed());
        assertEquals(5, graph.size());
        assertEquals(List.of(A, B), ids(graph.children(graph.root())));
        assertEquals(List.of(C), ids(graph.children(graph.node(A))));
        assertEquals(List.of(D), ids(graph.children(graph.node(B))));
        assertEquals(2, graph.node(C).depth());
        assertEquals("Page A", graph.node(A).title());
    }

    @Test
    public void testDifferentlySpelledLinksRegisterOnePage() throws InterruptedException {
        var prober = new FakeProber()
                .page(R, "Root", "/a", "https://SITE.test/a", "https://site.test:443/a")
                .page(A, "Page A");
        PageGraph graph = discover(prober, 10).graph();

        assertEquals(List.of(R, A), prober.probed());
        assertEquals(2, graph.size());
        assertEquals(List.of(A), ids(graph.children(graph.root())));
        assertEquals(1, graph.edges().size());
    }

    @Test
    public void testLinksToRegisteredPagesOnlyBecomeEdges() throws InterruptedException {
        PageGraph graph = discover(site(), 10).graph();

        // B stays under R although A also links to it, and A isn't re-parented under B
        assertEquals(R, graph.node(B).parentId());
        assertEquals(R, graph.node(A).parentId());

        var back = graph.edge(A, R);
        assertEquals(EdgeType.BACK, back.type());
        assertTrue(back.classification().ancestor());
        assertEquals(EdgeType.CROSS, graph.edge(A, B).type());
        assertEquals(EdgeType.CROSS, graph.edge(B, A).type());
        assertEquals(EdgeType.FORWARD, graph.edge(A, C).type());
        assertEquals(7, graph.edges().size());
    }

    @Test
    public void testTreeInvariants() throws InterruptedException {
        var prober = new FakeProber()
                .page(R, "Root", "/a", "/b", "/a#section", "/b?utm=1")
                .page(A, "A", "/b", "/c", "/", "/c")
                .page(B, "B", "/c", "/a", "/d")
                .page(C, "C", "/d", "/a", "/")
                .page(D, "D", "/c", "/b", "/");
        PageGraph graph = discover(prober, 10).graph();

        var seen = new HashSet<String>();
        for (PageNode node : graph.nodes()) {
            assertTrue(seen.add(node.id()), "duplicate " + node.id());
            PageNode parent = graph.parent(node);
            if (node == graph.root()) {
                assertNull(parent);
            } else {
                assertEquals(parent.depth() + 1, node.depth());
                assertTrue(parent.childIds().contains(node.id()));
            }
        }
        assertEquals(5, graph.size());
        // every page was probed exactly once
        assertEquals(5, prober.probed().size());
    }

    @Test
    public void testMaxDepthRegistersButDoesNotProbe() throws InterruptedException {
        var prober = site();
        PageGraph graph = discover(prober, 1).graph();

        assertEquals(List.of(R), prober.probed());
        assertEquals(3, graph.size());
        assertNull(graph.node(A).probeError());
        // unprobed pages are titled from the link that introduced them
        assertEquals("link to /a", graph.node(A).title());
    }

    @Test
    public void testMaxDepthZeroKeepsOnlyTheRoot() throws InterruptedException {
        var prober = site();
        var result = discover(prober, 0);

        assertEquals(List.of(), prober.probed());
        assertEquals(1, result.graph().size());
        assertFalse(result.isEmpty());
    }

    @Test
    public void testProbeFailureLeavesLeafAndContinues() throws InterruptedException {
        var prober = new FakeProber()
                .page(R, "Root", "/a", "/b")
                .page(B, "Page B", "/d")
                .page(D, "Page D");
        PageGraph graph = discover(prober, 10).graph();

        assertEquals(List.of(R, A, B, D), prober.probed());
        assertEquals("net::ERR_NAME_NOT_RESOLVED", graph.node(A).probeError());
        assertTrue(graph.node(A).childIds().isEmpty());
        assertEquals(1, graph.stats().probeFailures());
        assertTrue(graph.node(A).hasPathSegments());
    }

    @Test
    public void testRootFailureGivesEmptyResult() throws InterruptedException {
        var result = discover(new FakeProber(), 10);
        assertTrue(result.isEmpty());
        assertThrows(IllegalStateException.class, result::confirm);
        assertFalse(result.isConfirmed());
    }

    @Test
    public void testOutOfScopeLinksAreIgnored() throws InterruptedException {
        var prober = new FakeProber()
                .page(R, "Root", "/a", "https://elsewhere.test/x", "mailto:someone@site.test", "https://docs.site.test/y")
                .page(A, "A");
        PageGraph graph = discover(prober, 10).graph();
        assertEquals(2, graph.size());
        assertNull(graph.node("https://elsewhere.test/x"));

        var scoped = new Discovery(prober, new SiteScope(new Url(R),
                new ScopeConfig(List.of(new UrlMatcher.Domain("site.test")), List.of(new UrlMatcher.Regex(".*/a")))),
                DiscoveryListener.NONE);
        PageGraph domainGraph = scoped.discover(new Url(R), 1).graph();
        assertNotNull(domainGraph.node("https://docs.site.test/y"));
        assertNull(domainGraph.node(A));
    }

    @Test
    public void testSiblingTitleCollisionsGetSuffixes() throws InterruptedException {
        var prober = new FakeProber()
                .page(R, "Root", "/a", "/b", "/c")
                .page(A, "Notes")
                .page(B, "Notes")
                .page(C, "NOTES");
        PageGraph graph = discover(prober, 10).graph();
        assertEquals(List.of("Notes"), graph.node(A).pathSegments());
        assertEquals(List.of("Notes_2"), graph.node(B).pathSegments());
        assertEquals(List.of("NOTES_3"), graph.node(C).pathSegments());
    }

    @Test
    public void testListenerSeesProgress() throws InterruptedException {
        var listener = mock(DiscoveryListener.class);
        var prober = new FakeProber()
                .page(R, "Root", "/a", "/b")
                .page(B, "Page B");
        var discovery = new Discovery(prober, new SiteScope(new Url(R), new ScopeConfig(null, null)), listener);
        discovery.discover(new Url(R), 10);

        verify(listener).levelStarted(0, 1);
        verify(listener).levelStarted(1, 2);
        verify(listener, times(2)).pageDiscovered(any());
        verify(listener, times(2)).pageProbed(any(), any());
        verify(listener).probeFailed(any(), any());
        verify(listener, times(2)).edgeRecorded(any());
        verify(listener).discoveryFinished(any());
    }
}
