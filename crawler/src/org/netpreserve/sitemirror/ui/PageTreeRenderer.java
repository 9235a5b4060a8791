package org.netpreserve.sitemirror.ui;

import org.netpreserve.sitemirror.graph.EdgeType;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws the discovered hierarchy for the user to review:
 * <pre>
 * [L0] Home
 * ├─ [L1] Docs
 * │  └─ [L2] Install
 * └─ [L1] Blog (probe failed: timeout)
 * </pre>
 */
public class PageTreeRenderer {
    private static final String BRANCH = "├─ ";
    private static final String LAST_BRANCH = "└─ ";
    private static final String PIPE = "│  ";
    private static final String SPACE = "   ";

    public List<String> renderLines(PageGraph graph) {
        var lines = new ArrayList<String>();
        PageNode root = graph.root();
        lines.add(label(root));
        List<PageNode> children = graph.children(root);
        for (int i = 0; i < children.size(); i++) {
            renderNode(graph, children.get(i), "", i == children.size() - 1, lines);
        }
        return lines;
    }

    private void renderNode(PageGraph graph, PageNode node, String prefix, boolean last, List<String> lines) {
        lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(node));
        String childPrefix = prefix + (last ? SPACE : PIPE);
        List<PageNode> children = graph.children(node);
        for (int i = 0; i < children.size(); i++) {
            renderNode(graph, children.get(i), childPrefix, i == children.size() - 1, lines);
        }
    }

    private static String label(PageNode node) {
        String label = "[L" + node.depth() + "] " + node.displayTitle();
        if (node.probeError() != null) {
            label += " (probe failed: " + node.probeError() + ")";
        }
        return label;
    }

    public String summary(PageGraph graph) {
        var stats = graph.stats();
        return String.format("%d pages, max depth %d, %d probe failures, links: %d forward, %d back, %d cross",
                stats.pages(), stats.maxDepth(), stats.probeFailures(),
                stats.edges().getOrDefault(EdgeType.FORWARD, 0),
                stats.edges().getOrDefault(EdgeType.BACK, 0),
                stats.edges().getOrDefault(EdgeType.CROSS, 0));
    }

    public String render(PageGraph graph) {
        return String.join("\n", renderLines(graph)) + "\n" + summary(graph) + "\n";
    }
}
