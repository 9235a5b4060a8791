package org.netpreserve.sitemirror.rewrite;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.netpreserve.sitemirror.graph.PageGraph;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.path.FilesystemResolver;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Checks a finished mirror for pages that won't browse offline: saved pages whose file is gone, and
 * links or stylesheets that still reach out to the network. Links to pages that were never saved
 * are counted too, since they lead back to the live site.
 */
public class IntegrityAuditor {
    private static final Logger log = LoggerFactory.getLogger(IntegrityAuditor.class);
    private static final int WARNINGS_PER_PAGE = 3;
    private final PageGraph graph;
    private final FilesystemResolver filesystem;
    private final Url rootUrl;

    public IntegrityAuditor(PageGraph graph, FilesystemResolver filesystem) {
        this.graph = graph;
        this.filesystem = filesystem;
        this.rootUrl = graph.root().url();
    }

    /**
     * @param savedPageIds pages the download phase reported as saved
     */
    public AuditReport audit(Collection<String> savedPageIds) {
        int pages = 0;
        int missing = 0;
        int liveLinks = 0;
        int stylesheets = 0;
        for (PageNode node : graph.nodes()) {
            if (!savedPageIds.contains(node.id())) continue;
            pages++;
            Path file = filesystem.outputFile(node);
            if (!Files.isRegularFile(file)) {
                log.error("Missing document for {} (expected at {})", node.title(), file);
                missing++;
                continue;
            }
            Document doc;
            try {
                doc = Jsoup.parse(file.toFile(), UTF_8.name(), node.url().toString());
            } catch (IOException e) {
                log.error("Unable to read document for {}: {}", node.title(), e.toString());
                missing++;
                continue;
            }
            liveLinks += countLiveLinks(node, doc);
            stylesheets += countExternalStylesheets(node, doc);
        }

        var report = new AuditReport(pages, missing, liveLinks, stylesheets);
        if (report.issues() == 0) {
            log.info("Integrity audit passed for {} pages", pages);
        } else {
            log.warn("Integrity audit found {} issues: {} missing documents, {} live links, {} external stylesheets",
                    report.issues(), missing, liveLinks, stylesheets);
        }
        return report;
    }

    private int countLiveLinks(PageNode node, Document doc) {
        int count = 0;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (!href.regionMatches(true, 0, "http", 0, 4)) continue;
            Url url = new Url(href);
            if (!url.isHttp() || !url.sameHost(rootUrl)) continue;
            if (++count <= WARNINGS_PER_PAGE) log.warn("Live site link in {}: {}", node.title(), href);
        }
        return count;
    }

    private int countExternalStylesheets(PageNode node, Document doc) {
        int count = 0;
        for (Element link : doc.select("link[rel=stylesheet][href]")) {
            String href = link.attr("href").trim();
            if (!href.regionMatches(true, 0, "http", 0, 4)) continue;
            if (++count <= WARNINGS_PER_PAGE) log.warn("External stylesheet in {}: {}", node.title(), href);
        }
        return count;
    }
}
