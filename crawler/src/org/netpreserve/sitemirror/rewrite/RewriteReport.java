package org.netpreserve.sitemirror.rewrite;

import java.util.Map;

/**
 * @param pages          saved pages that were scanned
 * @param linksRewritten hrefs whose value changed
 * @param failed         page ID to the reason its document couldn't be rewritten
 */
public record RewriteReport(int pages, int linksRewritten, Map<String, String> failed) {
    public RewriteReport {
        failed = failed == null ? Map.of() : Map.copyOf(failed);
    }
}
