package org.netpreserve.sitemirror.rewrite;

/**
 * @param pages               saved pages that were checked
 * @param missingFiles        saved pages whose document is missing or unreadable
 * @param residualLiveLinks   hrefs still pointing at the live site host
 * @param externalStylesheets stylesheets still loaded over http(s)
 */
public record AuditReport(int pages, int missingFiles, int residualLiveLinks, int externalStylesheets) {
    public int issues() {
        return missingFiles + residualLiveLinks + externalStylesheets;
    }
}
