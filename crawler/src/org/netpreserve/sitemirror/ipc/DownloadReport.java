package org.netpreserve.sitemirror.ipc;

/**
 * What a worker saved for one page.
 *
 * @param bytes    size of the saved document
 * @param blockIds number of block anchors found in it
 */
public record DownloadReport(String pageId, String savePath, long bytes, int blockIds) {
}
