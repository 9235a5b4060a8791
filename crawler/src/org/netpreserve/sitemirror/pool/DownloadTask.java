package org.netpreserve.sitemirror.pool;

import org.netpreserve.sitemirror.util.Url;

import java.nio.file.Path;

/**
 * One page to download. The save path was fixed during planning and never changes across retries.
 *
 * @param attempt 1 for the first try, incremented on each requeue
 */
public record DownloadTask(String pageId, Url url, Path savePath, int attempt) {
    public DownloadTask {
        if (!savePath.isAbsolute()) throw new IllegalArgumentException("savePath must be absolute: " + savePath);
        if (attempt < 1) throw new IllegalArgumentException("attempt must be positive");
    }

    public DownloadTask nextAttempt() {
        return new DownloadTask(pageId, url, savePath, attempt + 1);
    }
}
