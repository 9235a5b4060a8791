package org.netpreserve.sitemirror.pool;

import org.netpreserve.sitemirror.ipc.DownloadReport;
import org.netpreserve.sitemirror.ipc.ErrorInfo;

import java.util.Map;

/**
 * @param completed page ID to what was saved
 * @param failed    page ID to why it was given up on
 * @param retries   number of requeues after crashes or timeouts
 * @param crashes   number of worker crashes, including those of idle workers
 */
public record ExecutionReport(Map<String, DownloadReport> completed, Map<String, ErrorInfo> failed,
                              int retries, int crashes) {
    public ExecutionReport {
        completed = Map.copyOf(completed);
        failed = Map.copyOf(failed);
    }

    public int total() {
        return completed.size() + failed.size();
    }
}
