package org.netpreserve.sitemirror.ui;

import org.netpreserve.sitemirror.discovery.DiscoveryListener;
import org.netpreserve.sitemirror.discovery.ProbeException;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.ipc.DownloadReport;
import org.netpreserve.sitemirror.ipc.ErrorInfo;
import org.netpreserve.sitemirror.pool.DownloadTask;
import org.netpreserve.sitemirror.pool.ExecutionListener;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Prints one line per notable event of a run.
 */
public class ProgressReporter implements DiscoveryListener, ExecutionListener {
    private final PrintStream out;
    private int total;
    private int done;

    public ProgressReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void levelStarted(int depth, int pages) {
        out.printf("Discovering level %d (%d %s)%n", depth, pages, pages == 1 ? "page" : "pages");
    }

    @Override
    public void probeFailed(PageNode page, ProbeException e) {
        out.printf("  ! %s: %s%n", page.url(), e.getMessage());
    }

    /**
     * Sets the denominator of the download counter.
     */
    public void executionStarted(int tasks) {
        total = tasks;
        done = 0;
        out.printf("Downloading %d pages%n", tasks);
    }

    @Override
    public void taskCompleted(DownloadTask task, DownloadReport report) {
        done++;
        out.printf("[%d/%d] %s -> %s%n", done, total, task.url(), report.savePath());
    }

    @Override
    public void taskFailed(DownloadTask task, ErrorInfo error) {
        done++;
        out.printf("[%d/%d] FAILED %s: %s%n", done, total, task.url(), error.message());
    }

    @Override
    public void taskRetried(DownloadTask task, Duration delay) {
        out.printf("  retrying %s in %dms (attempt %d)%n", task.url(), delay.toMillis(), task.attempt() + 1);
    }

    @Override
    public void workerCrashed(String workerId, String reason) {
        out.printf("  worker %s crashed: %s%n", workerId, reason);
    }
}
