package org.netpreserve.sitemirror.pool;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.discovery.DiscoveryResult;
import org.netpreserve.sitemirror.graph.PageNode;
import org.netpreserve.sitemirror.path.FilesystemResolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * The download tasks for a confirmed discovery, one per page, in discovery order.
 */
public class ExecutionPlan {
    private final List<DownloadTask> tasks;

    private ExecutionPlan(List<DownloadTask> tasks) {
        this.tasks = List.copyOf(tasks);
    }

    /**
     * @throws IllegalStateException if discovery hasn't been confirmed
     */
    public static ExecutionPlan from(@Nullable DiscoveryResult discovery, FilesystemResolver filesystem) {
        if (discovery == null || !discovery.isConfirmed()) {
            throw new IllegalStateException("Execution requires a confirmed discovery tree");
        }
        var tasks = new ArrayList<DownloadTask>();
        var owners = new HashMap<Path, String>();
        for (PageNode node : discovery.graph().nodes()) {
            Path savePath = filesystem.outputFile(node);
            String previous = owners.putIfAbsent(savePath, node.id());
            if (previous != null) {
                throw new IllegalStateException("Pages " + previous + " and " + node.id() + " both map to " + savePath);
            }
            tasks.add(new DownloadTask(node.id(), node.url(), savePath, 1));
        }
        return new ExecutionPlan(tasks);
    }

    public List<DownloadTask> tasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }
}
