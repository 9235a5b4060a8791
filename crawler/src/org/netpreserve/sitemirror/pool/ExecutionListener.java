package org.netpreserve.sitemirror.pool;

import org.netpreserve.sitemirror.ipc.DownloadReport;
import org.netpreserve.sitemirror.ipc.ErrorInfo;

import java.time.Duration;

/**
 * Progress callbacks from {@link Execution}, all on the scheduling thread.
 */
public interface ExecutionListener {
    ExecutionListener NONE = new ExecutionListener() {
    };

    default void workerReady(String workerId) {
    }

    default void taskStarted(DownloadTask task, String workerId) {
    }

    default void taskCompleted(DownloadTask task, DownloadReport report) {
    }

    /**
     * The page won't be retried.
     */
    default void taskFailed(DownloadTask task, ErrorInfo error) {
    }

    /**
     * The task was lost to a crash and will run again after {@code delay}.
     */
    default void taskRetried(DownloadTask task, Duration delay) {
    }

    default void workerCrashed(String workerId, String reason) {
    }

    default void workerRespawned(String crashedId, String replacementId) {
    }
}
