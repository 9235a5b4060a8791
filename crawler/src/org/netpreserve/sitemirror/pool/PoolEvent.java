package org.netpreserve.sitemirror.pool;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.ipc.Message;

/**
 * Worker callbacks queued for the single scheduling thread.
 */
sealed interface PoolEvent {
    WorkerProxy worker();

    record Ready(WorkerProxy worker, Message.Ready ready) implements PoolEvent {
    }

    record Finished(WorkerProxy worker, DownloadTask task, Message.Result result) implements PoolEvent {
    }

    record Crashed(WorkerProxy worker, @Nullable DownloadTask lostTask, String reason) implements PoolEvent {
    }
}
