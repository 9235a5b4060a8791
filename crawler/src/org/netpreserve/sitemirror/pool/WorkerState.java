package org.netpreserve.sitemirror.pool;

public enum WorkerState {
    /**
     * Process started, waiting for READY.
     */
    INITIALIZING,
    IDLE,
    /**
     * Running exactly one task.
     */
    BUSY,
    /**
     * The process exited or its channel failed. Terminal for this process.
     */
    CRASHED
}
