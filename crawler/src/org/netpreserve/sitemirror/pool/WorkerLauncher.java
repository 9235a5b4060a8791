package org.netpreserve.sitemirror.pool;

import java.io.IOException;

/**
 * Starts worker processes. The process's stdin/stdout carry the worker protocol; its stderr carries
 * log output.
 */
public interface WorkerLauncher {
    Process launch(String workerId) throws IOException;
}
