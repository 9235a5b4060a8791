package org.netpreserve.sitemirror.worker;

import org.netpreserve.sitemirror.browser.BrowserPageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;

/**
 * Entry point of a worker process. Stdin and stdout carry the worker protocol, so anything that
 * would print to stdout is redirected to stderr.
 */
public class WorkerMain {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    public static void main(String[] args) {
        OutputStream protocolOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(System.err);
        String workerId = args.length > 0 ? args[0] : "worker";
        Thread.currentThread().setName("worker-" + workerId);

        int status = 0;
        try {
            new WorkerRuntime(System.in, protocolOut, BrowserPageRenderer::open).run();
        } catch (Exception e) {
            log.error("Worker {} failed", workerId, e);
            status = 1;
        }
        System.exit(status);
    }
}
