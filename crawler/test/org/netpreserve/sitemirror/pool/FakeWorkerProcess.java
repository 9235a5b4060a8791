package org.netpreserve.sitemirror.pool;

import org.netpreserve.sitemirror.worker.WorkerRuntime;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channel;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A worker "process" running {@link WorkerRuntime} on a thread, connected by pipes just like a
 * child JVM's stdio.
 */
public class FakeWorkerProcess extends Process {
    public static final int KILLED = 137;
    private final Pipe stdin = Pipe.open();
    private final Pipe stdout = Pipe.open();
    private final Pipe stderr = Pipe.open();
    private final OutputStream poolToWorker = Channels.newOutputStream(stdin.sink());
    private final InputStream workerToPool = Channels.newInputStream(stdout.source());
    private final InputStream workerLog = Channels.newInputStream(stderr.source());
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private final Thread thread;

    public FakeWorkerProcess(String workerId, WorkerRuntime.RendererFactory rendererFactory) throws IOException {
        var runtime = new WorkerRuntime(Channels.newInputStream(stdin.source()),
                Channels.newOutputStream(stdout.sink()), rendererFactory);
        thread = new Thread(() -> {
            int status = 0;
            try {
                runtime.run();
            } catch (Throwable e) {
                status = 1;
            } finally {
                closeWorkerSide();
                exit.complete(status);
            }
        }, "fake-worker-" + workerId);
        thread.setDaemon(true);
        thread.start();
    }

    public static WorkerLauncher launcher(WorkerRuntime.RendererFactory rendererFactory) {
        return workerId -> new FakeWorkerProcess(workerId, rendererFactory);
    }

    private void closeWorkerSide() {
        closeChannel(stdin.source());
        closeChannel(stdout.sink());
        closeChannel(stderr.sink());
    }

    private static void closeChannel(Channel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return poolToWorker;
    }

    @Override
    public InputStream getInputStream() {
        return workerToPool;
    }

    @Override
    public InputStream getErrorStream() {
        return workerLog;
    }

    @Override
    public int waitFor() throws InterruptedException {
        try {
            return exit.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            exit.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public CompletableFuture<Process> onExit() {
        return exit.thenApply(status -> this);
    }

    @Override
    public int exitValue() {
        if (!exit.isDone()) throw new IllegalThreadStateException("still running");
        return exit.join();
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public void destroy() {
        if (exit.isDone()) return;
        thread.interrupt();
        closeWorkerSide();
        exit.complete(KILLED);
    }
}
