package org.netpreserve.sitemirror.pool;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.ipc.IpcChannel;
import org.netpreserve.sitemirror.ipc.Message;
import org.netpreserve.sitemirror.ipc.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * The pool's handle on one worker process and its state machine:
 * <pre>
 * INITIALIZING --READY--> IDLE --dispatch--> BUSY --RESULT--> IDLE
 *      any state --exit, channel failure, timeout--> CRASHED
 * </pre>
 * Crashes are reported once, together with the task the worker was running, if any.
 */
public class WorkerProxy {
    private static final Logger log = LoggerFactory.getLogger(WorkerProxy.class);
    private final String id;
    private final Process process;
    // null until the IpcChannel constructor returns; its reader thread can call crash() before that
    private volatile IpcChannel channel;
    private final Events events;
    private final long startedNanos = System.nanoTime();
    private volatile boolean shuttingDown;
    private WorkerState state = WorkerState.INITIALIZING;
    private @Nullable DownloadTask currentTask;
    private @Nullable String currentTaskId;
    private long busySinceNanos;
    private long lastTaskStamp;

    /**
     * Callbacks arrive on the worker's reader thread.
     */
    public interface Events {
        void onReady(WorkerProxy worker, Message.Ready ready);

        void onResult(WorkerProxy worker, DownloadTask task, Message.Result result);

        /**
         * @param lostTask the task the worker was running when it crashed
         */
        void onCrash(WorkerProxy worker, @Nullable DownloadTask lostTask, String reason);
    }

    public WorkerProxy(String id, Process process, Events events) {
        this.id = id;
        this.process = process;
        this.events = events;
        this.channel = new IpcChannel("worker-" + id, process.getInputStream(), process.getOutputStream(),
                new IpcChannel.Listener() {
                    @Override
                    public void onMessage(Message message) {
                        handleMessage(message);
                    }

                    @Override
                    public void onProtocolError(ProtocolException e) {
                        crash("protocol error: " + e.getMessage());
                    }

                    @Override
                    public void onClose(@Nullable IOException cause) {
                        crash(cause == null ? "worker closed its channel" : "channel failed: " + cause.getMessage());
                    }
                });
        // a crash reported during construction found no channel to close
        if (state() == WorkerState.CRASHED) closeChannel();
        forwardStderr();
        process.onExit().thenRun(() -> crash("process exited with status " + process.exitValue()));
    }

    private void forwardStderr() {
        var workerLog = LoggerFactory.getLogger("org.netpreserve.sitemirror.worker." + id);
        var thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    workerLog.info(line);
                }
            } catch (IOException e) {
                log.debug("stderr of worker {} closed: {}", id, e.toString());
            }
        }, "worker-" + id + "-stderr");
        thread.setDaemon(true);
        thread.start();
    }

    private void handleMessage(Message message) {
        if (message instanceof Message.Ready ready) {
            synchronized (this) {
                if (state != WorkerState.INITIALIZING) {
                    log.warn("Worker {} sent READY while {}", id, state);
                    return;
                }
                state = WorkerState.IDLE;
            }
            log.info("Worker {} ready ({})", id, ready.browserVersion());
            events.onReady(this, ready);
        } else if (message instanceof Message.Result result) {
            DownloadTask task;
            synchronized (this) {
                if (state != WorkerState.BUSY || !result.taskId().equals(currentTaskId)) {
                    log.warn("Worker {} sent result for unexpected task {} while {}", id, result.taskId(), state);
                    return;
                }
                task = currentTask;
                currentTask = null;
                currentTaskId = null;
                state = WorkerState.IDLE;
            }
            events.onResult(this, task, result);
        } else {
            crash("unexpected " + message.type() + " from worker");
        }
    }

    public synchronized void init(Message.Init init) {
        if (state != WorkerState.INITIALIZING) throw new IllegalStateException("Worker " + id + " is " + state);
        trySend(init);
    }

    public void setCookies(List<Cookie> cookies) {
        synchronized (this) {
            if (state != WorkerState.IDLE) throw new IllegalStateException("Worker " + id + " is " + state);
        }
        trySend(new Message.SetCookies(cookies));
    }

    /**
     * Hands a task to this worker.
     *
     * @return the task ID stamped on the DOWNLOAD message
     * @throws IllegalStateException if the worker isn't IDLE
     */
    public String dispatch(DownloadTask task, List<Cookie> cookies) {
        Message.Download download;
        synchronized (this) {
            if (state != WorkerState.IDLE) throw new IllegalStateException("Worker " + id + " is " + state);
            lastTaskStamp = Math.max(System.currentTimeMillis(), lastTaskStamp + 1);
            currentTaskId = id + "-" + lastTaskStamp;
            currentTask = task;
            busySinceNanos = System.nanoTime();
            state = WorkerState.BUSY;
            download = new Message.Download(currentTaskId, task.url(), task.pageId(),
                    task.savePath().toString(), cookies);
        }
        trySend(download);
        return download.taskId();
    }

    private void trySend(Message message) {
        try {
            channel.send(message);
        } catch (IOException e) {
            crash("failed to send " + message.type() + ": " + e.getMessage());
        }
    }

    /**
     * Marks the worker CRASHED, kills the process and reports the lost task. Later calls do nothing.
     */
    public void crash(String reason) {
        DownloadTask lostTask;
        synchronized (this) {
            if (state == WorkerState.CRASHED) return;
            state = WorkerState.CRASHED;
            lostTask = currentTask;
            currentTask = null;
            currentTaskId = null;
        }
        closeChannel();
        process.destroyForcibly();
        if (shuttingDown) {
            log.debug("Worker {} gone during shutdown: {}", id, reason);
            return;
        }
        log.warn("Worker {} crashed: {}{}", id, reason, lostTask == null ? "" : " (while downloading " + lostTask.url() + ")");
        events.onCrash(this, lostTask, reason);
    }

    /**
     * Asks the worker to exit. Crashes after this point are expected and not reported.
     */
    public void shutdown() {
        shuttingDown = true;
        synchronized (this) {
            if (state == WorkerState.CRASHED) return;
        }
        try {
            channel.send(new Message.Shutdown());
        } catch (IOException e) {
            log.debug("Worker {} already closed its channel", id);
        }
    }

    private void closeChannel() {
        IpcChannel channel = this.channel;
        if (channel != null) channel.close();
    }

    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Terminates the process, forcibly if it doesn't exit promptly.
     */
    public void kill() throws InterruptedException {
        shuttingDown = true;
        process.destroy();
        if (!process.waitFor(2, TimeUnit.SECONDS)) {
            log.warn("Worker {} ignored SIGTERM, killing", id);
            process.destroyForcibly();
        }
        closeChannel();
        synchronized (this) {
            state = WorkerState.CRASHED;
        }
    }

    public String id() {
        return id;
    }

    public synchronized WorkerState state() {
        return state;
    }

    public synchronized @Nullable DownloadTask currentTask() {
        return currentTask;
    }

    /**
     * How long the current task has been running, or zero when not BUSY.
     */
    public synchronized Duration busyFor() {
        if (state != WorkerState.BUSY) return Duration.ZERO;
        return Duration.ofNanos(System.nanoTime() - busySinceNanos);
    }

    public Duration age() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public String toString() {
        return "WorkerProxy{" + id + " " + state() + "}";
    }
}
