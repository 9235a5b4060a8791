package org.netpreserve.sitemirror.pool;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.config.PoolConfig;
import org.netpreserve.sitemirror.ipc.DownloadReport;
import org.netpreserve.sitemirror.ipc.ErrorInfo;
import org.netpreserve.sitemirror.ipc.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs an {@link ExecutionPlan} on a pool of worker processes.
 * <p>
 * All scheduling happens on the calling thread: worker callbacks are queued as {@link PoolEvent}s
 * and handled one at a time, so the queue and counters need no locking. Each page's output path was
 * fixed during planning, so no two workers ever write the same file.
 */
public class Execution {
    private static final Logger log = LoggerFactory.getLogger(Execution.class);
    private static final long MAX_POLL_MILLIS = 250;
    private final WorkerLauncher launcher;
    private final PoolConfig config;
    private final Function<String, Message.Init> initFactory;
    private final ExecutionListener listener;

    public Execution(WorkerLauncher launcher, PoolConfig config, Function<String, Message.Init> initFactory,
                     ExecutionListener listener) {
        this.launcher = launcher;
        this.config = config;
        this.initFactory = initFactory;
        this.listener = listener;
    }

    private record Delayed(DownloadTask task, long dueNanos) {
    }

    /**
     * Downloads every page in the plan.
     *
     * @param cookies session cookies broadcast to each worker and embedded in every task
     * @throws IllegalStateException if there is no plan, i.e. discovery was never confirmed
     * @throws IOException           if no worker could be launched at all
     */
    public ExecutionReport run(@Nullable ExecutionPlan plan, List<Cookie> cookies) throws IOException, InterruptedException {
        if (plan == null) throw new IllegalStateException("Execution requires a confirmed discovery tree");
        var run = new Run(plan, List.copyOf(cookies));
        BlockingQueue<PoolEvent> events = run.events;
        try (var pool = new WorkerPool(launcher, config, initFactory, new WorkerProxy.Events() {
            @Override
            public void onReady(WorkerProxy worker, Message.Ready ready) {
                events.add(new PoolEvent.Ready(worker, ready));
            }

            @Override
            public void onResult(WorkerProxy worker, DownloadTask task, Message.Result result) {
                events.add(new PoolEvent.Finished(worker, task, result));
            }

            @Override
            public void onCrash(WorkerProxy worker, @Nullable DownloadTask lostTask, String reason) {
                events.add(new PoolEvent.Crashed(worker, lostTask, reason));
            }
        })) {
            pool.start();
            run.loop(pool);
        }
        var report = new ExecutionReport(run.completed, run.failed, run.retries, run.crashes);
        log.atInfo()
                .addKeyValue("completed", report.completed().size())
                .addKeyValue("failed", report.failed().size())
                .addKeyValue("retries", report.retries())
                .addKeyValue("crashes", report.crashes())
                .log("Execution finished");
        return report;
    }

    private class Run {
        final BlockingQueue<PoolEvent> events = new LinkedBlockingQueue<>();
        final ArrayDeque<DownloadTask> queue;
        final PriorityQueue<Delayed> delayed = new PriorityQueue<>(Comparator.comparingLong(Delayed::dueNanos));
        final List<Cookie> cookies;
        final Map<String, DownloadReport> completed = new LinkedHashMap<>();
        final Map<String, ErrorInfo> failed = new LinkedHashMap<>();
        int inFlight;
        int retries;
        int crashes;

        Run(ExecutionPlan plan, List<Cookie> cookies) {
            this.queue = new ArrayDeque<>(plan.tasks());
            this.cookies = cookies;
        }

        void loop(WorkerPool pool) throws InterruptedException {
            while (!queue.isEmpty() || !delayed.isEmpty() || inFlight > 0) {
                promoteDueRetries();
                dispatch(pool);
                checkTimeouts(pool);

                if (inFlight == 0 && events.isEmpty() && pool.size() == 0) {
                    failRemaining("No workers available");
                    break;
                }

                PoolEvent event = events.poll(pollMillis(), TimeUnit.MILLISECONDS);
                if (event != null) handle(pool, event);
            }
        }

        private void promoteDueRetries() {
            long now = System.nanoTime();
            while (!delayed.isEmpty() && delayed.peek().dueNanos() - now <= 0) {
                queue.add(delayed.remove().task());
            }
        }

        private void dispatch(WorkerPool pool) {
            while (!queue.isEmpty()) {
                WorkerProxy worker = pool.idleWorker();
                if (worker == null) return;
                DownloadTask task = queue.remove();
                try {
                    worker.dispatch(task, cookies);
                } catch (IllegalStateException e) {
                    // crashed between idleWorker() and dispatch()
                    queue.addFirst(task);
                    continue;
                }
                inFlight++;
                log.debug("Dispatched {} to worker {} (attempt {})", task.url(), worker.id(), task.attempt());
                listener.taskStarted(task, worker.id());
            }
        }

        private void checkTimeouts(WorkerPool pool) {
            for (WorkerProxy worker : pool.liveWorkers()) {
                if (worker.state() == WorkerState.BUSY && worker.busyFor().compareTo(config.taskTimeout()) > 0) {
                    worker.crash("task timed out after " + config.taskTimeout().toSeconds() + "s");
                } else if (worker.state() == WorkerState.INITIALIZING && worker.age().compareTo(config.readyTimeout()) > 0) {
                    worker.crash("not ready after " + config.readyTimeout().toSeconds() + "s");
                }
            }
        }

        private long pollMillis() {
            long wait = MAX_POLL_MILLIS;
            if (!delayed.isEmpty()) {
                long untilDue = TimeUnit.NANOSECONDS.toMillis(delayed.peek().dueNanos() - System.nanoTime());
                wait = Math.min(wait, Math.max(untilDue, 1));
            }
            return wait;
        }

        private void handle(WorkerPool pool, PoolEvent event) {
            if (event instanceof PoolEvent.Ready ready) {
                listener.workerReady(ready.worker().id());
                if (!cookies.isEmpty()) {
                    try {
                        ready.worker().setCookies(cookies);
                    } catch (IllegalStateException e) {
                        log.debug("Worker {} crashed before cookies could be sent", ready.worker().id());
                    }
                }
            } else if (event instanceof PoolEvent.Finished finished) {
                inFlight--;
                var task = finished.task();
                var result = finished.result();
                if (result.isSuccess()) {
                    completed.put(task.pageId(), result.data());
                    log.info("Saved {} ({} bytes)", task.url(), result.data().bytes());
                    listener.taskCompleted(task, result.data());
                } else {
                    fail(task, result.error());
                }
            } else if (event instanceof PoolEvent.Crashed crashed) {
                crashes++;
                listener.workerCrashed(crashed.worker().id(), crashed.reason());
                if (crashed.lostTask() != null) {
                    inFlight--;
                    requeue(crashed.lostTask(), crashed.reason());
                }
                var replacement = pool.replace(crashed.worker());
                if (replacement != null) {
                    listener.workerRespawned(crashed.worker().id(), replacement.id());
                }
            }
        }

        private void requeue(DownloadTask task, String reason) {
            if (task.attempt() > config.retryLimit()) {
                fail(task, ErrorInfo.of("WorkerCrash", "Gave up after " + task.attempt() + " attempts: " + reason));
                return;
            }
            Duration delay = config.retryDelay(task.attempt());
            delayed.add(new Delayed(task.nextAttempt(), System.nanoTime() + delay.toNanos()));
            retries++;
            log.info("Retrying {} in {}ms (attempt {} lost: {})", task.url(), delay.toMillis(), task.attempt(), reason);
            listener.taskRetried(task, delay);
        }

        private void fail(DownloadTask task, ErrorInfo error) {
            failed.put(task.pageId(), error);
            log.warn("Failed {}: {}", task.url(), error);
            listener.taskFailed(task, error);
        }

        private void failRemaining(String reason) {
            var error = ErrorInfo.of("NoWorkersAvailable", reason);
            for (Delayed retry : delayed) queue.add(retry.task());
            delayed.clear();
            while (!queue.isEmpty()) {
                fail(queue.remove(), error);
            }
        }
    }
}
