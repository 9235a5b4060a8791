package org.netpreserve.sitemirror.pool;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.config.PoolConfig;
import org.netpreserve.sitemirror.ipc.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Owns the worker processes. Crashed workers are evicted and, within a respawn budget, replaced.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private final WorkerLauncher launcher;
    private final PoolConfig config;
    private final Function<String, Message.Init> initFactory;
    private final WorkerProxy.Events events;
    private final List<WorkerProxy> workers = new CopyOnWriteArrayList<>();
    private final AtomicInteger idSeq = new AtomicInteger();
    private final int respawnBudget;
    private int respawns;
    private boolean closed;

    /**
     * @param initFactory builds the INIT message for a worker ID
     */
    public WorkerPool(WorkerLauncher launcher, PoolConfig config, Function<String, Message.Init> initFactory,
                      WorkerProxy.Events events) {
        this.launcher = launcher;
        this.config = config;
        this.initFactory = initFactory;
        this.events = events;
        this.respawnBudget = config.workersOrDefault() * (config.retryLimit() + 1);
    }

    /**
     * Launches the configured number of workers.
     *
     * @throws IOException if not a single worker could be launched
     */
    public void start() throws IOException {
        int size = config.workersOrDefault();
        IOException failure = null;
        for (int i = 0; i < size; i++) {
            try {
                spawn();
            } catch (IOException e) {
                log.error("Failed to launch worker", e);
                failure = e;
            }
        }
        if (workers.isEmpty()) {
            throw new IOException("Unable to launch any workers", failure);
        }
        log.info("Started {} workers", workers.size());
    }

    WorkerProxy spawn() throws IOException {
        if (closed) throw new IllegalStateException("Pool is closed");
        String id = "w" + idSeq.incrementAndGet();
        Process process = launcher.launch(id);
        var worker = new WorkerProxy(id, process, events);
        workers.add(worker);
        worker.init(initFactory.apply(id));
        return worker;
    }

    /**
     * Evicts a crashed worker and, if respawning is enabled and the budget allows, launches a
     * replacement.
     *
     * @return the replacement, or null if none was started
     */
    public @Nullable WorkerProxy replace(WorkerProxy crashed) {
        workers.remove(crashed);
        if (closed || !canRespawn()) return null;
        respawns++;
        try {
            var replacement = spawn();
            log.info("Respawned worker {} as {}", crashed.id(), replacement.id());
            return replacement;
        } catch (IOException e) {
            log.error("Failed to respawn worker {}", crashed.id(), e);
            return null;
        }
    }

    public boolean canRespawn() {
        return config.respawn() && respawns < respawnBudget;
    }

    public @Nullable WorkerProxy idleWorker() {
        for (WorkerProxy worker : workers) {
            if (worker.state() == WorkerState.IDLE) return worker;
        }
        return null;
    }

    /**
     * Workers not yet evicted. A crashed worker stays counted until {@link #replace} handles it.
     */
    public int size() {
        return workers.size();
    }

    /**
     * Workers that haven't crashed.
     */
    public List<WorkerProxy> liveWorkers() {
        var live = new ArrayList<WorkerProxy>();
        for (WorkerProxy worker : workers) {
            if (worker.state() != WorkerState.CRASHED) live.add(worker);
        }
        return live;
    }

    /**
     * Sends SHUTDOWN to every worker, waits out the grace period, then kills whatever is left.
     */
    public void shutdown() throws InterruptedException {
        closed = true;
        for (WorkerProxy worker : workers) {
            worker.shutdown();
        }
        long deadline = System.nanoTime() + config.shutdownGrace().toNanos();
        for (WorkerProxy worker : workers) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!worker.awaitExit(Duration.ofNanos(remaining))) {
                log.info("Worker {} still running after {}ms grace, terminating", worker.id(),
                        config.shutdownGrace().toMillis());
            }
            worker.kill();
        }
        workers.clear();
    }

    @Override
    public void close() throws InterruptedException {
        if (!workers.isEmpty()) shutdown();
        closed = true;
    }
}
