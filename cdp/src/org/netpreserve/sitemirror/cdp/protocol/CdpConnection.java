package org.netpreserve.sitemirror.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.FramedPipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static org.netpreserve.sitemirror.util.LogUtils.ellipses;

/**
 * A DevTools protocol connection over a browser's remote debugging pipe.
 * <p>
 * Commands block the caller until the matching response arrives. Events are dispatched on a
 * single background thread, in arrival order, to listeners keyed by session and method name.
 */
public class CdpConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CdpConnection.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    private final Map<Long, CompletableFuture<ObjectNode>> commands = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<ObjectNode>>> listeners = new ConcurrentHashMap<>();
    private final AtomicLong idSeq = new AtomicLong();
    private final CompletableFuture<Void> closedFuture = new CompletableFuture<>();
    private final ExecutorService executor;
    private final FramedPipe pipe;
    private volatile Thread executorThread;

    public CdpConnection(InputStream inputStream, OutputStream outputStream) {
        String parentThreadName = Thread.currentThread().getName();
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, parentThreadName + "-CDP");
            thread.setDaemon(true);
            executorThread = thread;
            return thread;
        });
        pipe = new FramedPipe("CDP.Pipe", inputStream, outputStream, new FramedPipe.Handler() {
            @Override
            public void onFrame(byte[] frame) {
                handleFrame(frame);
            }

            @Override
            public void onClose(@Nullable IOException cause) {
                handleClose();
            }
        });
    }

    private void handleFrame(byte[] frame) {
        CdpMessage.Incoming message;
        try {
            message = CdpMessage.JSON.readValue(frame, CdpMessage.Incoming.class);
        } catch (IOException e) {
            log.error("Failed to parse CDP message: {}", ellipses(new String(frame)), e);
            return;
        }
        if (message instanceof CdpMessage.Response response) {
            handleResponse(response);
        } else if (message instanceof CdpMessage.Event event) {
            try {
                executor.submit(() -> handleEvent(event));
            } catch (RejectedExecutionException e) {
                log.debug("Dropping event {}, connection is closing", event.method());
            }
        }
    }

    private void handleResponse(CdpMessage.Response response) {
        var future = commands.remove(response.id());
        if (future == null) {
            log.warn("Received response to unknown call id {}", response.id());
        } else if (response.error() == null) {
            future.complete(response.result() == null ? CdpMessage.JSON.createObjectNode() : response.result());
        } else {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        }
    }

    private void handleEvent(CdpMessage.Event event) {
        if (log.isTraceEnabled()) {
            log.trace("<- {} {}", event.method(), ellipses(String.valueOf(event.params())));
        }
        var handlers = listeners.get(listenerKey(event.sessionId(), event.method()));
        if (handlers == null) return;
        for (var handler : handlers) {
            try {
                handler.accept(event.params());
            } catch (Exception e) {
                log.error("{} handler threw", event.method(), e);
            }
        }
    }

    private void handleClose() {
        closedFuture.complete(null);
        commands.values().forEach(command -> command.completeExceptionally(new CDPClosedException()));
        commands.clear();
    }

    private static String listenerKey(@Nullable String sessionId, String method) {
        return (sessionId == null ? "" : sessionId) + "/" + method;
    }

    /**
     * Registers an event listener.
     *
     * @return a handle which removes the listener when closed
     */
    public AutoCloseable addListener(@Nullable String sessionId, String method, Consumer<ObjectNode> listener) {
        String key = listenerKey(sessionId, method);
        listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            var handlers = listeners.get(key);
            if (handlers != null) handlers.remove(listener);
        };
    }

    public CompletableFuture<ObjectNode> sendAsync(@Nullable String sessionId, String method, Map<String, Object> params) {
        long commandId = idSeq.incrementAndGet();
        var future = new CompletableFuture<ObjectNode>();
        if (closedFuture.isDone()) {
            future.completeExceptionally(new CDPClosedException());
            return future;
        }
        commands.put(commandId, future);
        try {
            byte[] frame = CdpMessage.JSON.writeValueAsBytes(new CdpMessage.Command(commandId, method, params, sessionId));
            if (log.isTraceEnabled()) {
                log.trace("-> [{}] {}", commandId, ellipses(new String(frame)));
            }
            pipe.send(frame);
        } catch (JsonProcessingException e) {
            commands.remove(commandId);
            throw new IllegalArgumentException("Unserializable params for " + method, e);
        } catch (IOException e) {
            commands.remove(commandId);
            future.completeExceptionally(new CDPClosedException());
        }
        return future;
    }

    public ObjectNode send(String method, Map<String, Object> params) {
        return send(null, method, params, DEFAULT_TIMEOUT);
    }

    public ObjectNode send(@Nullable String sessionId, String method, Map<String, Object> params) {
        return send(sessionId, method, params, DEFAULT_TIMEOUT);
    }

    public ObjectNode send(@Nullable String sessionId, String method, Map<String, Object> params, Duration timeout) {
        if (Thread.currentThread() == executorThread) {
            throw new IllegalStateException("Sending command on the event handler thread would deadlock");
        }
        var future = sendAsync(sessionId, method, params);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else if (e.getCause() instanceof IOException ioException) {
                throw new UncheckedIOException(ioException);
            } else {
                throw new RuntimeException(e.getCause());
            }
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new CDPTimeoutException("Timed out waiting for " + method);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPTimeoutException("Interrupted waiting for " + method);
        }
    }

    public boolean isClosed() {
        return closedFuture.isDone();
    }

    /**
     * Waits for the browser to close its end of the connection.
     */
    public void waitClose(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            closedFuture.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // never completed exceptionally
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void close() {
        pipe.close();
        executor.shutdown();
    }
}
