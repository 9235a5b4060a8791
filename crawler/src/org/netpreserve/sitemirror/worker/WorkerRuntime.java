package org.netpreserve.sitemirror.worker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.ipc.ErrorInfo;
import org.netpreserve.sitemirror.ipc.IpcChannel;
import org.netpreserve.sitemirror.ipc.Message;
import org.netpreserve.sitemirror.ipc.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The worker's side of the protocol. Handles one message at a time: INIT opens the browser and
 * answers READY, DOWNLOAD answers RESULT, SHUTDOWN or a closed channel ends {@link #run()}.
 */
public class WorkerRuntime {
    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);
    private final InputStream input;
    private final OutputStream output;
    private final RendererFactory rendererFactory;
    private final DownloadHandler downloadHandler;
    // empty means the channel closed
    private final BlockingQueue<Optional<Message>> inbox = new LinkedBlockingQueue<>();

    public interface RendererFactory {
        PageRenderer open(Message.Init init) throws IOException;
    }

    public WorkerRuntime(InputStream input, OutputStream output, RendererFactory rendererFactory) {
        this(input, output, rendererFactory, new DownloadHandler());
    }

    public WorkerRuntime(InputStream input, OutputStream output, RendererFactory rendererFactory,
                         DownloadHandler downloadHandler) {
        this.input = input;
        this.output = output;
        this.rendererFactory = rendererFactory;
        this.downloadHandler = downloadHandler;
    }

    /**
     * Serves the pool until told to shut down.
     *
     * @throws IOException if the browser can't be started or the pool can't be written to
     */
    public void run() throws IOException, InterruptedException {
        try (var channel = new IpcChannel("ipc", input, output, new IpcChannel.Listener() {
            @Override
            public void onMessage(Message message) {
                inbox.add(Optional.of(message));
            }

            @Override
            public void onProtocolError(ProtocolException e) {
                log.error("Ignoring invalid message from pool: {}", e.getMessage());
            }

            @Override
            public void onClose(@Nullable IOException cause) {
                inbox.add(Optional.empty());
            }
        })) {
            serve(channel);
        }
    }

    private void serve(IpcChannel channel) throws IOException, InterruptedException {
        PageRenderer renderer = null;
        List<Cookie> cookies = List.of();
        try {
            while (true) {
                Optional<Message> next = inbox.take();
                if (next.isEmpty()) {
                    log.info("Pool closed the channel, exiting");
                    return;
                }
                Message message = next.get();
                if (message instanceof Message.Init init) {
                    if (renderer != null) {
                        log.warn("Ignoring repeated INIT");
                        continue;
                    }
                    log.info("Starting browser for worker {}", init.workerId());
                    renderer = rendererFactory.open(init);
                    channel.send(new Message.Ready(init.workerId(), renderer.version()));
                } else if (message instanceof Message.SetCookies setCookies) {
                    cookies = setCookies.cookies();
                    log.debug("Received {} session cookies", cookies.size());
                } else if (message instanceof Message.Download download) {
                    Message.Result result;
                    if (renderer == null) {
                        result = Message.Result.failure(download.taskId(),
                                ErrorInfo.of("IllegalStateException", "DOWNLOAD before INIT"));
                    } else {
                        result = downloadHandler.handle(download, renderer, cookies);
                    }
                    channel.send(result);
                } else if (message instanceof Message.Shutdown) {
                    log.info("Shutting down");
                    return;
                } else {
                    log.warn("Ignoring unexpected {} from pool", message.type());
                }
            }
        } finally {
            if (renderer != null) renderer.close();
        }
    }
}
