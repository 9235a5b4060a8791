package org.netpreserve.sitemirror.ipc;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.FramedPipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.netpreserve.sitemirror.util.LogUtils.ellipses;

/**
 * A duplex message channel over a pair of byte streams, one NUL-terminated JSON envelope per frame.
 * Incoming frames are validated before they reach the listener.
 */
public class IpcChannel implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(IpcChannel.class);
    private final FramedPipe pipe;

    public interface Listener {
        void onMessage(Message message);

        /**
         * A frame failed validation. The channel stays open; the listener decides what that means.
         */
        default void onProtocolError(ProtocolException e) {
        }

        /**
         * The other end hung up or the stream failed.
         */
        default void onClose(@Nullable IOException cause) {
        }
    }

    public IpcChannel(String name, InputStream inputStream, OutputStream outputStream, Listener listener) {
        pipe = new FramedPipe(name, inputStream, outputStream, new FramedPipe.Handler() {
            @Override
            public void onFrame(byte[] frame) {
                Message message;
                try {
                    message = Envelope.decode(frame);
                } catch (ProtocolException e) {
                    log.warn("{}: rejected frame {}: {}", name, preview(frame), e.getMessage());
                    listener.onProtocolError(e);
                    return;
                }
                if (log.isTraceEnabled()) log.trace("{} <- {}", name, message.type());
                listener.onMessage(message);
            }

            @Override
            public void onClose(@Nullable IOException cause) {
                listener.onClose(cause);
            }
        });
    }

    static String preview(byte[] frame) {
        return ellipses(new String(frame, UTF_8));
    }

    public void send(Message message) throws IOException {
        if (log.isTraceEnabled()) log.trace("-> {}", message.type());
        pipe.send(Envelope.encode(message));
    }

    public boolean isClosed() {
        return pipe.isClosed();
    }

    @Override
    public void close() {
        pipe.close();
    }
}
