package org.netpreserve.sitemirror.util;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A duplex byte-stream channel carrying NUL-terminated frames.
 * <p>
 * This is the framing Chrome uses for --remote-debugging-pipe and we reuse it for our own worker
 * protocol. A daemon thread reads frames and hands them to the {@link Handler}; writes may come
 * from any thread.
 */
public class FramedPipe implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(FramedPipe.class);
    private final InputStream inputStream;
    private final OutputStream outputStream;
    private final Handler handler;
    private final Lock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Thread thread;

    public interface Handler {
        /**
         * Called on the reader thread for each complete frame (without the terminator).
         */
        void onFrame(byte[] frame);

        /**
         * Called exactly once when the read side ends.
         *
         * @param cause null on a clean end of stream
         */
        default void onClose(@Nullable IOException cause) {
        }
    }

    public FramedPipe(String name, InputStream inputStream, OutputStream outputStream, Handler handler) {
        this.inputStream = inputStream;
        this.outputStream = outputStream;
        this.handler = handler;
        this.thread = new Thread(this::run, name);
        thread.setDaemon(true);
        thread.start();
    }

    private static int findNullByte(byte[] buffer, int offset, int length) {
        for (int i = offset; i < length; i++) {
            if (buffer[i] == 0) return i;
        }
        return -1;
    }

    private void run() {
        ByteArrayOutputStream partialFrame = null;
        byte[] buffer = new byte[64 * 1024];
        IOException failure = null;
        try {
            while (true) {
                int bytesRead = inputStream.read(buffer);
                if (bytesRead < 0) {
                    log.debug("{}: end of stream", thread.getName());
                    break;
                }
                int startOfFrame = 0;
                while (true) {
                    int endOfFrame = findNullByte(buffer, startOfFrame, bytesRead);
                    if (endOfFrame == -1) break;
                    if (partialFrame == null) {
                        deliver(Arrays.copyOfRange(buffer, startOfFrame, endOfFrame));
                    } else {
                        partialFrame.write(buffer, startOfFrame, endOfFrame - startOfFrame);
                        deliver(partialFrame.toByteArray());
                        partialFrame = null;
                    }
                    startOfFrame = endOfFrame + 1;
                }

                // keep the tail of an incomplete frame for the next read
                if (startOfFrame < bytesRead) {
                    if (partialFrame == null) partialFrame = new ByteArrayOutputStream();
                    partialFrame.write(buffer, startOfFrame, bytesRead - startOfFrame);
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.debug("{}: read failed", thread.getName(), e);
                failure = e;
            }
        } finally {
            handler.onClose(failure);
        }
    }

    private void deliver(byte[] frame) {
        if (frame.length == 0) return;
        try {
            handler.onFrame(frame);
        } catch (RuntimeException e) {
            log.error("{}: frame handler threw", thread.getName(), e);
        }
    }

    /**
     * Writes one frame and flushes it.
     */
    public void send(byte[] frame) throws IOException {
        if (closed.get()) throw new IOException("Pipe closed");
        writeLock.lock();
        try {
            outputStream.write(frame);
            outputStream.write(0);
            outputStream.flush();
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            outputStream.close();
        } catch (IOException e) {
            log.debug("Error closing output of {}", thread.getName(), e);
        }
        try {
            inputStream.close();
        } catch (IOException e) {
            log.debug("Error closing input of {}", thread.getName(), e);
        }
    }
}
