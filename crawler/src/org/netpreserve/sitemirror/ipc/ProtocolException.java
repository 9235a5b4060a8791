package org.netpreserve.sitemirror.ipc;

/**
 * A frame that isn't a valid protocol message.
 */
public class ProtocolException extends Exception {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
