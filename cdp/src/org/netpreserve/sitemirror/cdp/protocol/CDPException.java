package org.netpreserve.sitemirror.cdp.protocol;

public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    /**
     * Responses are completed on the reader thread, so the caller fills in its own stack trace
     * once the exception reaches it.
     */
    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int getCode() {
        return code;
    }
}
