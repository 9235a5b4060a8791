package org.netpreserve.sitemirror.ipc;

/**
 * The closed set of messages exchanged between the pool and its workers.
 */
public enum MessageType {
    /**
     * Pool to worker: start the browser session.
     */
    INIT(Message.Init.class),
    /**
     * Pool to worker: replace the session cookies.
     */
    SET_COOKIES(Message.SetCookies.class),
    /**
     * Pool to worker: render and save one page.
     */
    DOWNLOAD(Message.Download.class),
    /**
     * Pool to worker: finish up and exit.
     */
    SHUTDOWN(Message.Shutdown.class),
    /**
     * Worker to pool: initialized and idle.
     */
    READY(Message.Ready.class),
    /**
     * Worker to pool: outcome of a task.
     */
    RESULT(Message.Result.class);

    private final Class<? extends Message> payloadClass;

    MessageType(Class<? extends Message> payloadClass) {
        this.payloadClass = payloadClass;
    }

    public Class<? extends Message> payloadClass() {
        return payloadClass;
    }
}
