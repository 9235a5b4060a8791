package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.util.Url;

/**
 * A page couldn't be probed. Discovery keeps the page as a leaf and carries on.
 */
public class ProbeException extends Exception {
    private final Url url;

    public ProbeException(Url url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public ProbeException(Url url, String message) {
        super(message);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
