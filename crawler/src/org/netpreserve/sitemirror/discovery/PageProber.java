package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.util.Url;

import java.util.List;

/**
 * Loads a page and reports its title and outbound links.
 */
public interface PageProber extends AutoCloseable {
    ProbeResult probe(Url url) throws ProbeException, InterruptedException;

    /**
     * Session cookies accumulated so far, to hand on to the download workers.
     */
    default List<Cookie> cookies() {
        return List.of();
    }

    @Override
    default void close() {
    }
}
