package org.netpreserve.sitemirror.worker;

import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.cdp.NavigationException;
import org.netpreserve.sitemirror.util.Url;

import java.io.IOException;
import java.util.List;

/**
 * A worker's browser session.
 */
public interface PageRenderer extends AutoCloseable {
    String version();

    void setCookies(List<Cookie> cookies);

    RenderedPage render(Url url) throws NavigationException, IOException, InterruptedException;

    @Override
    void close();
}
