package org.netpreserve.sitemirror.browser;

import org.netpreserve.sitemirror.cdp.BrowserProcess;
import org.netpreserve.sitemirror.cdp.BrowserTab;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.cdp.NavigationException;
import org.netpreserve.sitemirror.cdp.protocol.CDPException;
import org.netpreserve.sitemirror.ipc.Message;
import org.netpreserve.sitemirror.util.Url;
import org.netpreserve.sitemirror.worker.PageRenderer;
import org.netpreserve.sitemirror.worker.RenderedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * A worker's browser: one process, one tab, reused for every download.
 */
public class BrowserPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(BrowserPageRenderer.class);
    private final BrowserProcess browser;
    private final BrowserTab tab;
    private final Duration timeout;

    BrowserPageRenderer(BrowserProcess browser, Duration timeout) {
        this.browser = browser;
        this.tab = browser.newTab();
        this.timeout = timeout;
    }

    public static BrowserPageRenderer open(Message.Init init) throws IOException {
        var browser = BrowserProcess.start(init.browserExecutable(), init.browserOptions(), null);
        try {
            return new BrowserPageRenderer(browser, Duration.ofMillis(init.navigationTimeoutMs()));
        } catch (RuntimeException e) {
            browser.close();
            throw e;
        }
    }

    @Override
    public String version() {
        return browser.version();
    }

    @Override
    public void setCookies(List<Cookie> cookies) {
        tab.setCookies(cookies);
    }

    @Override
    public RenderedPage render(Url url) throws NavigationException, InterruptedException {
        tab.navigate(url, timeout);
        try {
            tab.scrollToBottom();
        } catch (CDPException e) {
            log.warn("Scrolling {} failed, saving what has rendered: {}", url, e.getMessage());
        }
        return new RenderedPage(tab.currentUrl(), tab.title(), tab.outerHtml());
    }

    @Override
    public void close() {
        tab.close();
        browser.close();
    }
}
