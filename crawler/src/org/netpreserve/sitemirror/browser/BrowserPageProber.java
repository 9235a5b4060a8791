package org.netpreserve.sitemirror.browser;

import org.netpreserve.sitemirror.cdp.BrowserProcess;
import org.netpreserve.sitemirror.cdp.BrowserTab;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.cdp.Link;
import org.netpreserve.sitemirror.cdp.NavigationException;
import org.netpreserve.sitemirror.cdp.protocol.CDPException;
import org.netpreserve.sitemirror.config.BrowserConfig;
import org.netpreserve.sitemirror.discovery.OutLink;
import org.netpreserve.sitemirror.discovery.PageProber;
import org.netpreserve.sitemirror.discovery.ProbeException;
import org.netpreserve.sitemirror.discovery.ProbeResult;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Probes pages in a single browser tab, so discovery sees the site the way a logged-in user does.
 */
public class BrowserPageProber implements PageProber {
    private static final Logger log = LoggerFactory.getLogger(BrowserPageProber.class);
    private final BrowserProcess browser;
    private final BrowserTab tab;
    private final Duration timeout;

    BrowserPageProber(BrowserProcess browser, Duration timeout) {
        this.browser = browser;
        this.tab = browser.newTab();
        this.timeout = timeout;
    }

    public static BrowserPageProber start(BrowserConfig config, Duration timeout) throws IOException {
        var browser = BrowserProcess.start(config.executable(), config.options(), null);
        log.info("Started {} for discovery", browser.version());
        try {
            return new BrowserPageProber(browser, timeout);
        } catch (RuntimeException e) {
            browser.close();
            throw e;
        }
    }

    @Override
    public ProbeResult probe(Url url) throws ProbeException, InterruptedException {
        try {
            tab.navigate(url, timeout);
        } catch (NavigationException e) {
            throw new ProbeException(url, e.getMessage(), e);
        }
        try {
            try {
                tab.scrollToBottom();
            } catch (CDPException e) {
                log.warn("Scrolling {} failed: {}", url, e.getMessage());
            }
            String title = tab.title();
            var links = new ArrayList<OutLink>();
            for (Link link : tab.extractLinks()) {
                links.add(new OutLink(link.url(), link.text()));
            }
            return new ProbeResult(title, links);
        } catch (CDPException e) {
            throw new ProbeException(url, "Browser error: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Cookie> cookies() {
        try {
            return tab.cookies();
        } catch (CDPException e) {
            log.warn("Couldn't read session cookies: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void close() {
        tab.close();
        browser.close();
    }
}
