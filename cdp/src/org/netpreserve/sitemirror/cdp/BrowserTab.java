package org.netpreserve.sitemirror.cdp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.intellij.lang.annotations.Language;
import org.netpreserve.sitemirror.cdp.protocol.CDPException;
import org.netpreserve.sitemirror.cdp.protocol.CDPTimeoutException;
import org.netpreserve.sitemirror.cdp.protocol.CdpConnection;
import org.netpreserve.sitemirror.cdp.protocol.CdpMessage;
import org.netpreserve.sitemirror.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A single page target attached in flat session mode.
 */
public class BrowserTab implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserTab.class);
    private final CdpConnection cdp;
    private final String sessionId;
    private final String targetId;
    private boolean pageEnabled;

    BrowserTab(CdpConnection cdp, String sessionId, String targetId) {
        this.cdp = cdp;
        this.sessionId = sessionId;
        this.targetId = targetId;
    }

    public String sessionId() {
        return sessionId;
    }

    private ObjectNode send(String method, Map<String, Object> params) {
        return cdp.send(sessionId, method, params);
    }

    /**
     * Navigates to the given URL and waits for the load event.
     */
    public void navigate(Url url, Duration timeout) throws NavigationException, InterruptedException {
        if (!pageEnabled) {
            send("Page.enable", Map.of());
            pageEnabled = true;
        }
        var loadEvent = new CompletableFuture<Void>();
        try (var ignored = cdp.addListener(sessionId, "Page.loadEventFired", event -> loadEvent.complete(null))) {
            ObjectNode result;
            try {
                result = cdp.send(sessionId, "Page.navigate", Map.of("url", url.toString()), timeout);
            } catch (CDPTimeoutException e) {
                throw new NavigationTimedOutException(url, timeout);
            } catch (CDPException e) {
                throw new NavigationFailedException(url, e.getMessage());
            }
            String errorText = result.path("errorText").asText("");
            if (!errorText.isEmpty()) {
                throw new NavigationFailedException(url, errorText);
            }
            loadEvent.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new NavigationTimedOutException(url, timeout);
        } catch (ExecutionException e) {
            throw new NavigationException(url, "Load event failed: " + e.getCause());
        } catch (NavigationException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // only reachable from the listener handle's close()
            throw new IllegalStateException(e);
        }
        log.debug("Loaded {}", url);
    }

    /**
     * Evaluates a JavaScript expression in the page and returns its value by JSON.
     *
     * @throws CDPException if the script threw
     */
    public JsonNode eval(@Language("JavaScript") String expression) {
        var result = send("Runtime.evaluate", Map.of(
                "expression", expression,
                "returnByValue", true,
                "awaitPromise", true));
        if (result.has("exceptionDetails")) {
            var details = result.path("exceptionDetails");
            String description = details.path("exception").path("description").asText(details.path("text").asText());
            throw new CDPException(-1, "Script error: " + description);
        }
        return result.path("result").path("value");
    }

    public String title() {
        return eval("document.title").asText("");
    }

    public Url currentUrl() {
        return new Url(eval("location.href").asText());
    }

    /**
     * Returns every anchor with an href, in document order.
     */
    public List<Link> extractLinks() {
        var array = eval("""
                Array.from(document.querySelectorAll('a[href]'))
                    .map(a => ({href: a.href, text: (a.innerText || a.textContent || '').trim()}))
                """);
        var links = new ArrayList<Link>();
        for (JsonNode node : array) {
            Url url = Url.orNull(node.path("href").asText(null));
            if (url == null || !url.isValid()) continue;
            links.add(new Link(url, node.path("text").asText("")));
        }
        return links;
    }

    /**
     * Scrolls down in steps until the document stops growing, so lazily loaded content renders.
     */
    public void scrollToBottom() {
        eval("""
                new Promise(resolve => {
                    let lastHeight = -1, steps = 0;
                    const step = () => {
                        const height = document.documentElement.scrollHeight;
                        if (height === lastHeight || steps++ > 50) {
                            window.scrollTo(0, 0);
                            resolve(true);
                            return;
                        }
                        lastHeight = height;
                        window.scrollTo(0, height);
                        setTimeout(step, 250);
                    };
                    step();
                })
                """);
    }

    /**
     * Returns the serialized DOM, including the doctype if the document has one.
     */
    public String outerHtml() {
        return eval("""
                (document.doctype ? new XMLSerializer().serializeToString(document.doctype) + '\\n' : '')
                    + document.documentElement.outerHTML
                """).asText();
    }

    public void setCookies(List<Cookie> cookies) {
        if (cookies.isEmpty()) return;
        var params = new ArrayList<Map<String, Object>>();
        for (Cookie cookie : cookies) {
            params.add(cookie.toParam());
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("cookies", params);
        send("Network.setCookies", map);
    }

    public List<Cookie> cookies() {
        var result = send("Network.getCookies", Map.of());
        return CdpMessage.JSON.convertValue(result.path("cookies"), new TypeReference<List<Cookie>>() {
        });
    }

    @Override
    public void close() {
        try {
            cdp.send("Target.closeTarget", Map.of("targetId", targetId));
        } catch (CDPException e) {
            log.debug("Failed to close target {}", targetId, e);
        }
    }
}
