package org.netpreserve.sitemirror.discovery;

import org.netpreserve.sitemirror.UrlMatcher;
import org.netpreserve.sitemirror.config.ScopeConfig;
import org.netpreserve.sitemirror.util.Url;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which links discovery follows. The root URL's host is always in scope; excludes win
 * over includes.
 */
public class SiteScope {
    private final List<UrlMatcher> include = new ArrayList<>();
    private final List<UrlMatcher> exclude = new ArrayList<>();

    public SiteScope(Url rootUrl, ScopeConfig config) {
        String host = rootUrl.host();
        if (host != null) include.add(new UrlMatcher.Host(host));
        if (config != null) {
            if (config.include() != null) include.addAll(config.include());
            if (config.exclude() != null) exclude.addAll(config.exclude());
        }
    }

    public boolean inScope(Url url) {
        if (!url.isHttp() || !url.isValid()) return false;
        for (UrlMatcher matcher : exclude) {
            if (matcher.test(url)) return false;
        }
        for (UrlMatcher matcher : include) {
            if (matcher.test(url)) return true;
        }
        return false;
    }
}
