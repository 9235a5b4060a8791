package org.netpreserve.sitemirror.config;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Url;

import java.nio.file.Path;

/**
 * Root configuration for a mirror run.
 *
 * @param rootUrl   the page discovery starts from
 * @param outputDir where the mirror is written
 * @param discovery how far to crawl
 * @param pool      how the download phase is parallelized
 * @param browser   what to render with
 * @param scope     which hosts and URLs beyond the root's host are followed
 */
public record MirrorConfig(
        @Nullable Url rootUrl,
        Path outputDir,
        DiscoveryConfig discovery,
        PoolConfig pool,
        BrowserConfig browser,
        ScopeConfig scope
) {
    public MirrorConfig {
        if (outputDir == null) outputDir = Path.of("mirror");
        if (discovery == null) discovery = new DiscoveryConfig(10, null);
        if (pool == null) pool = new PoolConfig(0, 3, null, true, null, null, null);
        if (browser == null) browser = new BrowserConfig(null, null);
        if (scope == null) scope = new ScopeConfig(null, null);
    }

    public MirrorConfig withRootUrl(Url rootUrl) {
        return new MirrorConfig(rootUrl, outputDir, discovery, pool, browser, scope);
    }

    public MirrorConfig withOutputDir(Path outputDir) {
        return new MirrorConfig(rootUrl, outputDir, discovery, pool, browser, scope);
    }

    public MirrorConfig withDiscovery(DiscoveryConfig discovery) {
        return new MirrorConfig(rootUrl, outputDir, discovery, pool, browser, scope);
    }

    public MirrorConfig withPool(PoolConfig pool) {
        return new MirrorConfig(rootUrl, outputDir, discovery, pool, browser, scope);
    }
}
