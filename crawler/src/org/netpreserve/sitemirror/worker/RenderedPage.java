package org.netpreserve.sitemirror.worker;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Url;

/**
 * @param url  where the browser ended up after redirects
 * @param html the serialized DOM after scripts ran
 */
public record RenderedPage(Url url, @Nullable String title, String html) {
}
