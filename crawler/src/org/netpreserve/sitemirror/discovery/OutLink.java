package org.netpreserve.sitemirror.discovery;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Url;

/**
 * A link found on a probed page.
 */
public record OutLink(Url url, @Nullable String text) {
}
