package org.netpreserve.sitemirror.cdp;

import org.netpreserve.sitemirror.util.Url;

/**
 * An anchor found in a rendered page.
 *
 * @param url  absolute target, as resolved by the browser
 * @param text visible anchor text, trimmed
 */
public record Link(Url url, String text) {
}
