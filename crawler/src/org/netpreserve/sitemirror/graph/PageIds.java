package org.netpreserve.sitemirror.graph;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Url;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives stable page identifiers from URLs.
 * <p>
 * Pages whose URL carries a 32-hex-digit page ID (as the last path segment, or its suffix after a
 * dash) are identified by that ID, so the same page reached through differently titled URLs maps to
 * one node. Any other page is identified by its canonical URL without query or fragment.
 */
public final class PageIds {
    private static final Pattern TRAILING_HEX_ID = Pattern.compile("(?:^|[-/])([0-9a-fA-F]{32})/?$");
    private static final Pattern QUERY_HEX_ID = Pattern.compile("(?:^|&)p=([0-9a-fA-F]{32})(?:&|$)");

    private PageIds() {
    }

    public static String fromUrl(Url url) {
        String hexId = hexId(url);
        if (hexId != null) return hexId;
        Url canonical = url.canonical().withoutQueryOrFragment();
        if (canonical.path().isEmpty()) return canonical + "/";
        return canonical.toString();
    }

    /**
     * Returns the 32-hex-digit page ID embedded in the URL, lowercased, or null if there isn't one.
     */
    public static @Nullable String hexId(Url url) {
        String query = url.query();
        if (query != null) {
            Matcher matcher = QUERY_HEX_ID.matcher(query);
            if (matcher.find()) return matcher.group(1).toLowerCase(Locale.ROOT);
        }
        Matcher matcher = TRAILING_HEX_ID.matcher(url.path());
        if (matcher.find()) return matcher.group(1).toLowerCase(Locale.ROOT);
        return null;
    }

    /**
     * Guesses a human-readable title from the last path segment, e.g. {@code /Lab-1-29d9...} gives
     * {@code Lab 1}. Returns null when nothing readable remains.
     */
    public static @Nullable String slug(Url url) {
        String path = url.path();
        if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        String segment = path.substring(path.lastIndexOf('/') + 1);
        segment = segment.replaceFirst("-?[0-9a-fA-F]{32}$", "");
        int dot = segment.lastIndexOf('.');
        if (dot > 0) segment = segment.substring(0, dot);
        try {
            segment = URLDecoder.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escape, keep it raw
        }
        segment = segment.replace('-', ' ').replace('_', ' ').strip();
        return segment.isEmpty() ? null : segment;
    }
}
