package org.netpreserve.sitemirror.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.urlcanon.Canonicalizer;
import org.netpreserve.urlcanon.ParsedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * URL type which caches parsing.
 */
public class Url {
    private final String url;
    private URI uri;
    private ParsedUrl parsedUrl;

    @JsonCreator
    public Url(String url) {
        this.url = Objects.requireNonNull(url, "url");
    }

    private Url(ParsedUrl parsedUrl) {
        this(parsedUrl.toString());
        this.parsedUrl = parsedUrl;
    }

    public static @Nullable Url orNull(@Nullable String url) {
        if (url == null) return null;
        return new Url(url);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    private synchronized ParsedUrl parse() {
        if (parsedUrl == null) {
            parsedUrl = ParsedUrl.parseUrl(url);
        }
        return parsedUrl;
    }

    /**
     * Returns true if this URL parses as an absolute URI.
     */
    public boolean isValid() {
        try {
            return toURI().isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public @Nullable String host() {
        String host = parse().getHost();
        return host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
    }

    public @Nullable String scheme() {
        String scheme = parse().getScheme();
        return scheme.isEmpty() ? null : scheme;
    }

    public String path() {
        return parse().getPath();
    }

    public @Nullable String query() {
        ParsedUrl parsed = parse();
        return parsed.getQuestionMark().isEmpty() ? null : parsed.getQuery();
    }

    public @Nullable String fragment() {
        ParsedUrl parsed = parse();
        return parsed.getHashSign().isEmpty() ? null : parsed.getFragment();
    }

    private static boolean startsWithIgnoreCase(String str, String prefix) {
        return str.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    public boolean isHttp() {
        return startsWithIgnoreCase(url, "http:") ||
               startsWithIgnoreCase(url, "https:");
    }

    public Url withoutFragment() {
        int i = url.indexOf('#');
        if (i == -1) {
            return this;
        }
        return new Url(url.substring(0, i));
    }

    /**
     * Strips both the query string and the fragment.
     */
    public Url withoutQueryOrFragment() {
        ParsedUrl parsed = parse();
        if (parsed.getQuestionMark().isEmpty() && parsed.getHashSign().isEmpty()) {
            return this;
        }
        ParsedUrl copy = new ParsedUrl(parsed);
        copy.setQuestionMark("");
        copy.setQuery("");
        copy.setHashSign("");
        copy.setFragment("");
        return new Url(copy);
    }

    /**
     * WHATWG canonical form with the scheme and host lowercased and any default port elided. Differently
     * spelled URLs of the same resource share one canonical form.
     */
    public Url canonical() {
        ParsedUrl copy = new ParsedUrl(parse());
        Canonicalizer.WHATWG.canonicalize(copy);
        copy.setScheme(copy.getScheme().toLowerCase(Locale.ROOT));
        copy.setHost(copy.getHost().toLowerCase(Locale.ROOT));
        if (isDefaultPort(copy.getScheme(), copy.getPort())) {
            copy.setColonBeforePort("");
            copy.setPort("");
        }
        return new Url(copy);
    }

    private static boolean isDefaultPort(String scheme, String port) {
        return switch (scheme.toLowerCase(Locale.ROOT)) {
            case "http" -> port.equals("80");
            case "https" -> port.equals("443");
            default -> false;
        };
    }

    /**
     * Resolves a possibly relative reference against this URL.
     *
     * @throws IllegalArgumentException if either this URL or the reference is malformed
     */
    public Url resolve(String reference) {
        try {
            return new Url(toURI().resolve(reference.trim()).toString());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
    }

    public boolean sameHost(Url other) {
        String host = host();
        return host != null && host.equals(other.host());
    }

    public boolean startsWith(Url prefix) {
        ParsedUrl parsed = parse();
        ParsedUrl prefixParsed = prefix.parse();
        return parsed.getScheme().equalsIgnoreCase(prefixParsed.getScheme()) &&
               Objects.equals(host(), prefix.host()) &&
               parsed.getPort().equals(prefixParsed.getPort()) &&
               parsed.getPath().startsWith(prefixParsed.getPath());
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
