package org.netpreserve.sitemirror;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitemirror.util.Url;

import static org.junit.jupiter.api.Assertions.*;

class UrlMatcherTest {
    @Test
    public void testHost() {
        var matcher = new UrlMatcher.Host("example.com");
        assertTrue(matcher.test(new Url("https://example.com")));
        assertTrue(matcher.test(new Url("https://example.com/path")));
        assertTrue(matcher.test(new Url("http://EXAMPLE.COM"))); // case insensitive host
        assertFalse(matcher.test(new Url("https://subdomain.example.com")));
        assertFalse(matcher.test(new Url("https://othersite.com")));
    }

    @Test
    public void testDomain() {
        var matcher = new UrlMatcher.Domain("Example.com");
        assertTrue(matcher.test(new Url("https://example.com")));
        assertTrue(matcher.test(new Url("https://subdomain.example.com")));
        assertTrue(matcher.test(new Url("https://sub.sub.example.com")));
        assertFalse(matcher.test(new Url("https://notexample.com")));
        assertFalse(matcher.test(new Url("mailto:someone@example.com")));
    }

    @Test
    public void testPrefix() {
        var matcher = new UrlMatcher.Prefix(new Url("https://example.com/path"));
        assertTrue(matcher.test(new Url("https://example.com/path")));
        assertTrue(matcher.test(new Url("https://example.com/path/subpath")));
        assertTrue(matcher.test(new Url("https://example.com/path?query=1")));
        assertFalse(matcher.test(new Url("https://example.com/other")));
        assertFalse(matcher.test(new Url("http://example.com/path")));
        assertFalse(matcher.test(new Url("https://example.com:8443/path")));
    }

    @Test
    public void testRegex() {
        var matcher = new UrlMatcher.Regex("https://.*\\.example\\.com/.*");
        assertTrue(matcher.test(new Url("https://sub.example.com/page")));
        assertFalse(matcher.test(new Url("https://example.com/page")));
        assertFalse(matcher.test(new Url("http://sub.example.com/page")));
    }
}
