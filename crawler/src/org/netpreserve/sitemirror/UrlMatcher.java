package org.netpreserve.sitemirror;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.netpreserve.sitemirror.util.Url;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

@JsonSubTypes({
        @JsonSubTypes.Type(value = UrlMatcher.Host.class),
        @JsonSubTypes.Type(value = UrlMatcher.Domain.class),
        @JsonSubTypes.Type(value = UrlMatcher.Regex.class),
        @JsonSubTypes.Type(value = UrlMatcher.Prefix.class),
})
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
public sealed interface UrlMatcher extends Predicate<Url> {
    record Host(String host) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return host.equalsIgnoreCase(url.host());
        }
    }

    record Domain(String domain) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            String host = url.host();
            if (host == null) return false;
            String lowerCaseDomain = domain.toLowerCase(Locale.ROOT);
            return host.equals(lowerCaseDomain) || host.endsWith("." + lowerCaseDomain);
        }
    }

    record Regex(String regex) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return Pattern.compile(regex).matcher(url.toString()).matches();
        }
    }

    record Prefix(Url prefix) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return url.startsWith(prefix);
        }
    }
}
