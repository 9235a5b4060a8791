package org.netpreserve.sitemirror.cdp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A browser cookie as reported by Network.getCookies.
 *
 * @param expires seconds since the epoch, or a non-positive value for a session cookie
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Cookie(
        String name,
        String value,
        @Nullable String domain,
        @Nullable String path,
        @Nullable Double expires,
        boolean httpOnly,
        boolean secure,
        @Nullable String sameSite) {

    /**
     * Converts to the CookieParam shape accepted by Network.setCookies.
     */
    Map<String, Object> toParam() {
        var param = new LinkedHashMap<String, Object>();
        param.put("name", name);
        param.put("value", value);
        if (domain != null) param.put("domain", domain);
        if (path != null) param.put("path", path);
        if (expires != null && expires > 0) param.put("expires", expires);
        param.put("httpOnly", httpOnly);
        param.put("secure", secure);
        if (sameSite != null) param.put("sameSite", sameSite);
        return param;
    }
}
