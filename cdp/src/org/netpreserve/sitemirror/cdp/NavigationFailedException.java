package org.netpreserve.sitemirror.cdp;

import org.netpreserve.sitemirror.util.Url;

public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(Url url, String errorText) {
        super(url, "Navigation failed: " + errorText);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
