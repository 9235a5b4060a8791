package org.netpreserve.sitemirror.cdp;

import org.netpreserve.sitemirror.util.Url;

import java.time.Duration;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(Url url, Duration timeout) {
        super(url, "No load event after " + timeout.toSeconds() + "s");
    }
}
