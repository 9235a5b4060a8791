package org.netpreserve.sitemirror.util;

public class LogUtils {
    public static String ellipses(String string) {
        return ellipses(string, 200);
    }

    /**
     * Shortens a string for logging by cutting out its middle.
     */
    public static String ellipses(String string, int maxLength) {
        if (string == null || string.length() <= maxLength) return string;
        int half = maxLength / 2;
        return string.substring(0, half) + "...(" + (string.length() - maxLength) + " chars)..."
               + string.substring(string.length() - half);
    }
}
