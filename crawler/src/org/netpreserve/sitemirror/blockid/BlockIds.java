package org.netpreserve.sitemirror.blockid;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Raw block IDs are 32 lowercase hex digits. The canonical form is dashed like a UUID (8-4-4-4-12).
 */
public final class BlockIds {
    public static final int RAW_LENGTH = 32;
    private static final Pattern RAW = Pattern.compile("[0-9a-f]{32}");
    private static final Pattern CANONICAL_OR_RAW = Pattern.compile("[0-9a-fA-F-]{32,36}");

    private BlockIds() {
    }

    public static boolean isRaw(@Nullable String id) {
        return id != null && RAW.matcher(id).matches();
    }

    /**
     * Formats a raw ID as {@code xxxxxxxx-xxxx-xxxx-xxxx-xxxxxxxxxxxx}.
     *
     * @throws IllegalArgumentException if {@code raw} isn't a raw block ID
     */
    public static String format(String raw) {
        if (!isRaw(raw)) throw new IllegalArgumentException("Not a raw block ID: " + raw);
        return raw.substring(0, 8) + '-' + raw.substring(8, 12) + '-' + raw.substring(12, 16) + '-'
               + raw.substring(16, 20) + '-' + raw.substring(20, 32);
    }

    public static String stripSeparators(String id) {
        return id.replace("-", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Reduces a raw or dashed ID in any case to its raw form, or returns null if it isn't a block ID.
     */
    public static @Nullable String normalize(@Nullable String id) {
        if (id == null || !CANONICAL_OR_RAW.matcher(id).matches()) return null;
        String raw = stripSeparators(id);
        return isRaw(raw) ? raw : null;
    }
}
