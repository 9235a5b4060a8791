package org.netpreserve.sitemirror.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns page titles into directory names that are safe on both Windows and POSIX filesystems.
 */
public final class FileNames {
    public static final int MAX_LENGTH = 150;
    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGES = Pattern.compile("^[._]+|[._]+$");
    private static final Set<String> RESERVED = Set.of("CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    /**
     * Lowercased names of the files the mirror writes next to page directories. A page directory
     * must never take one of these names.
     */
    public static final Set<String> OUTPUT_FILES = Set.of("index.html", ".block-ids.json", "site-graph.json");

    private FileNames() {
    }

    /**
     * Sanitizes a title for use as a single path segment. Never returns an empty string.
     */
    public static String sanitize(String title) {
        String name = UNSAFE.matcher(title).replaceAll("");
        name = WHITESPACE.matcher(name.strip()).replaceAll("_");
        name = EDGES.matcher(name).replaceAll("");
        if (name.isEmpty()) return "Untitled";
        if (RESERVED.contains(name.toUpperCase(Locale.ROOT))) name = name + "_";
        if (name.length() > MAX_LENGTH) {
            String hash = md5Hex(title).substring(0, 8);
            name = name.substring(0, MAX_LENGTH - hash.length() - 1) + "_" + hash;
        }
        return name;
    }

    /**
     * Returns {@code name}, or the first of {@code name_2}, {@code name_3}, ... not in {@code taken}.
     * Comparison ignores case so that siblings stay distinct on case-insensitive filesystems.
     *
     * @param taken lowercased names already in use; the returned name is added to it
     */
    public static String unique(String name, Set<String> taken) {
        String candidate = name;
        for (int i = 2; !taken.add(candidate.toLowerCase(Locale.ROOT)); i++) {
            candidate = name + "_" + i;
        }
        return candidate;
    }

    private static String md5Hex(String s) {
        try {
            var digest = MessageDigest.getInstance("MD5").digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is a required JDK algorithm", e);
        }
    }
}
