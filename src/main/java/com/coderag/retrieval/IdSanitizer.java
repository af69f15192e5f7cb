package com.coderag.retrieval;

import java.util.regex.Pattern;

/**
 * IdSanitizer - Turns arbitrary chunk ids into storage keys safe for both the local
 * file index and remote index services: only [A-Za-z0-9_-], at most 64 characters.
 */
public final class IdSanitizer {

    public static final int MAX_LENGTH = 64;

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");
    private static final int HASH_SUFFIX_LENGTH = 9;   // '-' + 8 hex digits

    public static String sanitize(String id) {
        String safe = UNSAFE.matcher(id).replaceAll("_");
        if (safe.length() <= MAX_LENGTH) {
            return safe;
        }
        // keep long ids distinct: shared path prefixes would otherwise collide after truncation
        String suffix = String.format("-%08x", id.hashCode());
        return safe.substring(0, MAX_LENGTH - HASH_SUFFIX_LENGTH) + suffix;
    }

    private IdSanitizer() {}
}
