package com.cpparchitect.core.generator.impl;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps graph node keys to identifiers that every dialect accepts unquoted.
 *
 * <p>Ids match {@code n_[A-Za-z0-9_]+}. Keys that sanitize to the same id get numeric
 * suffixes in allocation order, so one allocator per document keeps ids unique.
 */
final class NodeIdAllocator {

    private static final String PREFIX = "n_";
    private static final int MAX_STEM_LENGTH = 40;
    private static final Pattern ID_UNSAFE = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");

    private final Map<String, String> idsByKey = new HashMap<>();
    private final Set<String> usedIds = new HashSet<>();

    /**
     * Returns the id of a key, allocating one on first use.
     *
     * @param key graph node key
     * @return dialect-safe unique id
     */
    String idFor(String key) {
        String existing = idsByKey.get(key);
        if (existing != null) {
            return existing;
        }
        String stem = stem(key);
        String id = stem;
        int suffix = 2;
        while (!usedIds.add(id)) {
            id = stem + "_" + suffix++;
        }
        idsByKey.put(key, id);
        return id;
    }

    private static String stem(String key) {
        String cleaned = UNDERSCORE_RUN.matcher(ID_UNSAFE.matcher(key).replaceAll("_")).replaceAll("_");
        if (cleaned.length() > MAX_STEM_LENGTH) {
            cleaned = cleaned.substring(0, MAX_STEM_LENGTH);
        }
        return PREFIX + (cleaned.isEmpty() ? "node" : cleaned);
    }
}
