/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.util;

import java.util.Locale;

/**
 * Normalization helpers for category names and feedback tags.
 *
 * <p>
 * Categories are compared case-insensitively everywhere in the engine, so every category string entering a record or a
 * lookup passes through {@link #normalize(String)} first. Tags additionally collapse spaces and hyphens into
 * underscores so that "too far", "too-far" and "TOO_FAR" are the same signal.
 */
public final class CategoryNames {

    private CategoryNames() {
        // Utility class, no instantiation
    }

    /**
     * Normalizes a category name to trimmed lower case.
     *
     * @param category
     *            raw category, may be null
     * @return normalized category, or empty string for null input
     */
    public static String normalize(String category) {
        if (category == null) {
            return "";
        }
        return category.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes a feedback tag: lower case, with runs of whitespace or hyphens replaced by a single underscore.
     *
     * @param tag
     *            raw tag, may be null
     * @return normalized tag, or empty string for null input
     */
    public static String normalizeTag(String tag) {
        if (tag == null) {
            return "";
        }
        return tag.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }
}
