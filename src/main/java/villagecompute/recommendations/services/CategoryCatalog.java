/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import villagecompute.recommendations.util.CategoryNames;

/**
 * Static knowledge about activity categories: which categories are related, and at which hours of the day each
 * category is an ideal or good fit.
 *
 * <p>
 * <b>Related categories</b> are symmetric: "coffee" relates to "dining" and "dining" relates to "coffee" even when only
 * one side lists the other. Categories missing from the tables have no related categories and no time windows; they
 * still score normally, just without those bonuses.
 *
 * <p>
 * <b>Time windows</b> are half-open hour ranges {@code [start, end)} on a 24 hour clock. A window whose start is after
 * its end wraps past midnight (bars {@code [21, 2)} covers 21:00 to 01:59).
 */
@ApplicationScoped
public class CategoryCatalog {

    private static final Map<String, Set<String>> RELATED_CATEGORIES = Map.of("coffee", Set.of("dining", "breakfast"),
            "bars", Set.of("nightlife", "entertainment", "live music"), "dining", Set.of("coffee", "bars"), "fitness",
            Set.of("outdoor", "wellness", "sports"), "arts", Set.of("culture", "entertainment"), "live music",
            Set.of("bars", "nightlife", "entertainment"), "shopping", Set.of("arts", "culture"), "outdoor",
            Set.of("hiking", "parks"), "museum", Set.of("arts", "culture"));

    private static final Map<String, List<HourWindow>> IDEAL_WINDOWS = Map.ofEntries(
            Map.entry("coffee", List.of(new HourWindow(7, 10))), Map.entry("breakfast", List.of(new HourWindow(7, 10))),
            Map.entry("dining", List.of(new HourWindow(18, 20))), Map.entry("food", List.of(new HourWindow(18, 20))),
            Map.entry("restaurant", List.of(new HourWindow(18, 20))),
            Map.entry("bars", List.of(new HourWindow(21, 2))), Map.entry("nightlife", List.of(new HourWindow(22, 3))),
            Map.entry("live music", List.of(new HourWindow(19, 23))),
            Map.entry("entertainment", List.of(new HourWindow(18, 23))),
            Map.entry("fitness", List.of(new HourWindow(6, 9))), Map.entry("outdoor", List.of(new HourWindow(7, 11))),
            Map.entry("hiking", List.of(new HourWindow(7, 11))), Map.entry("parks", List.of(new HourWindow(10, 16))),
            Map.entry("arts", List.of(new HourWindow(14, 17))), Map.entry("culture", List.of(new HourWindow(14, 17))),
            Map.entry("museum", List.of(new HourWindow(11, 16))),
            Map.entry("shopping", List.of(new HourWindow(14, 17))),
            Map.entry("wellness", List.of(new HourWindow(8, 11))), Map.entry("sports", List.of(new HourWindow(17, 21))));

    private static final Map<String, List<HourWindow>> GOOD_WINDOWS = Map.ofEntries(
            Map.entry("coffee", List.of(new HourWindow(10, 15))),
            Map.entry("breakfast", List.of(new HourWindow(10, 12))),
            Map.entry("dining", List.of(new HourWindow(11, 14), new HourWindow(17, 21))),
            Map.entry("food", List.of(new HourWindow(11, 14), new HourWindow(17, 21))),
            Map.entry("restaurant", List.of(new HourWindow(11, 14), new HourWindow(17, 21))),
            Map.entry("bars", List.of(new HourWindow(17, 21))), Map.entry("nightlife", List.of(new HourWindow(20, 22))),
            Map.entry("live music", List.of(new HourWindow(17, 19))),
            Map.entry("entertainment", List.of(new HourWindow(14, 18))),
            Map.entry("fitness", List.of(new HourWindow(17, 20))), Map.entry("outdoor", List.of(new HourWindow(14, 17))),
            Map.entry("hiking", List.of(new HourWindow(14, 17))), Map.entry("parks", List.of(new HourWindow(7, 10))),
            Map.entry("arts", List.of(new HourWindow(11, 14))), Map.entry("culture", List.of(new HourWindow(11, 14))),
            Map.entry("museum", List.of(new HourWindow(10, 11), new HourWindow(16, 18))),
            Map.entry("shopping", List.of(new HourWindow(11, 14))),
            Map.entry("wellness", List.of(new HourWindow(16, 19))), Map.entry("sports", List.of(new HourWindow(12, 17))));

    /**
     * Checks whether two categories are related.
     *
     * @param category
     *            candidate category
     * @param interest
     *            stated interest
     * @return true when either category lists the other as related
     */
    public boolean isRelated(String category, String interest) {
        String a = CategoryNames.normalize(category);
        String b = CategoryNames.normalize(interest);
        if (a.isEmpty() || b.isEmpty() || a.equals(b)) {
            return false;
        }
        return RELATED_CATEGORIES.getOrDefault(a, Set.of()).contains(b)
                || RELATED_CATEGORIES.getOrDefault(b, Set.of()).contains(a);
    }

    /**
     * Checks whether any of the interests is related to the category.
     */
    public boolean isRelatedToAny(String category, List<String> interests) {
        if (interests == null) {
            return false;
        }
        for (String interest : interests) {
            if (isRelated(category, interest)) {
                return true;
            }
        }
        return false;
    }

    public boolean isIdealHour(String category, int hour) {
        return inAnyWindow(IDEAL_WINDOWS.get(CategoryNames.normalize(category)), hour);
    }

    public boolean isGoodHour(String category, int hour) {
        return inAnyWindow(GOOD_WINDOWS.get(CategoryNames.normalize(category)), hour);
    }

    private static boolean inAnyWindow(List<HourWindow> windows, int hour) {
        if (windows == null) {
            return false;
        }
        for (HourWindow window : windows) {
            if (window.contains(hour)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Half-open hour range, wrapping midnight when {@code start > end}.
     */
    record HourWindow(int start, int end) {

        boolean contains(int hour) {
            if (start <= end) {
                return hour >= start && hour < end;
            }
            return hour >= start || hour < end;
        }
    }
}
