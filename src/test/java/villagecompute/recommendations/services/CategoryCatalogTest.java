/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CategoryCatalog}.
 */
class CategoryCatalogTest {

    private final CategoryCatalog catalog = new CategoryCatalog();

    @Test
    void testIsRelated_symmetricAndCaseInsensitive() {
        assertTrue(catalog.isRelated("Dining", "coffee"));
        assertTrue(catalog.isRelated("coffee", " DINING "));
        assertTrue(catalog.isRelated("hiking", "outdoor"), "Related lookup works from either side");
        assertFalse(catalog.isRelated("coffee", "coffee"), "A category is not related to itself");
        assertFalse(catalog.isRelated("coffee", "fitness"));
        assertFalse(catalog.isRelated(null, "coffee"));
    }

    @Test
    void testIsRelatedToAny() {
        assertTrue(catalog.isRelatedToAny("nightlife", List.of("hiking", "bars")));
        assertFalse(catalog.isRelatedToAny("nightlife", List.of("hiking")));
        assertFalse(catalog.isRelatedToAny("nightlife", null));
    }

    @Test
    void testHourWindows() {
        assertTrue(catalog.isIdealHour("coffee", 7));
        assertFalse(catalog.isIdealHour("coffee", 10), "Window end is exclusive");
        assertTrue(catalog.isGoodHour("coffee", 10));
        assertTrue(catalog.isIdealHour("bars", 23));
        assertTrue(catalog.isIdealHour("bars", 1), "Window wraps past midnight");
        assertFalse(catalog.isIdealHour("bars", 2));
        assertTrue(catalog.isGoodHour("dining", 12));
        assertTrue(catalog.isGoodHour("dining", 17));
        assertFalse(catalog.isIdealHour("unknown", 12));
        assertFalse(catalog.isGoodHour("unknown", 12));
    }

    @Test
    void testHourWindow_contains() {
        CategoryCatalog.HourWindow overnight = new CategoryCatalog.HourWindow(22, 3);

        assertTrue(overnight.contains(22));
        assertTrue(overnight.contains(0));
        assertFalse(overnight.contains(3));
        assertFalse(overnight.contains(12));
    }
}
