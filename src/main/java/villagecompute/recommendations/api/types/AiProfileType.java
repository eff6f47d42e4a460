/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.recommendations.util.CategoryNames;

/**
 * Learned preference record, the only state the engine mutates (through
 * {@link villagecompute.recommendations.services.ProfileLearner}).
 *
 * <p>
 * This type defines the structure of the document the profile collaborator stores per user. Unknown keys are ignored
 * and missing keys take the defaults from {@link #createDefault()}, so older or hand-edited documents still load.
 *
 * <p>
 * A category should never be in both lists. The record does not enforce that (a stored document may already violate
 * it); the next learning transition repairs it.
 *
 * @param schemaVersion
 *            document schema version (current: 1)
 * @param favoriteCategories
 *            liked categories, oldest first
 * @param dislikedCategories
 *            disliked categories, oldest first
 * @param priceSensitivity
 *            learned price sensitivity
 * @param preferredDistanceMiles
 *            learned comfortable travel distance; null until a distance signal has been learned
 * @param distanceTolerance
 *            learned distance tolerance
 * @param budgetLevel
 *            learned typical price tier, 0 - 3; null until a price signal has been learned
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record AiProfileType(@JsonProperty("schema_version") Integer schemaVersion,
        @JsonProperty("favorite_categories") List<String> favoriteCategories,
        @JsonProperty("disliked_categories") List<String> dislikedCategories,
        @JsonProperty("price_sensitivity") PriceSensitivity priceSensitivity,
        @JsonProperty("preferred_distance_miles") Double preferredDistanceMiles,
        @JsonProperty("distance_tolerance") DistanceTolerance distanceTolerance,
        @JsonProperty("budget_level") Integer budgetLevel) {

    public static final int CURRENT_SCHEMA_VERSION = 1;
    public static final double DEFAULT_PREFERRED_DISTANCE_MILES = 5.0;
    public static final int DEFAULT_BUDGET_LEVEL = 2;

    public AiProfileType {
        schemaVersion = schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
        favoriteCategories = normalizedList(favoriteCategories);
        dislikedCategories = normalizedList(dislikedCategories);
        priceSensitivity = priceSensitivity == null ? PriceSensitivity.MEDIUM : priceSensitivity;
        distanceTolerance = distanceTolerance == null ? DistanceTolerance.MEDIUM : distanceTolerance;
        budgetLevel = budgetLevel == null ? null : Math.max(0, Math.min(3, budgetLevel));
    }

    /**
     * Creates the profile every new user starts with.
     *
     * @return profile with no category signals, medium sensitivity and tolerance, and no learned distance
     *         or budget
     */
    public static AiProfileType createDefault() {
        return new AiProfileType(CURRENT_SCHEMA_VERSION, List.of(), List.of(), PriceSensitivity.MEDIUM, null,
                DistanceTolerance.MEDIUM, null);
    }

    /**
     * Learned budget, or {@link #DEFAULT_BUDGET_LEVEL} as the starting point for the first price signal.
     */
    public int budgetLevelOrDefault() {
        return budgetLevel != null ? budgetLevel : DEFAULT_BUDGET_LEVEL;
    }

    public boolean hasLearnedDistance() {
        return preferredDistanceMiles != null;
    }

    /**
     * Learned distance, or {@link #DEFAULT_PREFERRED_DISTANCE_MILES} as the starting point for the first distance
     * signal.
     */
    public double preferredDistanceOrDefault() {
        return preferredDistanceMiles != null ? preferredDistanceMiles : DEFAULT_PREFERRED_DISTANCE_MILES;
    }

    public boolean isFavorite(String category) {
        return favoriteCategories.contains(CategoryNames.normalize(category));
    }

    public boolean isDisliked(String category) {
        return dislikedCategories.contains(CategoryNames.normalize(category));
    }

    public AiProfileType withCategories(List<String> favorites, List<String> disliked) {
        return new AiProfileType(schemaVersion, favorites, disliked, priceSensitivity, preferredDistanceMiles,
                distanceTolerance, budgetLevel);
    }

    public AiProfileType withPriceSensitivity(PriceSensitivity sensitivity) {
        return new AiProfileType(schemaVersion, favoriteCategories, dislikedCategories, sensitivity,
                preferredDistanceMiles, distanceTolerance, budgetLevel);
    }

    public AiProfileType withPreferredDistance(double miles) {
        return new AiProfileType(schemaVersion, favoriteCategories, dislikedCategories, priceSensitivity, miles,
                distanceTolerance, budgetLevel);
    }

    public AiProfileType withDistanceTolerance(DistanceTolerance tolerance) {
        return new AiProfileType(schemaVersion, favoriteCategories, dislikedCategories, priceSensitivity,
                preferredDistanceMiles, tolerance, budgetLevel);
    }

    public AiProfileType withBudgetLevel(int level) {
        return new AiProfileType(schemaVersion, favoriteCategories, dislikedCategories, priceSensitivity,
                preferredDistanceMiles, distanceTolerance, level);
    }

    private static List<String> normalizedList(List<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String category : categories) {
            String value = CategoryNames.normalize(category);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return List.copyOf(new ArrayList<>(normalized));
    }
}
