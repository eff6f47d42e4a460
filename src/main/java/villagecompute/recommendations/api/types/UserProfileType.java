/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.recommendations.util.CategoryNames;

/**
 * Stated user preferences, owned by the profile collaborator and read-only to the engine.
 *
 * <p>
 * Interests are kept in stated order (the first entries are the user's top interests), normalized to lower case and
 * de-duplicated.
 *
 * @param interests
 *            ranked interest categories (0 - 10 entries)
 * @param homeLocation
 *            home coordinates (nullable)
 * @param workLocation
 *            work coordinates (nullable)
 * @param maxDistanceMiles
 *            furthest distance the user is willing to travel (nullable)
 * @param budgetLevel
 *            stated budget, 0 - 3 (nullable); the price ceiling starts from it until a budget is learned
 * @param preferredTimes
 *            preferred time-of-day buckets
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record UserProfileType(List<String> interests, @JsonProperty("home_location") GeoPointType homeLocation,
        @JsonProperty("work_location") GeoPointType workLocation,
        @JsonProperty("max_distance_miles") Double maxDistanceMiles, @JsonProperty("budget_level") Integer budgetLevel,
        @JsonProperty("preferred_times") Set<TimeOfDay> preferredTimes) {

    public UserProfileType {
        Set<String> normalized = new LinkedHashSet<>();
        if (interests != null) {
            for (String interest : interests) {
                String value = CategoryNames.normalize(interest);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        interests = List.copyOf(new ArrayList<>(normalized));

        Set<TimeOfDay> times = EnumSet.noneOf(TimeOfDay.class);
        if (preferredTimes != null) {
            for (TimeOfDay time : preferredTimes) {
                if (time != null) {
                    times.add(time);
                }
            }
        }
        preferredTimes = Set.copyOf(times);
    }

    /**
     * Creates a profile with interests only.
     */
    public static UserProfileType withInterests(String... interests) {
        return new UserProfileType(List.of(interests), null, null, null, null, Set.of());
    }

    public UserProfileType withHome(GeoPointType home) {
        return new UserProfileType(interests, home, workLocation, maxDistanceMiles, budgetLevel, preferredTimes);
    }

    public UserProfileType withWork(GeoPointType work) {
        return new UserProfileType(interests, homeLocation, work, maxDistanceMiles, budgetLevel, preferredTimes);
    }

    public UserProfileType withMaxDistance(Double maxDistanceMiles) {
        return new UserProfileType(interests, homeLocation, workLocation, maxDistanceMiles, budgetLevel,
                preferredTimes);
    }

    public UserProfileType withBudgetLevel(Integer budgetLevel) {
        return new UserProfileType(interests, homeLocation, workLocation, maxDistanceMiles, budgetLevel,
                preferredTimes);
    }

    public UserProfileType withPreferredTimes(Set<TimeOfDay> preferredTimes) {
        return new UserProfileType(interests, homeLocation, workLocation, maxDistanceMiles, budgetLevel,
                preferredTimes);
    }
}
