/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.recommendations.util.CategoryNames;

/**
 * One user reaction to one completed activity.
 *
 * <p>
 * Category and price tier are copied from the candidate when the feedback is captured. Tags are normalized on
 * construction (see {@link CategoryNames#normalizeTag(String)}); unknown tags are kept and ignored by the learner.
 *
 * @param category
 *            category of the completed activity
 * @param priceTier
 *            price tier of the completed activity (nullable)
 * @param rating
 *            positive or negative
 * @param tags
 *            qualifier strings such as "too far" or "great value"
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FeedbackEventType(String category, @JsonProperty("price_tier") Integer priceTier,
        FeedbackRating rating, Set<String> tags) {

    public FeedbackEventType {
        Set<String> normalized = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                String value = CategoryNames.normalizeTag(tag);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        tags = Set.copyOf(normalized);
    }

    public static FeedbackEventType positive(String category, String... tags) {
        return new FeedbackEventType(category, null, FeedbackRating.POSITIVE,
                new LinkedHashSet<>(Arrays.asList(tags)));
    }

    public static FeedbackEventType negative(String category, String... tags) {
        return new FeedbackEventType(category, null, FeedbackRating.NEGATIVE,
                new LinkedHashSet<>(Arrays.asList(tags)));
    }

    public FeedbackEventType withPriceTier(Integer priceTier) {
        return new FeedbackEventType(category, priceTier, rating, tags);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
