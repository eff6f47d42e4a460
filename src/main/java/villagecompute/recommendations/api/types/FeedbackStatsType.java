/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of a user's feedback history, used to show learning progress.
 *
 * @param totalFeedback
 *            number of feedback events recorded
 * @param positiveCount
 *            number of positive events
 * @param negativeCount
 *            number of negative events
 * @param satisfactionRate
 *            positive share in percent (0 when there is no feedback)
 * @param topCategories
 *            up to five favorite categories from the learned profile
 */
public record FeedbackStatsType(@JsonProperty("total_feedback") int totalFeedback,
        @JsonProperty("positive_count") int positiveCount, @JsonProperty("negative_count") int negativeCount,
        @JsonProperty("satisfaction_rate") double satisfactionRate,
        @JsonProperty("top_categories") List<String> topCategories) {
}
