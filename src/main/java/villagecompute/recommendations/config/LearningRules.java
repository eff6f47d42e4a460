/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

/**
 * Step sizes and bounds for feedback-driven profile updates.
 *
 * @param distanceStepMiles
 *            how much "too far" or "convenient" shrinks the preferred distance
 * @param minPreferredDistanceMiles
 *            floor for the preferred distance
 * @param maxTrackedCategories
 *            favorite and disliked lists keep at most this many recent entries
 * @param budgetBlendWeight
 *            weight of a liked activity's price tier when blending the learned budget level
 */
public record LearningRules(double distanceStepMiles, double minPreferredDistanceMiles, int maxTrackedCategories,
        double budgetBlendWeight) {

    public static LearningRules defaults() {
        return new LearningRules(0.5, 0.5, 10, 0.3);
    }
}
