/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.jobs;

/**
 * Asynchronous job types handled by the recommendation engine.
 */
public enum JobType {

    /**
     * Folds one feedback event into the user's AI profile. Payload: {@code user_id}, {@code feedback}.
     */
    PROFILE_LEARNING("Profile learning (per feedback event)");

    private final String description;

    JobType(String description) {
        this.description = description;
    }

    /**
     * Returns a human-readable description.
     */
    public String getDescription() {
        return description;
    }
}
