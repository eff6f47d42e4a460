/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Paid-placement level of a candidate.
 *
 * <p>
 * Multipliers are not stored here; they come from {@link villagecompute.recommendations.config.ScoringWeights} so they
 * can be tuned without touching the enum.
 */
public enum SponsorTier {

    ORGANIC("organic"), BOOSTED("boosted"), PREMIUM("premium");

    private final String value;

    SponsorTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isSponsored() {
        return this != ORGANIC;
    }

    /**
     * Parses a stored tier value. Unknown or missing values are treated as organic.
     */
    @JsonCreator
    public static SponsorTier fromValue(String value) {
        if (value == null) {
            return ORGANIC;
        }
        for (SponsorTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value.trim())) {
                return tier;
            }
        }
        return ORGANIC;
    }
}
