/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final output unit handed to the presentation layer.
 *
 * @param candidate
 *            recommended activity
 * @param breakdown
 *            score components (never shown to the user as numbers)
 * @param explanation
 *            short human-readable justification
 * @param sponsored
 *            true for boosted or premium placements
 * @param confidence
 *            final score relative to 100, capped at 1.0
 * @param generatedAt
 *            when the recommendation was produced
 * @param expiresAt
 *            when the recommendation should no longer be shown
 */
public record RecommendationType(CandidateType candidate, ScoreBreakdownType breakdown, String explanation,
        @JsonProperty("is_sponsored") boolean sponsored, double confidence,
        @JsonProperty("generated_at") Instant generatedAt, @JsonProperty("expires_at") Instant expiresAt) {

    public double finalScore() {
        return breakdown.finalScore();
    }
}
