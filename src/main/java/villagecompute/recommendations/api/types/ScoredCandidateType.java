/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.Comparator;

/**
 * A candidate paired with its (boosted) score breakdown.
 *
 * @param candidate
 *            the scored candidate
 * @param breakdown
 *            score components and final score
 */
public record ScoredCandidateType(CandidateType candidate, ScoreBreakdownType breakdown) {

    /**
     * Ranking order: final score descending, then candidate id ascending.
     */
    public static final Comparator<ScoredCandidateType> RANK_ORDER = Comparator
            .comparingDouble(ScoredCandidateType::finalScore).reversed()
            .thenComparing(scored -> scored.candidate().id(), Comparator.nullsLast(Comparator.naturalOrder()));

    public double finalScore() {
        return breakdown.finalScore();
    }

    public String category() {
        return candidate.category();
    }

    public boolean isSponsored() {
        return candidate.isSponsored();
    }
}
