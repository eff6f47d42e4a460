/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.SponsorTier;
import villagecompute.recommendations.config.ScoringWeights;

/**
 * Applies the paid-placement multiplier to a score breakdown.
 *
 * <p>
 * <b>Multipliers:</b> organic 1.0, boosted 1.15, premium 1.30 (configurable).
 *
 * <p>
 * <b>Anti-spam rule:</b> when the unboosted total is below {@value #WEAK_MATCH_THRESHOLD} the boost adds at most
 * {@value #WEAK_MATCH_MAX_BOOST} points. This rule is fixed and not part of the configurable weights.
 */
@ApplicationScoped
public class SponsorBoostApplier {

    private static final Logger LOG = Logger.getLogger(SponsorBoostApplier.class);

    /**
     * Unboosted totals below this are weak organic matches.
     */
    public static final double WEAK_MATCH_THRESHOLD = 40.0;

    /**
     * Largest number of points a sponsor boost may add to a weak match.
     */
    public static final double WEAK_MATCH_MAX_BOOST = 10.0;

    @Inject
    ScoringWeights weights;

    /**
     * Applies the tier's multiplier.
     *
     * @param breakdown
     *            unboosted breakdown from {@link ScoreCalculator}
     * @param tier
     *            sponsor tier (null is treated as organic)
     * @return breakdown with {@code sponsorMultiplier} and {@code finalScore} set
     */
    public ScoreBreakdownType applyBoost(ScoreBreakdownType breakdown, SponsorTier tier) {
        if (breakdown == null) {
            throw new IllegalArgumentException("breakdown is required");
        }
        double multiplier = weights.sponsor().multiplierFor(tier);
        double baseTotal = breakdown.baseTotal();

        double boostedFinal;
        if (multiplier <= 1.0) {
            boostedFinal = baseTotal;
        } else if (baseTotal < WEAK_MATCH_THRESHOLD) {
            double boost = Math.min(baseTotal * (multiplier - 1.0), WEAK_MATCH_MAX_BOOST);
            boostedFinal = baseTotal + boost;
            LOG.debugf("Capped %s boost for weak match: baseTotal=%.1f, boost=%.2f", tier, baseTotal, boost);
        } else {
            boostedFinal = baseTotal * multiplier;
        }
        return breakdown.withBoost(multiplier, boostedFinal);
    }
}
