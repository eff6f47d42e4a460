/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

/**
 * Per-candidate score components for one request.
 *
 * <p>
 * {@code finalScore} is derived by {@link villagecompute.recommendations.services.SponsorBoostApplier}; before the
 * boost is applied it equals {@link #baseTotal()} and {@code sponsorMultiplier} is 1.0.
 *
 * @param base
 *            interest match, 0 - 40
 * @param location
 *            proximity, 0 - 20
 * @param time
 *            time-of-day fit, 0 - 15
 * @param feedback
 *            learned preference fit, 0 - 15
 * @param collaborative
 *            cross-user signal, 0 - 10
 * @param sponsorMultiplier
 *            1.0, 1.15 or 1.30
 * @param finalScore
 *            boosted total
 * @param referenceDistanceMiles
 *            distance to the closest reference point, when one was known (nullable)
 * @param timeOfDay
 *            bucket of the request time (nullable when no request time was known)
 */
public record ScoreBreakdownType(double base, double location, double time, double feedback, double collaborative,
        double sponsorMultiplier, double finalScore, Double referenceDistanceMiles, TimeOfDay timeOfDay) {

    /**
     * Creates an unboosted breakdown whose final score equals the sum of the sub-scores.
     */
    public static ScoreBreakdownType unboosted(double base, double location, double time, double feedback,
            double collaborative, Double referenceDistanceMiles, TimeOfDay timeOfDay) {
        double total = base + location + time + feedback + collaborative;
        return new ScoreBreakdownType(base, location, time, feedback, collaborative, 1.0, total,
                referenceDistanceMiles, timeOfDay);
    }

    /**
     * Sum of the five sub-scores, before any sponsor multiplier.
     */
    public double baseTotal() {
        return base + location + time + feedback + collaborative;
    }

    /**
     * Points added by the sponsor boost.
     */
    public double sponsorBoost() {
        return finalScore - baseTotal();
    }

    public ScoreBreakdownType withBoost(double multiplier, double boostedFinal) {
        return new ScoreBreakdownType(base, location, time, feedback, collaborative, multiplier, boostedFinal,
                referenceDistanceMiles, timeOfDay);
    }
}
