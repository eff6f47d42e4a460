/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

import villagecompute.recommendations.api.types.SponsorTier;

/**
 * Point budgets and thresholds used by the score calculator and sponsor boost.
 *
 * <p>
 * The sub-score maxima (40 + 20 + 15 + 15 + 10) add up to 100 before the sponsor multiplier. Distances are in miles.
 * Produced by {@link RecommendationConfig} from {@code recommendations.scoring.*} properties; tests use
 * {@link #defaults()}.
 *
 * @param base
 *            interest-match weights
 * @param location
 *            proximity weights and distance thresholds
 * @param time
 *            time-of-day weights
 * @param feedback
 *            learned-preference weights
 * @param collaborative
 *            collaborative-signal weights
 * @param sponsor
 *            sponsor tier multipliers
 */
public record ScoringWeights(BaseWeights base, LocationWeights location, TimeWeights time, FeedbackWeights feedback,
        CollaborativeWeights collaborative, SponsorWeights sponsor) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(new BaseWeights(40, 30, 20, 10, 3),
                new LocationWeights(20, 15, 10, 15, 5, 10, 0.5, 1.0, 5.0), new TimeWeights(15, 10, 8, 5, 8),
                new FeedbackWeights(15, 5, 5, 3, 15), new CollaborativeWeights(5, 10), new SponsorWeights(1.15, 1.30));
    }

    /**
     * Highest total a candidate can reach before the sponsor multiplier.
     */
    public double maxBaseTotal() {
        return base.topInterest() + location.onRoute() + time.ideal() + feedback.max() + collaborative.max();
    }

    /**
     * @param topInterest
     *            category is among the user's top interests
     * @param interest
     *            category is any stated interest
     * @param related
     *            category is related to a stated interest
     * @param explore
     *            no match; keeps unrelated categories explorable
     * @param topInterestCount
     *            how many leading interests count as "top"
     */
    public record BaseWeights(double topInterest, double interest, double related, double explore,
            int topInterestCount) {
    }

    /**
     * @param onRoute
     *            within {@code onRouteMiles} of a reference point or the commute line
     * @param near
     *            within {@code nearMiles}
     * @param inRangeMin
     *            score at the user's max distance
     * @param inRangeMax
     *            score just beyond {@code nearMiles}
     * @param far
     *            beyond the user's max distance
     * @param neutral
     *            no reference point or no candidate location
     * @param onRouteMiles
     *            on-route threshold
     * @param nearMiles
     *            near threshold
     * @param defaultMaxMiles
     *            max distance when neither profile states one
     */
    public record LocationWeights(double onRoute, double near, double inRangeMin, double inRangeMax, double far,
            double neutral, double onRouteMiles, double nearMiles, double defaultMaxMiles) {
    }

    /**
     * @param ideal
     *            request hour inside the category's ideal window
     * @param good
     *            request hour inside the category's secondary window
     * @param preferred
     *            outside both windows but in one of the user's preferred buckets
     * @param offPeak
     *            any other time, or the candidate is closed
     * @param neutral
     *            request time unknown
     */
    public record TimeWeights(double ideal, double good, double preferred, double offPeak, double neutral) {
    }

    /**
     * @param favorite
     *            category is a learned favorite
     * @param neutral
     *            no learned signal
     * @param dislikePenalty
     *            subtracted from neutral for disliked categories
     * @param priceMatch
     *            bonus when the price tier is within the inferred ceiling
     * @param max
     *            sub-score cap
     */
    public record FeedbackWeights(double favorite, double neutral, double dislikePenalty, double priceMatch,
            double max) {
    }

    /**
     * @param defaultScore
     *            used when no override is supplied
     * @param max
     *            cap for supplied overrides
     */
    public record CollaborativeWeights(double defaultScore, double max) {
    }

    /**
     * @param boostedMultiplier
     *            multiplier for {@link SponsorTier#BOOSTED}
     * @param premiumMultiplier
     *            multiplier for {@link SponsorTier#PREMIUM}
     */
    public record SponsorWeights(double boostedMultiplier, double premiumMultiplier) {

        public double multiplierFor(SponsorTier tier) {
            if (tier == null) {
                return 1.0;
            }
            switch (tier) {
                case BOOSTED :
                    return boostedMultiplier;
                case PREMIUM :
                    return premiumMultiplier;
                default :
                    return 1.0;
            }
        }
    }
}
