/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

import java.time.Duration;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration for the recommendation engine.
 *
 * <p>
 * Reads scoring weights, selection rules and learning rules from {@code application.properties}, validates them at
 * startup and produces them as immutable beans for the services.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code recommendations.scoring.*} - sub-score point budgets, distance thresholds and sponsor multipliers</li>
 * <li>{@code recommendations.scoring.parallel} - score candidates on a parallel stream (default: false)</li>
 * <li>{@code recommendations.selection.*} - list size, sponsored share and diversity floor</li>
 * <li>{@code recommendations.ttl-days} - recommendation validity window (default: 7)</li>
 * <li>{@code recommendations.learning.*} - feedback learning step sizes</li>
 * </ul>
 *
 * @see villagecompute.recommendations.services.ScoreCalculator
 * @see villagecompute.recommendations.services.BusinessRuleFilter
 * @see villagecompute.recommendations.services.ProfileLearner
 */
@ApplicationScoped
@Startup
public class RecommendationConfig {

    private static final Logger LOG = Logger.getLogger(RecommendationConfig.class);

    @ConfigProperty(
            name = "recommendations.scoring.base.top-interest",
            defaultValue = "40")
    double baseTopInterest;

    @ConfigProperty(
            name = "recommendations.scoring.base.interest",
            defaultValue = "30")
    double baseInterest;

    @ConfigProperty(
            name = "recommendations.scoring.base.related",
            defaultValue = "20")
    double baseRelated;

    @ConfigProperty(
            name = "recommendations.scoring.base.explore",
            defaultValue = "10")
    double baseExplore;

    @ConfigProperty(
            name = "recommendations.scoring.base.top-interest-count",
            defaultValue = "3")
    int topInterestCount;

    @ConfigProperty(
            name = "recommendations.scoring.location.on-route",
            defaultValue = "20")
    double locationOnRoute;

    @ConfigProperty(
            name = "recommendations.scoring.location.near",
            defaultValue = "15")
    double locationNear;

    @ConfigProperty(
            name = "recommendations.scoring.location.in-range-min",
            defaultValue = "10")
    double locationInRangeMin;

    @ConfigProperty(
            name = "recommendations.scoring.location.in-range-max",
            defaultValue = "15")
    double locationInRangeMax;

    @ConfigProperty(
            name = "recommendations.scoring.location.far",
            defaultValue = "5")
    double locationFar;

    @ConfigProperty(
            name = "recommendations.scoring.location.neutral",
            defaultValue = "10")
    double locationNeutral;

    @ConfigProperty(
            name = "recommendations.scoring.location.on-route-miles",
            defaultValue = "0.5")
    double onRouteMiles;

    @ConfigProperty(
            name = "recommendations.scoring.location.near-miles",
            defaultValue = "1.0")
    double nearMiles;

    @ConfigProperty(
            name = "recommendations.scoring.location.default-max-miles",
            defaultValue = "5.0")
    double defaultMaxMiles;

    @ConfigProperty(
            name = "recommendations.scoring.time.ideal",
            defaultValue = "15")
    double timeIdeal;

    @ConfigProperty(
            name = "recommendations.scoring.time.good",
            defaultValue = "10")
    double timeGood;

    @ConfigProperty(
            name = "recommendations.scoring.time.preferred",
            defaultValue = "8")
    double timePreferred;

    @ConfigProperty(
            name = "recommendations.scoring.time.off-peak",
            defaultValue = "5")
    double timeOffPeak;

    @ConfigProperty(
            name = "recommendations.scoring.time.neutral",
            defaultValue = "8")
    double timeNeutral;

    @ConfigProperty(
            name = "recommendations.scoring.feedback.favorite",
            defaultValue = "15")
    double feedbackFavorite;

    @ConfigProperty(
            name = "recommendations.scoring.feedback.neutral",
            defaultValue = "5")
    double feedbackNeutral;

    @ConfigProperty(
            name = "recommendations.scoring.feedback.dislike-penalty",
            defaultValue = "5")
    double feedbackDislikePenalty;

    @ConfigProperty(
            name = "recommendations.scoring.feedback.price-match",
            defaultValue = "3")
    double feedbackPriceMatch;

    @ConfigProperty(
            name = "recommendations.scoring.feedback.max",
            defaultValue = "15")
    double feedbackMax;

    @ConfigProperty(
            name = "recommendations.scoring.collaborative.default",
            defaultValue = "5")
    double collaborativeDefault;

    @ConfigProperty(
            name = "recommendations.scoring.collaborative.max",
            defaultValue = "10")
    double collaborativeMax;

    @ConfigProperty(
            name = "recommendations.scoring.sponsor.boosted-multiplier",
            defaultValue = "1.15")
    double boostedMultiplier;

    @ConfigProperty(
            name = "recommendations.scoring.sponsor.premium-multiplier",
            defaultValue = "1.30")
    double premiumMultiplier;

    @ConfigProperty(
            name = "recommendations.scoring.parallel",
            defaultValue = "false")
    boolean parallelScoring;

    @ConfigProperty(
            name = "recommendations.selection.default-k",
            defaultValue = "10")
    int defaultK;

    @ConfigProperty(
            name = "recommendations.selection.min-k",
            defaultValue = "5")
    int minK;

    @ConfigProperty(
            name = "recommendations.selection.max-sponsored-ratio",
            defaultValue = "0.4")
    double maxSponsoredRatio;

    @ConfigProperty(
            name = "recommendations.selection.min-distinct-categories",
            defaultValue = "3")
    int minDistinctCategories;

    @ConfigProperty(
            name = "recommendations.ttl-days",
            defaultValue = "7")
    int ttlDays;

    @ConfigProperty(
            name = "recommendations.learning.distance-step-miles",
            defaultValue = "0.5")
    double distanceStepMiles;

    @ConfigProperty(
            name = "recommendations.learning.min-preferred-distance-miles",
            defaultValue = "0.5")
    double minPreferredDistanceMiles;

    @ConfigProperty(
            name = "recommendations.learning.max-tracked-categories",
            defaultValue = "10")
    int maxTrackedCategories;

    @ConfigProperty(
            name = "recommendations.learning.budget-blend-weight",
            defaultValue = "0.3")
    double budgetBlendWeight;

    /**
     * Validates the configured values at startup.
     *
     * @throws RecommendationConfigurationException
     *             if a weight is negative, the maxima exceed 100 points, a multiplier is below 1.0, or a selection
     *             or learning rule is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requireNonNegative("recommendations.scoring.base", baseTopInterest, baseInterest, baseRelated, baseExplore);
        requireNonNegative("recommendations.scoring.location", locationOnRoute, locationNear, locationInRangeMin,
                locationInRangeMax, locationFar, locationNeutral, onRouteMiles, nearMiles);
        requireNonNegative("recommendations.scoring.time", timeIdeal, timeGood, timePreferred, timeOffPeak,
                timeNeutral);
        requireNonNegative("recommendations.scoring.feedback", feedbackFavorite, feedbackNeutral,
                feedbackDislikePenalty, feedbackPriceMatch, feedbackMax);
        requireNonNegative("recommendations.scoring.collaborative", collaborativeDefault, collaborativeMax);

        if (topInterestCount < 1) {
            fail("recommendations.scoring.base.top-interest-count must be at least 1, was " + topInterestCount);
        }
        if (onRouteMiles <= 0 || nearMiles <= 0) {
            fail("recommendations.scoring.location distance thresholds must be positive (on-route-miles="
                    + onRouteMiles + ", near-miles=" + nearMiles + ")");
        }
        if (onRouteMiles > nearMiles) {
            fail("recommendations.scoring.location.on-route-miles (" + onRouteMiles
                    + ") must not exceed near-miles (" + nearMiles + ")");
        }
        if (defaultMaxMiles <= 0) {
            fail("recommendations.scoring.location.default-max-miles must be positive, was " + defaultMaxMiles);
        }
        if (boostedMultiplier < 1.0 || premiumMultiplier < 1.0) {
            fail("Sponsor multipliers must be at least 1.0 (boosted=" + boostedMultiplier + ", premium="
                    + premiumMultiplier + ")");
        }
        if (minK < 1 || defaultK < 1) {
            fail("recommendations.selection.min-k and default-k must be at least 1 (min-k=" + minK + ", default-k="
                    + defaultK + ")");
        }
        if (maxSponsoredRatio < 0.0 || maxSponsoredRatio > 1.0) {
            fail("recommendations.selection.max-sponsored-ratio must be within [0, 1], was " + maxSponsoredRatio);
        }
        if (minDistinctCategories < 1) {
            fail("recommendations.selection.min-distinct-categories must be at least 1, was "
                    + minDistinctCategories);
        }
        if (ttlDays < 1) {
            fail("recommendations.ttl-days must be at least 1, was " + ttlDays);
        }
        if (distanceStepMiles <= 0 || minPreferredDistanceMiles <= 0) {
            fail("recommendations.learning distance step and floor must be positive");
        }
        if (maxTrackedCategories < 1) {
            fail("recommendations.learning.max-tracked-categories must be at least 1, was " + maxTrackedCategories);
        }
        if (budgetBlendWeight < 0.0 || budgetBlendWeight > 1.0) {
            fail("recommendations.learning.budget-blend-weight must be within [0, 1], was " + budgetBlendWeight);
        }

        double maxTotal = scoringWeights().maxBaseTotal();
        if (maxTotal > 100.0 + 1e-9) {
            fail("Scoring weight maxima add up to " + maxTotal + ", which exceeds the 100 point budget");
        }
        if (maxTotal < 100.0 - 1e-9) {
            LOG.warnf("Scoring weight maxima add up to %.1f, below the 100 point budget", maxTotal);
        }
        LOG.infof("Recommendation engine configured: defaultK=%d, minK=%d, maxSponsoredRatio=%.2f, parallel=%s",
                defaultK, minK, maxSponsoredRatio, parallelScoring);
    }

    /**
     * Produces the scoring weights used by the score calculator and sponsor boost.
     *
     * @return immutable scoring weights
     */
    @Produces
    @Singleton
    public ScoringWeights scoringWeights() {
        return new ScoringWeights(
                new ScoringWeights.BaseWeights(baseTopInterest, baseInterest, baseRelated, baseExplore,
                        topInterestCount),
                new ScoringWeights.LocationWeights(locationOnRoute, locationNear, locationInRangeMin,
                        locationInRangeMax, locationFar, locationNeutral, onRouteMiles, nearMiles, defaultMaxMiles),
                new ScoringWeights.TimeWeights(timeIdeal, timeGood, timePreferred, timeOffPeak, timeNeutral),
                new ScoringWeights.FeedbackWeights(feedbackFavorite, feedbackNeutral, feedbackDislikePenalty,
                        feedbackPriceMatch, feedbackMax),
                new ScoringWeights.CollaborativeWeights(collaborativeDefault, collaborativeMax),
                new ScoringWeights.SponsorWeights(boostedMultiplier, premiumMultiplier));
    }

    @Produces
    @Singleton
    public SelectionRules selectionRules() {
        return new SelectionRules(defaultK, minK, maxSponsoredRatio, minDistinctCategories);
    }

    @Produces
    @Singleton
    public LearningRules learningRules() {
        return new LearningRules(distanceStepMiles, minPreferredDistanceMiles, maxTrackedCategories,
                budgetBlendWeight);
    }

    @Produces
    @Singleton
    public PipelineSettings pipelineSettings() {
        return new PipelineSettings(parallelScoring, Duration.ofDays(ttlDays));
    }

    private void requireNonNegative(String group, double... values) {
        for (double value : values) {
            if (value < 0 || Double.isNaN(value)) {
                fail(group + " weights must be non-negative, found " + value);
            }
        }
    }

    private void fail(String errorMessage) {
        LOG.fatal(errorMessage);
        throw new RecommendationConfigurationException(errorMessage);
    }

    /**
     * Exception thrown when recommendation configuration is invalid.
     */
    public static class RecommendationConfigurationException extends RuntimeException {

        public RecommendationConfigurationException(String message) {
            super(message);
        }

        public RecommendationConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
