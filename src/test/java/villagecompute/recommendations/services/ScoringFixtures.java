/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.time.LocalDateTime;

import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.GeoPointType;
import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.ScoredCandidateType;
import villagecompute.recommendations.api.types.SponsorTier;
import villagecompute.recommendations.config.LearningRules;
import villagecompute.recommendations.config.ScoringWeights;
import villagecompute.recommendations.config.SelectionRules;

/**
 * Shared builders for service unit tests.
 */
final class ScoringFixtures {

    static final GeoPointType HOME = new GeoPointType(40.0, -74.0);
    static final GeoPointType WORK = new GeoPointType(40.1, -74.0);

    /** Monday 2025-06-02. */
    static final LocalDateTime MONDAY = LocalDateTime.of(2025, 6, 2, 0, 0);

    private static final double MILES_PER_DEGREE_LATITUDE = 3958.8 * Math.PI / 180.0;

    private ScoringFixtures() {
    }

    static GeoPointType milesNorthOf(GeoPointType origin, double miles) {
        return new GeoPointType(origin.latitude() + miles / MILES_PER_DEGREE_LATITUDE, origin.longitude());
    }

    static LocalDateTime at(int hour) {
        return MONDAY.withHour(hour);
    }

    static ScoreCalculator scoreCalculator() {
        ScoreCalculator calculator = new ScoreCalculator();
        calculator.weights = ScoringWeights.defaults();
        calculator.catalog = new CategoryCatalog();
        return calculator;
    }

    static SponsorBoostApplier sponsorBoostApplier() {
        SponsorBoostApplier applier = new SponsorBoostApplier();
        applier.weights = ScoringWeights.defaults();
        return applier;
    }

    static BusinessRuleFilter businessRuleFilter() {
        BusinessRuleFilter filter = new BusinessRuleFilter();
        filter.rules = SelectionRules.defaults();
        return filter;
    }

    static ExplanationGenerator explanationGenerator() {
        ExplanationGenerator generator = new ExplanationGenerator();
        generator.weights = ScoringWeights.defaults();
        return generator;
    }

    static ProfileLearner profileLearner() {
        ProfileLearner learner = new ProfileLearner();
        learner.rules = LearningRules.defaults();
        return learner;
    }

    /**
     * Scored candidate whose final score is {@code score}, split as base plus 5 points in each other component.
     */
    static ScoredCandidateType scored(String id, String category, double score, SponsorTier tier, String businessId) {
        CandidateType candidate = CandidateType.of(id, category, null).withBusinessId(businessId).withSponsorTier(tier);
        ScoreBreakdownType breakdown = ScoreBreakdownType.unboosted(score - 20, 5, 5, 5, 5, null, null);
        return new ScoredCandidateType(candidate, breakdown);
    }

    static ScoredCandidateType organic(String id, String category, double score) {
        return scored(id, category, score, SponsorTier.ORGANIC, null);
    }
}
