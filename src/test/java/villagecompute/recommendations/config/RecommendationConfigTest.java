/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.recommendations.api.types.SponsorTier;
import villagecompute.recommendations.config.RecommendationConfig.RecommendationConfigurationException;

/**
 * Unit tests for {@link RecommendationConfig} startup validation and the values it produces.
 */
class RecommendationConfigTest {

    private RecommendationConfig config;

    @BeforeEach
    void setUp() {
        config = new RecommendationConfig();
        config.baseTopInterest = 40;
        config.baseInterest = 30;
        config.baseRelated = 20;
        config.baseExplore = 10;
        config.topInterestCount = 3;
        config.locationOnRoute = 20;
        config.locationNear = 15;
        config.locationInRangeMin = 10;
        config.locationInRangeMax = 15;
        config.locationFar = 5;
        config.locationNeutral = 10;
        config.onRouteMiles = 0.5;
        config.nearMiles = 1.0;
        config.defaultMaxMiles = 5.0;
        config.timeIdeal = 15;
        config.timeGood = 10;
        config.timePreferred = 8;
        config.timeOffPeak = 5;
        config.timeNeutral = 8;
        config.feedbackFavorite = 15;
        config.feedbackNeutral = 5;
        config.feedbackDislikePenalty = 5;
        config.feedbackPriceMatch = 3;
        config.feedbackMax = 15;
        config.collaborativeDefault = 5;
        config.collaborativeMax = 10;
        config.boostedMultiplier = 1.15;
        config.premiumMultiplier = 1.30;
        config.parallelScoring = false;
        config.defaultK = 10;
        config.minK = 5;
        config.maxSponsoredRatio = 0.4;
        config.minDistinctCategories = 3;
        config.ttlDays = 7;
        config.distanceStepMiles = 0.5;
        config.minPreferredDistanceMiles = 0.5;
        config.maxTrackedCategories = 10;
        config.budgetBlendWeight = 0.3;
    }

    @Test
    void testValidateConfiguration_defaults_pass() {
        assertDoesNotThrow(() -> config.validateConfiguration());
    }

    @Test
    void testProducers_matchDefaults() {
        assertEquals(ScoringWeights.defaults(), config.scoringWeights());
        assertEquals(SelectionRules.defaults(), config.selectionRules());
        assertEquals(LearningRules.defaults(), config.learningRules());
        assertEquals(PipelineSettings.defaults(), config.pipelineSettings());
        assertEquals(100.0, config.scoringWeights().maxBaseTotal(), 1e-9);
    }

    @Test
    void testProducers_reflectOverrides() {
        config.premiumMultiplier = 1.5;
        config.ttlDays = 2;
        config.parallelScoring = true;

        assertEquals(1.5, config.scoringWeights().sponsor().multiplierFor(SponsorTier.PREMIUM), 0.0);
        assertEquals(Duration.ofDays(2), config.pipelineSettings().recommendationTtl());
        assertTrue(config.pipelineSettings().parallelScoring());
    }

    @Test
    void testValidateConfiguration_belowBudget_onlyWarns() {
        config.collaborativeMax = 5;

        assertDoesNotThrow(() -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_overBudget_fails() {
        config.baseTopInterest = 45;

        RecommendationConfigurationException e = assertThrows(RecommendationConfigurationException.class,
                () -> config.validateConfiguration());
        assertTrue(e.getMessage().contains("100 point budget"), "Message should name the point budget");
    }

    @Test
    void testValidateConfiguration_negativeWeight_fails() {
        config.timeOffPeak = -1;

        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_multiplierBelowOne_fails() {
        config.boostedMultiplier = 0.9;

        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_distanceThresholds() {
        config.onRouteMiles = 2.0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration(),
                "On-route threshold beyond near threshold must fail");

        config.onRouteMiles = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.onRouteMiles = 0.5;
        config.defaultMaxMiles = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_selectionRules() {
        config.maxSponsoredRatio = 1.2;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.maxSponsoredRatio = 0.4;
        config.minK = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.minK = 5;
        config.minDistinctCategories = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.minDistinctCategories = 3;
        config.ttlDays = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testValidateConfiguration_learningRules() {
        config.distanceStepMiles = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.distanceStepMiles = 0.5;
        config.maxTrackedCategories = 0;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());

        config.maxTrackedCategories = 10;
        config.budgetBlendWeight = 1.5;
        assertThrows(RecommendationConfigurationException.class, () -> config.validateConfiguration());
    }

    @Test
    void testSelectionRules_effectiveKAndSponsorCap() {
        SelectionRules rules = SelectionRules.defaults();

        assertEquals(10, rules.effectiveK(0), "Non-positive k falls back to the default");
        assertEquals(5, rules.effectiveK(2), "k is raised to the minimum");
        assertEquals(12, rules.effectiveK(12));
        assertEquals(4, rules.maxSponsored(10));
        assertEquals(2, rules.maxSponsored(5));
        assertEquals(2, rules.maxSponsored(7));
    }
}
