/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.RecommendationType;
import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.ScoredCandidateType;
import villagecompute.recommendations.api.types.TimeOfDay;

/**
 * Unit tests for {@link ExplanationGenerator}.
 */
public class ExplanationGeneratorTest {

    private ExplanationGenerator generator;

    @BeforeEach
    public void setup() {
        generator = ScoringFixtures.explanationGenerator();
    }

    @Test
    public void testExplain_interestMatchNearby() {
        String text = explain(CandidateType.of("c1", "coffee", null), 40, 20, 15, 0.3, TimeOfDay.MORNING);

        assertEquals("Matches your interest in coffee, 0.3 mi away.", text);
    }

    @Test
    public void testExplain_locationLeads_addsIdealTime() {
        String text = explain(CandidateType.of("m1", "museum", null), 10, 20, 15, 0.4, TimeOfDay.EVENING);

        assertEquals("Just 0.4 mi away, great for an evening visit.", text);
    }

    @Test
    public void testExplain_timeLeads_addsHighRating() {
        CandidateType candidate = CandidateType.of("c1", "coffee", null).withRating(4.7, 30);

        String text = explain(candidate, 10, 10, 15, null, TimeOfDay.MORNING);

        assertEquals("Perfect for a morning visit, highly rated.", text);
    }

    @Test
    public void testExplain_weakMatch_exploreWording() {
        String text = explain(CandidateType.of("m1", "museum", null), 10, 10, 8, null, null);

        assertEquals("Something new to try in museum.", text);
    }

    @Test
    public void testExplain_relatedCategory() {
        String text = explain(CandidateType.of("b1", "bars", null), 20, 10, 5, 3.2, TimeOfDay.NIGHT);

        assertEquals("Related to your interests.", text);
    }

    @Test
    public void testExplain_tieBetweenBaseAndLocation_favorsBase() {
        String text = explain(CandidateType.of("d1", "dining", null), 20, 20, 10, 0.2, TimeOfDay.AFTERNOON);

        assertTrue(text.startsWith("Related to your interests"), text);
        assertTrue(text.endsWith("0.2 mi away."), text);
    }

    @Test
    public void testExplain_veryClose_formatsBelowTenthOfMile() {
        String text = explain(CandidateType.of("c1", "coffee", null), 10, 20, 5, 0.04, TimeOfDay.NIGHT);

        assertEquals("Just < 0.1 mi away.", text);
    }

    @Test
    public void testExplain_neverMentionsScores() {
        CandidateType candidate = CandidateType.of("c1", "coffee", null).withRating(4.9, 10);
        ScoreBreakdownType breakdown = ScoreBreakdownType.unboosted(37, 17, 13, 11, 7, 0.6, TimeOfDay.MORNING)
                .withBoost(1.30, 110.5);

        String text = generator.explain(new ScoredCandidateType(candidate, breakdown));

        for (String number : new String[]{"37", "17", "13", "11", "85", "110", "1.3"}) {
            assertFalse(text.contains(number), "Explanation leaks a score: " + text);
        }
    }

    @Test
    public void testExplain_recommendation_usesBreakdown() {
        CandidateType candidate = CandidateType.of("c1", "coffee", null);
        ScoreBreakdownType breakdown = ScoreBreakdownType.unboosted(40, 20, 15, 5, 5, 0.3, TimeOfDay.MORNING);
        RecommendationType recommendation = new RecommendationType(candidate, breakdown, null, false, 0.85,
                Instant.now(), Instant.now());

        assertEquals("Matches your interest in coffee, 0.3 mi away.", generator.explain(recommendation));
    }

    @Test
    public void testExplain_null_throws() {
        assertThrows(IllegalArgumentException.class, () -> generator.explain((RecommendationType) null));
        assertThrows(IllegalArgumentException.class, () -> generator.explain((ScoredCandidateType) null));
    }

    private String explain(CandidateType candidate, double base, double location, double time, Double distance,
            TimeOfDay timeOfDay) {
        ScoreBreakdownType breakdown = ScoreBreakdownType.unboosted(base, location, time, 5, 5, distance, timeOfDay);
        return generator.explain(new ScoredCandidateType(candidate, breakdown));
    }
}
