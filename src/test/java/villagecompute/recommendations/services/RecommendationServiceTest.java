/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static villagecompute.recommendations.services.ScoringFixtures.HOME;
import static villagecompute.recommendations.services.ScoringFixtures.at;
import static villagecompute.recommendations.services.ScoringFixtures.milesNorthOf;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.OpeningHoursType;
import villagecompute.recommendations.api.types.RecommendationType;
import villagecompute.recommendations.api.types.ScoringContextType;
import villagecompute.recommendations.api.types.SponsorTier;
import villagecompute.recommendations.api.types.UserProfileType;
import villagecompute.recommendations.config.PipelineSettings;
import villagecompute.recommendations.data.InMemoryProfileStore;

/**
 * Unit tests for {@link RecommendationService}, wiring the real pipeline components by hand.
 */
class RecommendationServiceTest {

    private static final UUID USER_ID = UUID.fromString("0b6f7e43-2f1d-4a8e-8d0e-51c7d3a9f001");

    @Mock
    Tracer tracer;

    @InjectMocks
    RecommendationService service;

    private SimpleMeterRegistry meterRegistry;
    private InMemoryProfileStore store;
    private UserProfileType user;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));

        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryProfileStore();

        AiProfileService aiProfileService = new AiProfileService();
        aiProfileService.profileStore = store;
        aiProfileService.profileLearner = ScoringFixtures.profileLearner();
        aiProfileService.objectMapper = new ObjectMapper();
        aiProfileService.tracer = tracer;
        aiProfileService.meterRegistry = meterRegistry;

        service.scoreCalculator = ScoringFixtures.scoreCalculator();
        service.sponsorBoostApplier = ScoringFixtures.sponsorBoostApplier();
        service.businessRuleFilter = ScoringFixtures.businessRuleFilter();
        service.explanationGenerator = ScoringFixtures.explanationGenerator();
        service.aiProfileService = aiProfileService;
        service.profileStore = store;
        service.settings = PipelineSettings.defaults();
        service.meterRegistry = meterRegistry;

        user = UserProfileType.withInterests("coffee", "hiking", "museum").withHome(HOME);
    }

    @Test
    void testRecommend_rankedExplainedAndStamped() {
        List<RecommendationType> recommendations = service.recommend(mixedCandidates(), user,
                AiProfileType.createDefault(), ScoringContextType.at(at(8)), 5);

        assertEquals(5, recommendations.size());
        for (int i = 1; i < recommendations.size(); i++) {
            assertTrue(recommendations.get(i - 1).finalScore() >= recommendations.get(i).finalScore(),
                    "Recommendations must be in descending score order");
        }

        RecommendationType top = recommendations.get(0);
        assertEquals("coffee-near", top.candidate().id());
        assertEquals(85.0, top.finalScore(), 0.001);
        assertEquals(0.85, top.confidence(), 0.001);
        assertEquals("Matches your interest in coffee, 0.3 mi away.", top.explanation());
        assertEquals(Duration.ofDays(7), Duration.between(top.generatedAt(), top.expiresAt()));
        assertFalse(top.sponsored());
    }

    @Test
    void testRecommend_sponsoredFlagAndConfidenceCap() {
        List<CandidateType> candidates = new ArrayList<>(mixedCandidates());
        candidates.add(CandidateType.of("coffee-premium", "coffee", milesNorthOf(HOME, 0.2))
                .withSponsorTier(SponsorTier.PREMIUM));

        List<RecommendationType> recommendations = service.recommend(candidates, user, null,
                ScoringContextType.at(at(8)), 5);

        RecommendationType premium = recommendations.get(0);
        assertEquals("coffee-premium", premium.candidate().id());
        assertTrue(premium.sponsored());
        assertEquals(110.5, premium.finalScore(), 0.001);
        assertEquals(1.0, premium.confidence(), 0.0, "Confidence is capped at 1.0");
        assertEquals(1.0, meterRegistry.counter("recommendations.sponsored.served").count(), 0.0);
    }

    @Test
    void testRecommend_categoryFloorApplied() {
        List<CandidateType> candidates = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            candidates.add(CandidateType.of("coffee-" + i, "coffee", milesNorthOf(HOME, 0.1 * i)));
        }
        candidates.add(CandidateType.of("museum-far", "museum", milesNorthOf(HOME, 9)));
        candidates.add(CandidateType.of("bar-far", "bars", milesNorthOf(HOME, 9)));

        List<RecommendationType> recommendations = service.recommend(candidates, user, null,
                ScoringContextType.at(at(8)), 5);

        assertEquals(3, recommendations.stream().map(r -> r.candidate().category()).distinct().count());
    }

    @Test
    void testRecommend_emptyCandidates_emptyResultAndMetric() {
        List<RecommendationType> recommendations = service.recommend(List.of(), user, null, null, 5);

        assertTrue(recommendations.isEmpty());
        assertEquals(1.0, meterRegistry.counter("recommendations.empty").count(), 0.0);
        assertEquals(1L, meterRegistry.timer("recommendations.duration").count());
    }

    @Test
    void testRecommend_openNowOnly_dropsClosedCandidates() {
        List<CandidateType> candidates = List.of(
                CandidateType.of("open", "coffee", null).withHours(OpeningHoursType.everyDay("06:00", "12:00")),
                CandidateType.of("closed", "coffee", null).withHours(OpeningHoursType.everyDay("16:00", "23:00")),
                CandidateType.of("unknown-hours", "dining", null));

        List<String> ids = service
                .recommend(candidates, user, null, ScoringContextType.at(at(8)).withOpenNowOnly(true), 5).stream()
                .map(r -> r.candidate().id()).collect(Collectors.toList());

        assertTrue(ids.contains("open"));
        assertTrue(ids.contains("unknown-hours"), "Unknown hours are never treated as closed");
        assertFalse(ids.contains("closed"));
    }

    @Test
    void testRecommend_parallelScoring_sameOutput() {
        List<RecommendationType> sequential = service.recommend(mixedCandidates(), user, null,
                ScoringContextType.at(at(19)), 5);

        service.settings = new PipelineSettings(true, Duration.ofDays(7));
        List<RecommendationType> parallel = service.recommend(mixedCandidates(), user, null,
                ScoringContextType.at(at(19)), 5);

        assertEquals(ids(sequential), ids(parallel));
    }

    @Test
    void testRecommend_missingRequestTime_usesNow() {
        List<RecommendationType> recommendations = service.recommend(mixedCandidates(), user, null,
                new ScoringContextType(null, null, null, false), 5);

        assertNotNull(recommendations.get(0).breakdown().timeOfDay());
    }

    @Test
    void testRecommend_nullArguments_throw() {
        assertThrows(IllegalArgumentException.class, () -> service.recommend(null, user, null, null, 5));
        assertThrows(IllegalArgumentException.class, () -> service.recommend(List.of(), null, null, null, 5));
    }

    @Test
    void testRecommendForUser_usesStoredProfiles() {
        store.saveUserProfile(USER_ID, user);
        service.aiProfileService.applyFeedback(USER_ID, FeedbackEventType.negative("coffee"));

        List<RecommendationType> recommendations = service.recommendForUser(USER_ID, mixedCandidates(),
                ScoringContextType.at(at(8)), 5);

        RecommendationType coffee = recommendations.stream().filter(r -> r.candidate().id().equals("coffee-near"))
                .findFirst().orElseThrow();
        assertEquals(0.0, coffee.breakdown().feedback(), 0.001, "Learned dislike applies to scoring");
    }

    @Test
    void testRecommendForUser_unknownUser_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> service.recommendForUser(USER_ID, mixedCandidates(), null, 5));
    }

    private static List<CandidateType> mixedCandidates() {
        return List.of(CandidateType.of("coffee-near", "coffee", milesNorthOf(HOME, 0.3)).withRating(4.8, 120),
                CandidateType.of("hike-mid", "hiking", milesNorthOf(HOME, 3.0)),
                CandidateType.of("museum-near", "museum", milesNorthOf(HOME, 0.8)),
                CandidateType.of("bar-far", "bars", milesNorthOf(HOME, 12.0)).withSponsorTier(SponsorTier.BOOSTED),
                CandidateType.of("dining-mid", "dining", milesNorthOf(HOME, 2.0)).withBusinessId("biz-7"),
                CandidateType.of("dining-dup", "dining", milesNorthOf(HOME, 2.5)).withBusinessId("biz-7"),
                CandidateType.of("parks-near", "parks", milesNorthOf(HOME, 0.4)));
    }

    private static List<String> ids(List<RecommendationType> recommendations) {
        return recommendations.stream().map(r -> r.candidate().id()).collect(Collectors.toList());
    }
}
