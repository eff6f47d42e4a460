/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.RecommendationType;
import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.ScoredCandidateType;
import villagecompute.recommendations.api.types.ScoringContextType;
import villagecompute.recommendations.api.types.UserProfileType;
import villagecompute.recommendations.config.PipelineSettings;
import villagecompute.recommendations.data.ProfileStore;
import villagecompute.recommendations.observability.LoggingConfig;

/**
 * Runs the recommendation pipeline for one request.
 *
 * <pre>
 * candidates -> [open now filter] -> ScoreCalculator -> SponsorBoostApplier -> BusinessRuleFilter
 *            -> ExplanationGenerator -> RecommendationType[]
 * </pre>
 *
 * <p>
 * Scoring runs on a parallel stream when {@code recommendations.scoring.parallel} is set. Candidates are independent
 * and the filter re-sorts its input, so the output is the same either way.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code recommendations.generated} - recommendations returned</li>
 * <li>{@code recommendations.empty} - requests that produced nothing</li>
 * <li>{@code recommendations.sponsored.served} - boosted or premium recommendations returned</li>
 * <li>{@code recommendations.duration} - pipeline time</li>
 * </ul>
 */
@ApplicationScoped
public class RecommendationService {

    private static final Logger LOG = Logger.getLogger(RecommendationService.class);

    @Inject
    ScoreCalculator scoreCalculator;

    @Inject
    SponsorBoostApplier sponsorBoostApplier;

    @Inject
    BusinessRuleFilter businessRuleFilter;

    @Inject
    ExplanationGenerator explanationGenerator;

    @Inject
    AiProfileService aiProfileService;

    @Inject
    ProfileStore profileStore;

    @Inject
    PipelineSettings settings;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Recommends with the configured default list size.
     */
    public List<RecommendationType> recommend(List<CandidateType> candidates, UserProfileType userProfile,
            AiProfileType aiProfile, ScoringContextType context) {
        return recommend(candidates, userProfile, aiProfile, context, 0);
    }

    /**
     * Scores, boosts, filters and explains candidates for a user.
     *
     * @param candidates
     *            candidates from the retrieval collaborator
     * @param userProfile
     *            stated preferences
     * @param aiProfile
     *            learned preferences (nullable)
     * @param context
     *            request context; a missing request time means "now"
     * @param k
     *            requested list size, non-positive for the default
     * @return recommendations in rank order, empty when nothing qualifies
     */
    public List<RecommendationType> recommend(List<CandidateType> candidates, UserProfileType userProfile,
            AiProfileType aiProfile, ScoringContextType context, int k) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates is required");
        }
        if (userProfile == null) {
            throw new IllegalArgumentException("userProfile is required");
        }

        ScoringContextType ctx = context != null ? context : ScoringContextType.at(null);
        if (ctx.requestTime() == null) {
            ctx = ctx.withRequestTime(LocalDateTime.now());
        }

        Span span = tracer.spanBuilder("recommendations.generate").setAttribute("candidate_count", candidates.size())
                .setAttribute("requested_k", k).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("RecommendationService.recommend");

            List<CandidateType> eligible = openNowFilter(candidates, ctx);
            List<ScoredCandidateType> scored = scoreAll(eligible, userProfile, aiProfile, ctx);
            List<ScoredCandidateType> selected = businessRuleFilter.select(scored, k);
            List<RecommendationType> recommendations = toRecommendations(selected);

            long sponsoredCount = recommendations.stream().filter(RecommendationType::sponsored).count();
            meterRegistry.counter("recommendations.generated").increment(recommendations.size());
            meterRegistry.counter("recommendations.sponsored.served").increment(sponsoredCount);
            if (recommendations.isEmpty()) {
                meterRegistry.counter("recommendations.empty").increment();
                LOG.infof("No recommendations available from %d candidates", candidates.size());
            } else {
                LOG.infof("Generated %d recommendations (%d sponsored) from %d candidates", recommendations.size(),
                        sponsoredCount, candidates.size());
            }

            span.addEvent("recommendations.generated",
                    Attributes.of(AttributeKey.longKey("eligible_count"), (long) eligible.size(),
                            AttributeKey.longKey("recommendation_count"), (long) recommendations.size(),
                            AttributeKey.longKey("sponsored_count"), sponsoredCount));
            return recommendations;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            sample.stop(Timer.builder("recommendations.duration").register(meterRegistry));
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Loads the user's stated and learned profiles from the store, then runs {@link #recommend}.
     *
     * @param userId
     *            user identifier
     * @param candidates
     *            candidates from the retrieval collaborator
     * @param context
     *            request context
     * @param k
     *            requested list size, non-positive for the default
     * @return recommendations in rank order
     * @throws IllegalArgumentException
     *             if the user has no stored profile
     */
    public List<RecommendationType> recommendForUser(UUID userId, List<CandidateType> candidates,
            ScoringContextType context, int k) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        UserProfileType userProfile = profileStore.findUserProfile(userId)
                .orElseThrow(() -> new IllegalArgumentException("User profile not found: " + userId));
        AiProfileType aiProfile = aiProfileService.getProfile(userId);

        LoggingConfig.setUserId(userId);
        return recommend(candidates, userProfile, aiProfile, context, k);
    }

    List<CandidateType> openNowFilter(List<CandidateType> candidates, ScoringContextType context) {
        List<CandidateType> eligible = new ArrayList<>(candidates.size());
        for (CandidateType candidate : candidates) {
            if (candidate == null) {
                LOG.warn("Skipping null candidate");
                continue;
            }
            if (context.openNowOnly() && candidate.hours() != null
                    && !candidate.hours().isOpenAt(context.requestTime())) {
                LOG.tracef("Dropped %s, closed at %s", candidate.id(), context.requestTime());
                continue;
            }
            eligible.add(candidate);
        }
        return eligible;
    }

    List<ScoredCandidateType> scoreAll(List<CandidateType> candidates, UserProfileType userProfile,
            AiProfileType aiProfile, ScoringContextType context) {
        Stream<CandidateType> stream = settings.parallelScoring()
                ? candidates.parallelStream()
                : candidates.stream();
        return stream.map(candidate -> {
            ScoreBreakdownType breakdown = scoreCalculator.score(candidate, userProfile, aiProfile, context);
            ScoreBreakdownType boosted = sponsorBoostApplier.applyBoost(breakdown, candidate.sponsorTier());
            return new ScoredCandidateType(candidate, boosted);
        }).collect(Collectors.toList());
    }

    private List<RecommendationType> toRecommendations(List<ScoredCandidateType> selected) {
        Instant generatedAt = Instant.now();
        Instant expiresAt = generatedAt.plus(settings.recommendationTtl());
        List<RecommendationType> recommendations = new ArrayList<>(selected.size());
        for (ScoredCandidateType scored : selected) {
            double confidence = Math.min(scored.finalScore() / 100.0, 1.0);
            recommendations.add(new RecommendationType(scored.candidate(), scored.breakdown(),
                    explanationGenerator.explain(scored), scored.isSponsored(), confidence, generatedAt, expiresAt));
        }
        return recommendations;
    }
}
