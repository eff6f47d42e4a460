/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.time.LocalDateTime;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.GeoPointType;
import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.ScoringContextType;
import villagecompute.recommendations.api.types.TimeOfDay;
import villagecompute.recommendations.api.types.UserProfileType;
import villagecompute.recommendations.config.ScoringWeights;
import villagecompute.recommendations.util.GeoDistance;

/**
 * Computes the five-part score for a single candidate.
 *
 * <p>
 * <b>Sub-scores</b> (default point budgets, configured through {@link ScoringWeights}):
 * <ul>
 * <li><b>Base (0-40):</b> top-3 interest 40, any interest 30, related category 20, otherwise 10</li>
 * <li><b>Location (0-20):</b> on route 20, near 15, linear 15 to 10 up to the max distance, 5 beyond</li>
 * <li><b>Time (0-15):</b> ideal window 15, good window 10, preferred time bucket 8, otherwise 5</li>
 * <li><b>Feedback (0-15):</b> favorite 15, neutral 5, disliked 0, plus 3 when the price fits</li>
 * <li><b>Collaborative (0-10):</b> neutral 5 unless the context carries an override</li>
 * </ul>
 *
 * <p>
 * Scoring is pure and total: missing optional candidate fields fall back to the neutral value of the affected sub-score
 * and never raise. The sponsor multiplier is not applied here; see {@link SponsorBoostApplier}.
 */
@ApplicationScoped
public class ScoreCalculator {

    private static final Logger LOG = Logger.getLogger(ScoreCalculator.class);

    private static final ScoringContextType EMPTY_CONTEXT = new ScoringContextType(null, null, null, false);

    @Inject
    ScoringWeights weights;

    @Inject
    CategoryCatalog catalog;

    /**
     * Scores a candidate for a user.
     *
     * @param candidate
     *            candidate to score
     * @param userProfile
     *            stated preferences (nullable, treated as empty)
     * @param aiProfile
     *            learned preferences (nullable, treated as the default profile)
     * @param context
     *            request context (nullable)
     * @return unboosted breakdown whose final score equals the sum of the sub-scores
     */
    public ScoreBreakdownType score(CandidateType candidate, UserProfileType userProfile, AiProfileType aiProfile,
            ScoringContextType context) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate is required");
        }
        UserProfileType user = userProfile != null ? userProfile : UserProfileType.withInterests();
        AiProfileType ai = aiProfile != null ? aiProfile : AiProfileType.createDefault();
        ScoringContextType ctx = context != null ? context : EMPTY_CONTEXT;

        if (candidate.category().isEmpty()) {
            LOG.warnf("Candidate %s has no category, scoring as unmatched", candidate.id());
        }

        double base = calculateBaseScore(candidate.category(), user.interests());
        Double referenceDistance = referenceDistanceMiles(candidate.location(), user, ctx.currentLocation());
        double location = calculateLocationScore(referenceDistance, effectiveMaxDistance(user, ai));
        TimeOfDay timeOfDay = ctx.requestTime() != null ? TimeOfDay.fromHour(ctx.requestTime().getHour()) : null;
        double time = calculateTimeScore(candidate, user, ctx.requestTime());
        double feedback = calculateFeedbackScore(candidate, user, ai);
        double collaborative = calculateCollaborativeScore(ctx.collaborativeScoreOverride());

        ScoreBreakdownType breakdown = ScoreBreakdownType.unboosted(base, location, time, feedback, collaborative,
                referenceDistance, timeOfDay);
        LOG.tracef("Scored candidate %s (%s): base=%.1f, location=%.1f, time=%.1f, feedback=%.1f, collaborative=%.1f",
                candidate.id(), candidate.category(), base, location, time, feedback, collaborative);
        return breakdown;
    }

    /**
     * Interest match. Interests are ordered; the first {@code topInterestCount} count as top interests.
     */
    double calculateBaseScore(String category, List<String> interests) {
        ScoringWeights.BaseWeights base = weights.base();
        int index = category.isEmpty() ? -1 : interests.indexOf(category);
        if (index >= 0 && index < base.topInterestCount()) {
            return base.topInterest();
        }
        if (index >= 0) {
            return base.interest();
        }
        if (catalog.isRelatedToAny(category, interests)) {
            return base.related();
        }
        return base.explore();
    }

    /**
     * Distance from the candidate to the closest reference point: home, work, the straight commute line between them,
     * or the current location.
     *
     * @return distance in miles, or null when either side is unknown
     */
    Double referenceDistanceMiles(GeoPointType candidateLocation, UserProfileType user, GeoPointType currentLocation) {
        if (candidateLocation == null) {
            return null;
        }
        Double best = null;
        if (user.homeLocation() != null) {
            best = min(best, GeoDistance.haversineMiles(candidateLocation, user.homeLocation()));
        }
        if (user.workLocation() != null) {
            best = min(best, GeoDistance.haversineMiles(candidateLocation, user.workLocation()));
        }
        if (user.homeLocation() != null && user.workLocation() != null) {
            best = min(best,
                    GeoDistance.distanceToSegmentMiles(candidateLocation, user.homeLocation(), user.workLocation()));
        }
        if (currentLocation != null) {
            best = min(best, GeoDistance.haversineMiles(candidateLocation, currentLocation));
        }
        return best;
    }

    /**
     * Smaller of the stated and learned max distance when both exist, otherwise whichever exists, otherwise the
     * configured default.
     */
    double effectiveMaxDistance(UserProfileType user, AiProfileType ai) {
        Double stated = positiveOrNull(user.maxDistanceMiles());
        Double learned = ai != null ? positiveOrNull(ai.preferredDistanceMiles()) : null;
        if (stated != null && learned != null) {
            return Math.min(stated, learned);
        }
        if (stated != null) {
            return stated;
        }
        if (learned != null) {
            return learned;
        }
        return weights.location().defaultMaxMiles();
    }

    double calculateLocationScore(Double distanceMiles, double maxDistanceMiles) {
        ScoringWeights.LocationWeights location = weights.location();
        if (distanceMiles == null) {
            return location.neutral();
        }
        double d = distanceMiles;
        if (d <= location.onRouteMiles()) {
            return location.onRoute();
        }
        if (d <= location.nearMiles()) {
            return location.near();
        }
        if (d <= maxDistanceMiles) {
            double ratio = 1.0 - d / maxDistanceMiles;
            return location.inRangeMin() + (location.inRangeMax() - location.inRangeMin()) * ratio;
        }
        return location.far();
    }

    double calculateTimeScore(CandidateType candidate, UserProfileType user, LocalDateTime requestTime) {
        ScoringWeights.TimeWeights time = weights.time();
        if (requestTime == null) {
            return time.neutral();
        }
        if (candidate.hours() != null && !candidate.hours().isOpenAt(requestTime)) {
            return time.offPeak();
        }
        int hour = requestTime.getHour();
        if (catalog.isIdealHour(candidate.category(), hour)) {
            return time.ideal();
        }
        if (catalog.isGoodHour(candidate.category(), hour)) {
            return time.good();
        }
        if (user.preferredTimes().contains(TimeOfDay.fromHour(hour))) {
            return time.preferred();
        }
        return time.offPeak();
    }

    double calculateFeedbackScore(CandidateType candidate, UserProfileType user, AiProfileType ai) {
        ScoringWeights.FeedbackWeights feedback = weights.feedback();
        double score;
        if (ai.isFavorite(candidate.category())) {
            score = feedback.favorite();
        } else if (ai.isDisliked(candidate.category())) {
            score = Math.max(0, feedback.neutral() - feedback.dislikePenalty());
        } else {
            score = feedback.neutral();
        }
        if (candidate.priceTier() != null && candidate.priceTier() <= priceCeiling(user, ai)) {
            score += feedback.priceMatch();
        }
        return clamp(score, 0, feedback.max());
    }

    /**
     * Highest price tier the user is comfortable with: the learned budget (else the stated one, else the default level)
     * shifted by price sensitivity.
     */
    int priceCeiling(UserProfileType user, AiProfileType ai) {
        int budget;
        if (ai.budgetLevel() != null) {
            budget = ai.budgetLevel();
        } else if (user != null && user.budgetLevel() != null) {
            budget = Math.max(0, Math.min(3, user.budgetLevel()));
        } else {
            budget = AiProfileType.DEFAULT_BUDGET_LEVEL;
        }
        int ceiling = budget + ai.priceSensitivity().ceilingShift();
        return Math.max(0, Math.min(3, ceiling));
    }

    double calculateCollaborativeScore(Double override) {
        ScoringWeights.CollaborativeWeights collaborative = weights.collaborative();
        if (override == null || override.isNaN()) {
            return collaborative.defaultScore();
        }
        return clamp(override, 0, collaborative.max());
    }

    private static Double min(Double current, double candidate) {
        return current == null ? candidate : Math.min(current, candidate);
    }

    private static Double positiveOrNull(Double value) {
        return value != null && value > 0 ? value : null;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
