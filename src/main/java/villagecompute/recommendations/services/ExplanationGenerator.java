/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import villagecompute.recommendations.api.types.CandidateType;
import villagecompute.recommendations.api.types.RecommendationType;
import villagecompute.recommendations.api.types.ScoreBreakdownType;
import villagecompute.recommendations.api.types.ScoredCandidateType;
import villagecompute.recommendations.api.types.TimeOfDay;
import villagecompute.recommendations.config.ScoringWeights;

/**
 * Renders a one-sentence, templated reason for a recommendation.
 *
 * <p>
 * The lead phrase comes from the largest of the base, location and time sub-scores (ties favor base, then location).
 * A second phrase is appended when another factor is strong: close by, an ideal time, a stated interest, or a high
 * rating. Numeric scores never appear in the text.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>"Matches your interest in coffee, 0.3 mi away."</li>
 * <li>"Just 0.4 mi away, great for an evening visit." (when the interest match is weak)</li>
 * <li>"Something new to try in museum, highly rated."</li>
 * </ul>
 */
@ApplicationScoped
public class ExplanationGenerator {

    static final double HIGH_RATING = 4.5;

    @Inject
    ScoringWeights weights;

    public String explain(RecommendationType recommendation) {
        if (recommendation == null) {
            throw new IllegalArgumentException("recommendation is required");
        }
        return explain(recommendation.candidate(), recommendation.breakdown());
    }

    public String explain(ScoredCandidateType scored) {
        if (scored == null) {
            throw new IllegalArgumentException("scored candidate is required");
        }
        return explain(scored.candidate(), scored.breakdown());
    }

    String explain(CandidateType candidate, ScoreBreakdownType breakdown) {
        Factor lead = dominantFactor(breakdown);
        List<String> phrases = new ArrayList<>(2);
        phrases.add(leadPhrase(lead, candidate, breakdown));

        String secondary = secondaryPhrase(lead, candidate, breakdown);
        if (secondary != null) {
            phrases.add(secondary);
        }
        return sentence(String.join(", ", phrases));
    }

    Factor dominantFactor(ScoreBreakdownType breakdown) {
        Factor lead = Factor.BASE;
        double best = breakdown.base();
        if (breakdown.location() > best) {
            lead = Factor.LOCATION;
            best = breakdown.location();
        }
        if (breakdown.time() > best) {
            lead = Factor.TIME;
        }
        return lead;
    }

    private String leadPhrase(Factor lead, CandidateType candidate, ScoreBreakdownType breakdown) {
        switch (lead) {
            case LOCATION :
                if (breakdown.referenceDistanceMiles() != null) {
                    return "just " + formatDistance(breakdown.referenceDistanceMiles()) + " away";
                }
                return "convenient to get to";
            case TIME :
                if (breakdown.timeOfDay() != null) {
                    return "perfect for " + article(breakdown.timeOfDay()) + " " + breakdown.timeOfDay().value()
                            + " visit";
                }
                return "good timing right now";
            default :
                return interestPhrase(candidate.category(), breakdown.base());
        }
    }

    private String secondaryPhrase(Factor lead, CandidateType candidate, ScoreBreakdownType breakdown) {
        if (lead != Factor.LOCATION && breakdown.referenceDistanceMiles() != null
                && breakdown.location() >= weights.location().near()) {
            return formatDistance(breakdown.referenceDistanceMiles()) + " away";
        }
        if (lead != Factor.TIME && breakdown.timeOfDay() != null && breakdown.time() >= weights.time().ideal()) {
            return "great for " + article(breakdown.timeOfDay()) + " " + breakdown.timeOfDay().value() + " visit";
        }
        if (lead != Factor.BASE && breakdown.base() >= weights.base().interest()) {
            return "matches your interest in " + displayCategory(candidate.category());
        }
        if (candidate.rating() != null && candidate.rating() >= HIGH_RATING) {
            return "highly rated";
        }
        return null;
    }

    private String interestPhrase(String category, double base) {
        String name = displayCategory(category);
        if (base >= weights.base().interest()) {
            return "matches your interest in " + name;
        }
        if (base >= weights.base().related()) {
            return "related to your interests";
        }
        return "something new to try in " + name;
    }

    static String formatDistance(double miles) {
        if (miles < 0.1) {
            return "< 0.1 mi";
        }
        return String.format(Locale.US, "%.1f mi", miles);
    }

    private static String displayCategory(String category) {
        return category == null || category.isEmpty() ? "something different" : category;
    }

    private static String article(TimeOfDay timeOfDay) {
        return timeOfDay == TimeOfDay.AFTERNOON || timeOfDay == TimeOfDay.EVENING ? "an" : "a";
    }

    private static String sentence(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1) + ".";
    }

    enum Factor {
        BASE, LOCATION, TIME
    }
}
