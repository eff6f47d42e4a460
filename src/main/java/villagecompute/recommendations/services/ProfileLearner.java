/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.FeedbackRating;
import villagecompute.recommendations.config.LearningRules;
import villagecompute.recommendations.exceptions.ValidationException;
import villagecompute.recommendations.util.CategoryNames;

/**
 * Rule-based learning: folds one feedback event into an AI profile and returns the new profile.
 *
 * <p>
 * <b>Positive feedback:</b>
 * <ul>
 * <li>category becomes the most recent favorite and leaves the disliked list</li>
 * <li>{@code good_value} / {@code great_value}: price sensitivity one step toward low</li>
 * <li>{@code convenient}: preferred distance shrinks by one step</li>
 * <li>a price tier blends into the learned budget level</li>
 * </ul>
 *
 * <p>
 * <b>Negative feedback:</b>
 * <ul>
 * <li>category becomes the most recent dislike and leaves the favorites</li>
 * <li>{@code too_expensive}: price sensitivity one step toward high, budget level down by one</li>
 * <li>{@code too_far}: preferred distance shrinks by one step, distance tolerance one step toward low</li>
 * <li>{@code too_crowded}: recorded through {@link #onCrowdedSignal(String)} only</li>
 * </ul>
 *
 * <p>
 * The transition is pure and not idempotent: applying the same event twice shrinks the distance twice. Callers deliver
 * each event exactly once and serialize events per user. Unknown tags and categories are accepted.
 */
@ApplicationScoped
public class ProfileLearner {

    private static final Logger LOG = Logger.getLogger(ProfileLearner.class);

    public static final String TAG_GOOD_VALUE = "good_value";
    public static final String TAG_GREAT_VALUE = "great_value";
    public static final String TAG_CONVENIENT = "convenient";
    public static final String TAG_TOO_EXPENSIVE = "too_expensive";
    public static final String TAG_TOO_FAR = "too_far";
    public static final String TAG_TOO_CROWDED = "too_crowded";

    @Inject
    LearningRules rules;

    /**
     * Applies a feedback event.
     *
     * @param current
     *            current AI profile (null starts from the default profile)
     * @param event
     *            feedback to learn from
     * @return updated profile; favorites and dislikes never overlap
     * @throws ValidationException
     *             if the event has no category or no rating
     */
    public AiProfileType learn(AiProfileType current, FeedbackEventType event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        String category = CategoryNames.normalize(event.category());
        if (category.isEmpty()) {
            throw new ValidationException("Feedback event has no category");
        }
        if (event.rating() == null) {
            throw new ValidationException("Feedback event for " + category + " has no rating");
        }

        AiProfileType profile = current != null ? current : AiProfileType.createDefault();
        List<String> favorites = new ArrayList<>(profile.favoriteCategories());
        List<String> disliked = new ArrayList<>(profile.dislikedCategories());
        List<String> overlap = overlapping(favorites, disliked);
        if (!overlap.isEmpty()) {
            favorites.removeAll(overlap);
            LOG.debugf("Removed categories present in both favorites and dislikes: %s", overlap);
        }

        AiProfileType updated;
        if (event.rating() == FeedbackRating.POSITIVE) {
            disliked.remove(category);
            moveToMostRecent(favorites, category);
            updated = learnFromPositive(profile.withCategories(favorites, disliked), event);
        } else {
            favorites.remove(category);
            moveToMostRecent(disliked, category);
            updated = learnFromNegative(profile.withCategories(favorites, disliked), event, category);
        }

        LOG.debugf("Learned %s feedback for %s: favorites=%d, disliked=%d, sensitivity=%s, distance=%s",
                event.rating().value(), category, updated.favoriteCategories().size(),
                updated.dislikedCategories().size(), updated.priceSensitivity().value(),
                updated.preferredDistanceMiles());
        return updated;
    }

    private AiProfileType learnFromPositive(AiProfileType profile, FeedbackEventType event) {
        AiProfileType updated = profile;
        if (event.hasTag(TAG_GOOD_VALUE) || event.hasTag(TAG_GREAT_VALUE)) {
            updated = updated.withPriceSensitivity(updated.priceSensitivity().towardLow());
        }
        if (event.hasTag(TAG_CONVENIENT)) {
            updated = updated.withPreferredDistance(shrinkDistance(updated.preferredDistanceOrDefault()));
        }
        if (event.priceTier() != null) {
            int tier = Math.max(0, Math.min(3, event.priceTier()));
            double weight = rules.budgetBlendWeight();
            int blended = (int) Math.round(updated.budgetLevelOrDefault() * (1.0 - weight) + tier * weight);
            updated = updated.withBudgetLevel(blended);
        }
        return updated;
    }

    private AiProfileType learnFromNegative(AiProfileType profile, FeedbackEventType event, String category) {
        AiProfileType updated = profile;
        if (event.hasTag(TAG_TOO_EXPENSIVE)) {
            updated = updated.withPriceSensitivity(updated.priceSensitivity().towardHigh())
                    .withBudgetLevel(Math.max(0, updated.budgetLevelOrDefault() - 1));
        }
        if (event.hasTag(TAG_TOO_FAR)) {
            updated = updated.withPreferredDistance(shrinkDistance(updated.preferredDistanceOrDefault()))
                    .withDistanceTolerance(updated.distanceTolerance().towardLow());
        }
        if (event.hasTag(TAG_TOO_CROWDED)) {
            onCrowdedSignal(category);
        }
        return updated;
    }

    /**
     * Extension point for the "too crowded" signal. It has no scoring effect yet.
     *
     * @param category
     *            category the signal was given for
     */
    protected void onCrowdedSignal(String category) {
        LOG.debugf("Recorded too_crowded signal for %s (no profile effect)", category);
    }

    private double shrinkDistance(double distanceMiles) {
        return Math.max(rules.minPreferredDistanceMiles(), distanceMiles - rules.distanceStepMiles());
    }

    /**
     * Categories listed as both favorite and disliked, in favorites order.
     */
    static List<String> overlapping(List<String> favorites, List<String> disliked) {
        List<String> overlap = new ArrayList<>(favorites);
        overlap.retainAll(disliked);
        return overlap;
    }

    private void moveToMostRecent(List<String> categories, String category) {
        categories.remove(category);
        categories.add(category);
        while (categories.size() > rules.maxTrackedCategories()) {
            categories.remove(0);
        }
    }
}
