/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.data;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.UserProfileType;

/**
 * Storage collaborator for user profiles, AI profile documents and feedback history.
 *
 * <p>
 * The AI profile is exchanged as an untyped document (the JSONB shape the store keeps); conversion to
 * {@link villagecompute.recommendations.api.types.AiProfileType} happens in
 * {@link villagecompute.recommendations.services.AiProfileService}.
 *
 * <p>
 * Implementations must give at most one concurrent writer per user for {@link #saveAiProfileDocument}; the learning
 * loop reads, transforms and writes without locking.
 */
public interface ProfileStore {

    Optional<UserProfileType> findUserProfile(UUID userId);

    void saveUserProfile(UUID userId, UserProfileType profile);

    /**
     * @return stored AI profile document, or empty if the user has none yet
     */
    Optional<Map<String, Object>> findAiProfileDocument(UUID userId);

    void saveAiProfileDocument(UUID userId, Map<String, Object> document);

    /**
     * Appends a feedback event to the user's history.
     */
    void recordFeedback(UUID userId, FeedbackEventType event);

    /**
     * @return feedback history, oldest first
     */
    List<FeedbackEventType> findFeedback(UUID userId);
}
