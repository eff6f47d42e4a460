/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.quarkus.arc.DefaultBean;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.UserProfileType;

/**
 * Process-local {@link ProfileStore}. Used until an application supplies its own store bean.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryProfileStore implements ProfileStore {

    private static final Logger LOG = Logger.getLogger(InMemoryProfileStore.class);

    private final Map<UUID, UserProfileType> userProfiles = new ConcurrentHashMap<>();
    private final Map<UUID, Map<String, Object>> aiProfiles = new ConcurrentHashMap<>();
    private final Map<UUID, List<FeedbackEventType>> feedback = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfileType> findUserProfile(UUID userId) {
        return Optional.ofNullable(userProfiles.get(requireUserId(userId)));
    }

    @Override
    public void saveUserProfile(UUID userId, UserProfileType profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile is required");
        }
        userProfiles.put(requireUserId(userId), profile);
    }

    @Override
    public Optional<Map<String, Object>> findAiProfileDocument(UUID userId) {
        Map<String, Object> document = aiProfiles.get(requireUserId(userId));
        return document == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(document));
    }

    @Override
    public void saveAiProfileDocument(UUID userId, Map<String, Object> document) {
        if (document == null) {
            throw new IllegalArgumentException("document is required");
        }
        aiProfiles.put(requireUserId(userId), new LinkedHashMap<>(document));
        LOG.debugf("Stored AI profile document for user %s", userId);
    }

    @Override
    public void recordFeedback(UUID userId, FeedbackEventType event) {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        feedback.computeIfAbsent(requireUserId(userId), id -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<FeedbackEventType> findFeedback(UUID userId) {
        List<FeedbackEventType> events = feedback.get(requireUserId(userId));
        return events == null ? List.of() : List.copyOf(new ArrayList<>(events));
    }

    private static UUID requireUserId(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        return userId;
    }
}
