/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.services;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.FeedbackRating;
import villagecompute.recommendations.api.types.FeedbackStatsType;
import villagecompute.recommendations.data.ProfileStore;
import villagecompute.recommendations.observability.LoggingConfig;

/**
 * Loads, stores and updates the learned AI profile of a user.
 *
 * <p>
 * The profile is kept by {@link ProfileStore} as an untyped document, typically a JSONB column. This service converts
 * it to and from {@link AiProfileType} with Jackson, applies schema migrations, and runs the feedback learning loop:
 *
 * <pre>
 * load document -> AiProfileType -> ProfileLearner.learn(event) -> document -> store
 * </pre>
 *
 * <p>
 * <b>Error handling:</b> a stored document that cannot be read falls back to {@link AiProfileType#createDefault()} and
 * is logged at ERROR; the next successful feedback write replaces it.
 *
 * <p>
 * <b>Concurrency:</b> {@link #applyFeedback} is a read-modify-write without locking. Events for one user must be
 * applied one at a time and exactly once.
 */
@ApplicationScoped
public class AiProfileService {

    private static final Logger LOG = Logger.getLogger(AiProfileService.class);

    static final int TOP_CATEGORY_LIMIT = 5;

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    @Inject
    ProfileStore profileStore;

    @Inject
    ProfileLearner profileLearner;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Retrieves a user's AI profile.
     *
     * @param userId
     *            user identifier
     * @return stored profile, or the default profile when none is stored or the document is unreadable
     */
    public AiProfileType getProfile(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }

        Span span = tracer.spanBuilder("ai_profile.get").setAttribute("user_id", userId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setUserId(userId);
            LoggingConfig.setRequestOrigin("AiProfileService.getProfile");

            return loadProfile(userId, span);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Stores a user's AI profile, replacing the previous document.
     *
     * @param userId
     *            user identifier
     * @param profile
     *            profile to store
     * @return the stored profile
     */
    public AiProfileType saveProfile(UUID userId, AiProfileType profile) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile is required");
        }

        Span span = tracer.spanBuilder("ai_profile.save").setAttribute("user_id", userId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setUserId(userId);
            LoggingConfig.setRequestOrigin("AiProfileService.saveProfile");

            profileStore.saveAiProfileDocument(userId, toDocument(profile));
            LOG.infof("Saved AI profile for user %s (%d favorites, %d disliked)", userId,
                    profile.favoriteCategories().size(), profile.dislikedCategories().size());
            return profile;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Learns from one feedback event and persists the result.
     *
     * <p>
     * The event is also appended to the user's feedback history, which feeds {@link #getFeedbackStats(UUID)}.
     *
     * @param userId
     *            user identifier
     * @param event
     *            feedback event, consumed exactly once
     * @return updated profile
     */
    public AiProfileType applyFeedback(UUID userId, FeedbackEventType event) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }

        Span span = tracer.spanBuilder("ai_profile.apply_feedback").setAttribute("user_id", userId.toString())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setUserId(userId);
            LoggingConfig.setRequestOrigin("AiProfileService.applyFeedback");

            AiProfileType current = loadProfile(userId, span);
            AiProfileType updated = profileLearner.learn(current, event);

            profileStore.saveAiProfileDocument(userId, toDocument(updated));
            profileStore.recordFeedback(userId, event);

            span.addEvent("ai_profile.feedback_applied",
                    Attributes.of(AttributeKey.stringKey("rating"), event.rating().value(),
                            AttributeKey.stringKey("category"), String.valueOf(event.category()),
                            AttributeKey.longKey("favorite_count"), (long) updated.favoriteCategories().size()));
            meterRegistry.counter("ai_profile.feedback.applied", "rating", event.rating().value()).increment();

            LOG.infof("Applied %s feedback for category %s to user %s", event.rating().value(), event.category(),
                    userId);
            return updated;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Summarizes a user's feedback history.
     *
     * @param userId
     *            user identifier
     * @return counts, satisfaction rate in percent (0 with no feedback) and up to five favorite categories
     */
    public FeedbackStatsType getFeedbackStats(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }

        List<FeedbackEventType> history = profileStore.findFeedback(userId);
        int positive = 0;
        int negative = 0;
        for (FeedbackEventType event : history) {
            if (event.rating() == FeedbackRating.POSITIVE) {
                positive++;
            } else if (event.rating() == FeedbackRating.NEGATIVE) {
                negative++;
            }
        }
        int total = history.size();
        double satisfactionRate = total > 0 ? (positive * 100.0) / total : 0.0;

        List<String> favorites = loadProfile(userId, Span.current()).favoriteCategories();
        List<String> topCategories = favorites.subList(0, Math.min(TOP_CATEGORY_LIMIT, favorites.size()));

        return new FeedbackStatsType(total, positive, negative, satisfactionRate, List.copyOf(topCategories));
    }

    /**
     * Converts a profile to the stored document shape (snake_case keys, enum values as strings).
     */
    public Map<String, Object> toDocument(AiProfileType profile) {
        try {
            String json = objectMapper.writeValueAsString(profile);
            return objectMapper.readValue(json, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to serialize AI profile");
            throw new IllegalArgumentException("Invalid AI profile structure", e);
        }
    }

    /**
     * Reads a stored document. Unknown keys are ignored; missing keys and unknown enum values take their defaults.
     *
     * @throws IllegalArgumentException
     *             if the document cannot be mapped onto {@link AiProfileType}
     */
    public AiProfileType fromDocument(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return AiProfileType.createDefault();
        }
        try {
            String json = objectMapper.writeValueAsString(document);
            AiProfileType profile = objectMapper.readValue(json, AiProfileType.class);
            if (profile.schemaVersion() < AiProfileType.CURRENT_SCHEMA_VERSION) {
                profile = migrateSchema(document, profile.schemaVersion());
            }
            return profile;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable AI profile document", e);
        }
    }

    /**
     * Migrates a stored document to the current schema version. Only version 1 exists so far.
     *
     * @param oldDocument
     *            stored document
     * @param currentVersion
     *            version found in the document
     * @return profile in the current schema
     */
    public AiProfileType migrateSchema(Map<String, Object> oldDocument, int currentVersion) {
        LOG.infof("Migrating AI profile from schema v%d to v%d", currentVersion, AiProfileType.CURRENT_SCHEMA_VERSION);
        try {
            String json = objectMapper.writeValueAsString(oldDocument);
            AiProfileType migrated = objectMapper.readValue(json, AiProfileType.class);
            return new AiProfileType(AiProfileType.CURRENT_SCHEMA_VERSION, migrated.favoriteCategories(),
                    migrated.dislikedCategories(), migrated.priceSensitivity(), migrated.preferredDistanceMiles(),
                    migrated.distanceTolerance(), migrated.budgetLevel());
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to migrate AI profile from v%d, returning defaults", currentVersion);
            return AiProfileType.createDefault();
        }
    }

    private AiProfileType loadProfile(UUID userId, Span span) {
        Optional<Map<String, Object>> document = profileStore.findAiProfileDocument(userId);
        if (document.isEmpty() || document.get().isEmpty()) {
            LOG.debugf("User %s has no AI profile, returning defaults", userId);
            return AiProfileType.createDefault();
        }
        try {
            return fromDocument(document.get());
        } catch (IllegalArgumentException e) {
            LOG.errorf(e, "Failed to deserialize AI profile for user %s, returning defaults", userId);
            span.recordException(e);
            return AiProfileType.createDefault();
        }
    }
}
