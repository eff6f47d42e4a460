/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.jobs;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.FeedbackRating;
import villagecompute.recommendations.exceptions.ValidationException;
import villagecompute.recommendations.observability.LoggingConfig;
import villagecompute.recommendations.services.AiProfileService;

/**
 * Applies a submitted feedback event to the user's AI profile outside the request that captured it.
 *
 * <p>
 * <b>Payload:</b>
 *
 * <pre>
 * {
 *   "user_id": "3f0c...",
 *   "feedback": {
 *     "category": "hiking",
 *     "price_tier": 1,
 *     "rating": "negative",
 *     "tags": ["too far"]
 *   }
 * }
 * </pre>
 *
 * <p>
 * {@code rating} also accepts {@code thumbs_up} / {@code thumbs_down}. A malformed payload fails with
 * {@link ValidationException}. Learning is not idempotent, so the runner must not replay a job that already
 * succeeded.
 */
@ApplicationScoped
public class ProfileLearningJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ProfileLearningJobHandler.class);

    @Inject
    AiProfileService aiProfileService;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobType handlesType() {
        return JobType.PROFILE_LEARNING;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        if (payload == null) {
            throw new ValidationException("Profile learning job " + jobId + " has no payload");
        }
        UUID userId = parseUserId(payload.get("user_id"));
        FeedbackEventType event = parseFeedback(payload.get("feedback"));

        Span span = tracer.spanBuilder("job.profile_learning").setAttribute("job.id", jobId == null ? -1L : jobId)
                .setAttribute("job.type", JobType.PROFILE_LEARNING.name()).setAttribute("user_id", userId.toString())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            enrichLoggingContext(jobId, userId);

            AiProfileType updated = aiProfileService.applyFeedback(userId, event);
            // the service clears MDC when it returns
            enrichLoggingContext(jobId, userId);

            meterRegistry.counter("profile_learning.jobs.processed", "status", "success").increment();
            LOG.infof("Profile learning job %d completed for user %s (%d favorites, %d disliked)", jobId, userId,
                    updated.favoriteCategories().size(), updated.dislikedCategories().size());
        } catch (Exception e) {
            enrichLoggingContext(jobId, userId);
            meterRegistry.counter("profile_learning.jobs.processed", "status", "failure").increment();
            span.recordException(e);
            LOG.errorf(e, "Profile learning job %d failed for user %s", jobId, userId);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private static void enrichLoggingContext(Long jobId, UUID userId) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(jobId);
        LoggingConfig.setUserId(userId);
        LoggingConfig.setRequestOrigin("JobType." + JobType.PROFILE_LEARNING.name());
    }

    static UUID parseUserId(Object value) {
        if (value instanceof UUID) {
            return (UUID) value;
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new ValidationException("Payload is missing user_id");
        }
        try {
            return UUID.fromString((String) value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid user_id: " + value, e);
        }
    }

    static FeedbackEventType parseFeedback(Object value) {
        if (!(value instanceof Map)) {
            throw new ValidationException("Payload is missing feedback");
        }
        Map<?, ?> feedback = (Map<?, ?>) value;

        Object category = feedback.get("category");
        if (!(category instanceof String) || ((String) category).isBlank()) {
            throw new ValidationException("Feedback is missing category");
        }
        Object ratingValue = feedback.get("rating");
        FeedbackRating rating = ratingValue instanceof String ? FeedbackRating.fromValue((String) ratingValue) : null;
        if (rating == null) {
            throw new ValidationException("Feedback has unknown rating: " + ratingValue);
        }

        Integer priceTier = null;
        Object tierValue = feedback.get("price_tier");
        if (tierValue instanceof Number) {
            priceTier = ((Number) tierValue).intValue();
        } else if (tierValue != null) {
            LOG.warnf("Ignoring non-numeric price_tier %s", tierValue);
        }

        Set<String> tags = new LinkedHashSet<>();
        Object tagsValue = feedback.get("tags");
        if (tagsValue instanceof Collection) {
            for (Object tag : (Collection<?>) tagsValue) {
                if (tag != null) {
                    tags.add(tag.toString());
                }
            }
        }
        return new FeedbackEventType((String) category, priceTier, rating, tags);
    }
}
