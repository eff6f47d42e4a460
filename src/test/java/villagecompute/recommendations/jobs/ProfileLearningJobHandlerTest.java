/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.jobs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.recommendations.api.types.AiProfileType;
import villagecompute.recommendations.api.types.FeedbackEventType;
import villagecompute.recommendations.api.types.FeedbackRating;
import villagecompute.recommendations.exceptions.ValidationException;
import villagecompute.recommendations.observability.LoggingConfig;
import villagecompute.recommendations.services.AiProfileService;

/**
 * Unit tests for {@link ProfileLearningJobHandler}.
 */
class ProfileLearningJobHandlerTest {

    private static final UUID USER_ID = UUID.fromString("6a1d2c4e-90b3-4f55-a0e2-7c1f0e8d2b10");

    @Mock
    AiProfileService aiProfileService;

    @Mock
    Tracer tracer;

    @InjectMocks
    ProfileLearningJobHandler handler;

    private SimpleMeterRegistry meterRegistry;

    private final Logger handlerLogger = Logger.getLogger(ProfileLearningJobHandler.class.getName());
    private final List<String> loggedContext = new ArrayList<>();
    private final Handler contextCapture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            loggedContext.add(MDC.get(LoggingConfig.MDC_JOB_ID) + "/" + MDC.get(LoggingConfig.MDC_USER_ID));
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        meterRegistry = new SimpleMeterRegistry();
        handler.meterRegistry = meterRegistry;

        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        when(aiProfileService.applyFeedback(any(UUID.class), any(FeedbackEventType.class)))
                .thenReturn(AiProfileType.createDefault());
    }

    @AfterEach
    void tearDown() {
        handlerLogger.removeHandler(contextCapture);
    }

    @Test
    void testHandlesType() {
        assertEquals(JobType.PROFILE_LEARNING, handler.handlesType());
    }

    @Test
    void testExecute_success_appliesParsedFeedback() throws Exception {
        Map<String, Object> feedback = new HashMap<>();
        feedback.put("category", "hiking");
        feedback.put("rating", "negative");
        feedback.put("price_tier", 2);
        feedback.put("tags", List.of("too far"));

        handler.execute(42L, Map.of("user_id", USER_ID.toString(), "feedback", feedback));

        ArgumentCaptor<FeedbackEventType> captor = ArgumentCaptor.forClass(FeedbackEventType.class);
        verify(aiProfileService).applyFeedback(eq(USER_ID), captor.capture());
        FeedbackEventType event = captor.getValue();
        assertEquals("hiking", event.category());
        assertEquals(FeedbackRating.NEGATIVE, event.rating());
        assertEquals(2, event.priceTier());
        assertEquals(Set.of("too_far"), event.tags());
        assertEquals(1.0, meterRegistry.counter("profile_learning.jobs.processed", "status", "success").count(), 0.0);
    }

    @Test
    void testExecute_thumbsDown_acceptedAsNegative() throws Exception {
        handler.execute(1L,
                Map.of("user_id", USER_ID, "feedback", Map.of("category", "bars", "rating", "thumbs_down")));

        ArgumentCaptor<FeedbackEventType> captor = ArgumentCaptor.forClass(FeedbackEventType.class);
        verify(aiProfileService).applyFeedback(eq(USER_ID), captor.capture());
        assertEquals(FeedbackRating.NEGATIVE, captor.getValue().rating());
        assertNull(captor.getValue().priceTier());
        assertTrue(captor.getValue().tags().isEmpty());
    }

    @Test
    void testExecute_nonNumericPriceTier_ignored() throws Exception {
        handler.execute(2L, Map.of("user_id", USER_ID.toString(), "feedback",
                Map.of("category", "coffee", "rating", "positive", "price_tier", "cheap")));

        ArgumentCaptor<FeedbackEventType> captor = ArgumentCaptor.forClass(FeedbackEventType.class);
        verify(aiProfileService).applyFeedback(eq(USER_ID), captor.capture());
        assertNull(captor.getValue().priceTier());
    }

    @Test
    void testExecute_malformedPayload_throwsValidation() {
        Map<String, Object> feedback = Map.of("category", "coffee", "rating", "positive");

        assertThrows(ValidationException.class, () -> handler.execute(3L, null));
        assertThrows(ValidationException.class, () -> handler.execute(3L, Map.of("feedback", feedback)));
        assertThrows(ValidationException.class,
                () -> handler.execute(3L, Map.of("user_id", "not-a-uuid", "feedback", feedback)));
        assertThrows(ValidationException.class, () -> handler.execute(3L, Map.of("user_id", USER_ID.toString())));
        assertThrows(ValidationException.class, () -> handler.execute(3L,
                Map.of("user_id", USER_ID.toString(), "feedback", Map.of("category", "coffee", "rating", "meh"))));
        assertThrows(ValidationException.class, () -> handler.execute(3L,
                Map.of("user_id", USER_ID.toString(), "feedback", Map.of("category", " ", "rating", "positive"))));

        verify(aiProfileService, never()).applyFeedback(any(), any());
    }

    @Test
    void testExecute_serviceFailure_rethrownAndCounted() {
        when(aiProfileService.applyFeedback(any(UUID.class), any(FeedbackEventType.class)))
                .thenThrow(new IllegalStateException("store unavailable"));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> handler.execute(4L,
                Map.of("user_id", USER_ID.toString(), "feedback", Map.of("category", "coffee", "rating", "positive"))));

        assertEquals("store unavailable", thrown.getMessage());
        assertEquals(1.0, meterRegistry.counter("profile_learning.jobs.processed", "status", "failure").count(), 0.0);
        assertEquals(0.0, meterRegistry.counter("profile_learning.jobs.processed", "status", "success").count(), 0.0);
    }

    @Test
    void testExecute_logsKeepJobContextAfterServiceClearsMdc() throws Exception {
        handlerLogger.addHandler(contextCapture);
        doAnswer(invocation -> {
            LoggingConfig.clearMDC();
            return AiProfileType.createDefault();
        }).when(aiProfileService).applyFeedback(any(UUID.class), any(FeedbackEventType.class));

        handler.execute(7L, Map.of("user_id", USER_ID.toString(), "feedback",
                Map.of("category", "coffee", "rating", "positive")));

        assertFalse(loggedContext.isEmpty(), "Completion should be logged");
        assertEquals("7/" + USER_ID, loggedContext.get(loggedContext.size() - 1));
    }

    @Test
    void testExecute_failureLogKeepsJobContext() {
        handlerLogger.addHandler(contextCapture);
        doAnswer(invocation -> {
            LoggingConfig.clearMDC();
            throw new IllegalStateException("store unavailable");
        }).when(aiProfileService).applyFeedback(any(UUID.class), any(FeedbackEventType.class));

        assertThrows(IllegalStateException.class, () -> handler.execute(8L,
                Map.of("user_id", USER_ID.toString(), "feedback", Map.of("category", "coffee", "rating", "positive"))));

        assertEquals("8/" + USER_ID, loggedContext.get(loggedContext.size() - 1));
    }
}
