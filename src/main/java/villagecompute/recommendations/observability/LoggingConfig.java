/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching recommendation logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - User the recommendations or feedback belong to (UUID)</li>
 * <li>{@code request_origin} - Service operation or job type identifier</li>
 * <li>{@code job_id} - Job identifier (only for async job execution)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Services:</b>
 *
 * <pre>
 * try {
 *     LoggingConfig.enrichWithTraceContext();
 *     LoggingConfig.setUserId(userId);
 *     LoggingConfig.setRequestOrigin("RecommendationService.recommendForUser");
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear MDC at the
 * end of processing to prevent context leakage across pooled threads.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_SPAN_ID = "span_id";
    public static final String MDC_USER_ID = "user_id";

    /** Operation ("RecommendationService.recommend") or job type ("JobType.PROFILE_LEARNING"). */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /** Present only while a job handler runs. */
    public static final String MDC_JOB_ID = "job_id";

    private static final String[] ALL_FIELDS = {MDC_TRACE_ID, MDC_SPAN_ID, MDC_USER_ID, MDC_REQUEST_ORIGIN,
            MDC_JOB_ID};

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies the ids of the current span into MDC. Outside a valid span both ids are blank, so the console pattern
     * keeps its shape.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();
        boolean valid = spanContext.isValid();
        MDC.put(MDC_TRACE_ID, valid ? spanContext.getTraceId() : "");
        MDC.put(MDC_SPAN_ID, valid ? spanContext.getSpanId() : "");
    }

    public static void setUserId(UUID userId) {
        putIfPresent(MDC_USER_ID, userId);
    }

    public static void setRequestOrigin(String requestOrigin) {
        putIfPresent(MDC_REQUEST_ORIGIN, requestOrigin);
    }

    public static void setJobId(Long jobId) {
        putIfPresent(MDC_JOB_ID, jobId);
    }

    /**
     * Removes every field this class sets. Call from a {@code finally} block.
     */
    public static void clearMDC() {
        for (String field : ALL_FIELDS) {
            MDC.remove(field);
        }
    }

    private static void putIfPresent(String field, Object value) {
        if (value != null) {
            MDC.put(field, value.toString());
        }
    }
}
