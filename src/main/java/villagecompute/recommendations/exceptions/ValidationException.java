/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.exceptions;

/**
 * Exception thrown when a request or stored document fails validation (e.g., candidate without a category, unknown
 * feedback rating, malformed job payload).
 *
 * <p>
 * Extends RuntimeException per project standards. Job handlers let it propagate so the job is marked failed instead of
 * retried with the same bad input.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
