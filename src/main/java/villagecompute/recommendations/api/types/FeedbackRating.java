/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Binary user reaction to a completed activity. Accepts the legacy {@code thumbs_up}/{@code thumbs_down} spellings.
 */
public enum FeedbackRating {

    POSITIVE("positive"), NEGATIVE("negative");

    private final String value;

    FeedbackRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FeedbackRating fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "positive" :
            case "thumbs_up" :
                return POSITIVE;
            case "negative" :
            case "thumbs_down" :
                return NEGATIVE;
            default :
                return null;
        }
    }
}
