/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Learned sensitivity to price, ordered from LOW to HIGH.
 */
public enum PriceSensitivity {

    LOW("low", 1), MEDIUM("medium", 0), HIGH("high", -1);

    private final String value;
    private final int ceilingShift;

    PriceSensitivity(String value, int ceilingShift) {
        this.value = value;
        this.ceilingShift = ceilingShift;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Offset applied to the learned budget level when deriving the highest acceptable price tier.
     */
    public int ceilingShift() {
        return ceilingShift;
    }

    public PriceSensitivity towardLow() {
        return this == HIGH ? MEDIUM : LOW;
    }

    public PriceSensitivity towardHigh() {
        return this == LOW ? MEDIUM : HIGH;
    }

    /**
     * Parses a stored value, falling back to {@link #MEDIUM} for anything unrecognized.
     */
    @JsonCreator
    public static PriceSensitivity fromValue(String value) {
        if (value != null) {
            for (PriceSensitivity sensitivity : values()) {
                if (sensitivity.value.equalsIgnoreCase(value.trim())) {
                    return sensitivity;
                }
            }
        }
        return MEDIUM;
    }
}
