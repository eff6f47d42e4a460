/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Learned tolerance for travel distance, ordered from LOW to HIGH.
 */
public enum DistanceTolerance {

    LOW("low"), MEDIUM("medium"), HIGH("high");

    private final String value;

    DistanceTolerance(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public DistanceTolerance towardLow() {
        return this == HIGH ? MEDIUM : LOW;
    }

    @JsonCreator
    public static DistanceTolerance fromValue(String value) {
        if (value != null) {
            for (DistanceTolerance tolerance : values()) {
                if (tolerance.value.equalsIgnoreCase(value.trim())) {
                    return tolerance;
                }
            }
        }
        return MEDIUM;
    }
}
