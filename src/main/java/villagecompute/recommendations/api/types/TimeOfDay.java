/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse time-of-day buckets used for stated time preferences and explanation wording.
 *
 * <ul>
 * <li>morning: 05:00 - 12:00</li>
 * <li>afternoon: 12:00 - 17:00</li>
 * <li>evening: 17:00 - 21:00</li>
 * <li>night: 21:00 - 05:00</li>
 * </ul>
 */
public enum TimeOfDay {

    MORNING("morning"), AFTERNOON("afternoon"), EVENING("evening"), NIGHT("night");

    private final String value;

    TimeOfDay(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static TimeOfDay fromHour(int hour) {
        if (hour >= 5 && hour < 12) {
            return MORNING;
        }
        if (hour >= 12 && hour < 17) {
            return AFTERNOON;
        }
        if (hour >= 17 && hour < 21) {
            return EVENING;
        }
        return NIGHT;
    }

    @JsonCreator
    public static TimeOfDay fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TimeOfDay bucket : values()) {
            if (bucket.value.equalsIgnoreCase(value.trim())) {
                return bucket;
            }
        }
        return null;
    }
}
