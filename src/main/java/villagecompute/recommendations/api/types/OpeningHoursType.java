/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weekly opening schedule for a candidate.
 *
 * <p>
 * Days missing from the map are treated as closed. A candidate with no schedule at all carries {@code null} hours
 * instead of an empty instance, so "unknown" and "closed every day" stay distinguishable.
 *
 * @param days
 *            per-weekday opening windows
 */
public record OpeningHoursType(Map<DayOfWeek, DayHoursType> days) {

    public OpeningHoursType {
        days = days == null || days.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(days));
    }

    /**
     * Builds a schedule with the same window on every day of the week.
     */
    public static OpeningHoursType everyDay(String open, String close) {
        Map<DayOfWeek, DayHoursType> days = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            days.put(day, DayHoursType.of(open, close));
        }
        return new OpeningHoursType(days);
    }

    /**
     * Checks whether the schedule is open at the given local date-time. Overnight windows are evaluated against the
     * entry for the day being checked.
     *
     * @param dateTime
     *            local date-time to check
     * @return true if open
     */
    public boolean isOpenAt(LocalDateTime dateTime) {
        DayHoursType dayHours = days.get(dateTime.getDayOfWeek());
        return dayHours != null && dayHours.isOpenAt(dateTime.toLocalTime());
    }
}
