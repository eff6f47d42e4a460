/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.time.LocalTime;

/**
 * Opening window for a single weekday.
 *
 * <p>
 * The window includes the opening minute and excludes the closing one. A close time earlier than the open time means
 * the business closes after midnight (e.g. a bar open 16:00 - 02:00); equal times mean open around the clock.
 *
 * @param open
 *            opening time (ignored when closed)
 * @param close
 *            closing time (ignored when closed)
 * @param closed
 *            true if the business does not open that day
 */
public record DayHoursType(LocalTime open, LocalTime close, boolean closed) {

    public static DayHoursType of(String open, String close) {
        return new DayHoursType(LocalTime.parse(open), LocalTime.parse(close), false);
    }

    public static DayHoursType closedAllDay() {
        return new DayHoursType(null, null, true);
    }

    /**
     * Checks whether the given wall-clock time falls within this day's window.
     *
     * @param time
     *            local time of day
     * @return true if open at {@code time}
     */
    public boolean isOpenAt(LocalTime time) {
        if (closed || open == null || close == null) {
            return false;
        }
        if (open.equals(close)) {
            return true;
        }
        if (close.isBefore(open)) {
            return !time.isBefore(open) || time.isBefore(close);
        }
        return !time.isBefore(open) && time.isBefore(close);
    }
}
