/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import java.time.LocalDateTime;

/**
 * Per-request scoring context.
 *
 * @param requestTime
 *            local date-time the recommendation is for (nullable, defaults to "now" in the service)
 * @param currentLocation
 *            the user's current position, used as an extra location reference point (nullable)
 * @param collaborativeScoreOverride
 *            externally computed collaborative score, clamped to the collaborative budget (nullable)
 * @param openNowOnly
 *            drop candidates whose known hours say they are closed at {@code requestTime}
 */
public record ScoringContextType(LocalDateTime requestTime, GeoPointType currentLocation,
        Double collaborativeScoreOverride, boolean openNowOnly) {

    public static ScoringContextType at(LocalDateTime requestTime) {
        return new ScoringContextType(requestTime, null, null, false);
    }

    public ScoringContextType withRequestTime(LocalDateTime time) {
        return new ScoringContextType(time, currentLocation, collaborativeScoreOverride, openNowOnly);
    }

    public ScoringContextType withCurrentLocation(GeoPointType location) {
        return new ScoringContextType(requestTime, location, collaborativeScoreOverride, openNowOnly);
    }

    public ScoringContextType withCollaborativeScoreOverride(Double override) {
        return new ScoringContextType(requestTime, currentLocation, override, openNowOnly);
    }

    public ScoringContextType withOpenNowOnly(boolean openNow) {
        return new ScoringContextType(requestTime, currentLocation, collaborativeScoreOverride, openNow);
    }
}
