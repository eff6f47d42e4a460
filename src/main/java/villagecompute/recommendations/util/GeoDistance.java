/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.util;

import villagecompute.recommendations.api.types.GeoPointType;

/**
 * Great-circle distance helpers in miles.
 */
public final class GeoDistance {

    /**
     * Mean Earth radius in miles.
     */
    public static final double EARTH_RADIUS_MILES = 3958.8;

    private GeoDistance() {
        // Utility class, no instantiation
    }

    /**
     * Haversine distance between two points.
     *
     * @param from
     *            first point
     * @param to
     *            second point
     * @return distance in miles
     */
    public static double haversineMiles(GeoPointType from, GeoPointType to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("both points are required");
        }
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    /**
     * Distance from {@code point} to the segment between {@code start} and {@code end}.
     *
     * <p>
     * Projects onto the segment in a local equirectangular plane (accurate at commute scale), then measures the
     * haversine distance to the projected point.
     *
     * @param point
     *            point to measure from
     * @param start
     *            segment start
     * @param end
     *            segment end
     * @return distance in miles
     */
    public static double distanceToSegmentMiles(GeoPointType point, GeoPointType start, GeoPointType end) {
        if (point == null || start == null || end == null) {
            throw new IllegalArgumentException("point and both segment ends are required");
        }
        double cosLat = Math.cos(Math.toRadians((start.latitude() + end.latitude()) / 2));
        double ax = start.longitude() * cosLat;
        double ay = start.latitude();
        double bx = end.longitude() * cosLat;
        double by = end.latitude();
        double px = point.longitude() * cosLat;
        double py = point.latitude();

        double dx = bx - ax;
        double dy = by - ay;
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0) {
            return haversineMiles(point, start);
        }
        double t = ((px - ax) * dx + (py - ay) * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));

        GeoPointType closest = new GeoPointType(start.latitude() + t * (end.latitude() - start.latitude()),
                start.longitude() + t * (end.longitude() - start.longitude()));
        return haversineMiles(point, closest);
    }
}
