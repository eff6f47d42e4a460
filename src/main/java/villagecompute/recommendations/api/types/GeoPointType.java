/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Geographic coordinate in decimal degrees.
 *
 * @param latitude
 *            latitude (-90 to 90)
 * @param longitude
 *            longitude (-180 to 180)
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GeoPointType(double latitude, double longitude) {
}
