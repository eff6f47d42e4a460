/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.config;

/**
 * Business rules applied when selecting the final recommendation list.
 *
 * @param defaultK
 *            list size when the caller does not ask for one
 * @param minK
 *            smallest list size honoured; smaller requests are raised to it
 * @param maxSponsoredRatio
 *            share of the list that may be boosted or premium
 * @param minDistinctCategories
 *            diversity floor
 */
public record SelectionRules(int defaultK, int minK, double maxSponsoredRatio, int minDistinctCategories) {

    public static SelectionRules defaults() {
        return new SelectionRules(10, 5, 0.4, 3);
    }

    /**
     * Resolves the list size actually used for a request.
     *
     * @param requestedK
     *            requested size, or a non-positive value for the default
     * @return size between {@code minK} and the request
     */
    public int effectiveK(int requestedK) {
        int k = requestedK <= 0 ? defaultK : requestedK;
        return Math.max(minK, k);
    }

    /**
     * Maximum number of sponsored recommendations in a list of size {@code k}.
     */
    public int maxSponsored(int k) {
        return (int) Math.floor(maxSponsoredRatio * k + 1e-9);
    }
}
