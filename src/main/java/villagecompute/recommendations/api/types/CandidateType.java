/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.recommendations.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.recommendations.util.CategoryNames;

/**
 * A potential activity (restaurant, event, venue) supplied by the retrieval collaborator for one scoring pass.
 *
 * <p>
 * Only {@code id} and {@code category} are expected on every candidate. The remaining fields are optional and degrade
 * to neutral sub-scores when missing. The category is normalized to lower case on construction, and a missing sponsor
 * tier is treated as organic.
 *
 * @param id
 *            opaque provider identifier, unique per provider
 * @param businessId
 *            groups candidates belonging to the same real-world business (nullable)
 * @param name
 *            display name (nullable, used only for logging)
 * @param category
 *            category from the activity taxonomy
 * @param location
 *            candidate coordinates (nullable)
 * @param rating
 *            average rating 0.0 - 5.0 (nullable)
 * @param reviewCount
 *            number of reviews (nullable)
 * @param priceTier
 *            0 = free to 3 = expensive (nullable)
 * @param hours
 *            weekly opening schedule (nullable)
 * @param sponsorTier
 *            paid-placement level
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record CandidateType(String id, @JsonProperty("business_id") String businessId, String name, String category,
        GeoPointType location, Double rating, @JsonProperty("review_count") Integer reviewCount,
        @JsonProperty("price_tier") Integer priceTier, OpeningHoursType hours,
        @JsonProperty("sponsor_tier") SponsorTier sponsorTier) {

    public CandidateType {
        category = CategoryNames.normalize(category);
        sponsorTier = sponsorTier == null ? SponsorTier.ORGANIC : sponsorTier;
    }

    /**
     * Creates an organic candidate with only the required fields set.
     */
    public static CandidateType of(String id, String category, GeoPointType location) {
        return new CandidateType(id, null, null, category, location, null, null, null, null, SponsorTier.ORGANIC);
    }

    public CandidateType withBusinessId(String businessId) {
        return new CandidateType(id, businessId, name, category, location, rating, reviewCount, priceTier, hours,
                sponsorTier);
    }

    public CandidateType withRating(Double rating, Integer reviewCount) {
        return new CandidateType(id, businessId, name, category, location, rating, reviewCount, priceTier, hours,
                sponsorTier);
    }

    public CandidateType withPriceTier(Integer priceTier) {
        return new CandidateType(id, businessId, name, category, location, rating, reviewCount, priceTier, hours,
                sponsorTier);
    }

    public CandidateType withHours(OpeningHoursType hours) {
        return new CandidateType(id, businessId, name, category, location, rating, reviewCount, priceTier, hours,
                sponsorTier);
    }

    public CandidateType withSponsorTier(SponsorTier sponsorTier) {
        return new CandidateType(id, businessId, name, category, location, rating, reviewCount, priceTier, hours,
                sponsorTier);
    }

    public boolean isSponsored() {
        return sponsorTier.isSponsored();
    }
}
