package com.example.salesmart.discovery;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Structured filter predicate. Every dimension is optional; a null dimension
 * is always satisfied. Collections are either null or non-empty.
 */
@Value
@Builder(toBuilder = true)
public class FilterCriteria {

    BigDecimal minPrice;
    BigDecimal maxPrice;
    Double minRating;
    Double maxRating;
    Integer minReviewCount;
    Integer maxReviewCount;
    Long minSalesCount;
    Long maxSalesCount;
    Double minTrustScore;
    Double maxTrustScore;
    Set<Platform> platforms;
    Boolean mall;
    Boolean verifiedSeller;
    List<String> requiredKeywords;
    List<String> excludedKeywords;
    List<String> requiredBrands;
    List<String> excludedBrands;
    List<String> sellerLocations;
    List<String> trustBadgeTypes;

    public static FilterCriteria none() {
        return FilterCriteria.builder().build();
    }

    public boolean isEmpty() {
        return toMap().isEmpty();
    }

    public Set<Platform> getPlatforms() {
        return platforms == null ? null : Collections.unmodifiableSet(platforms);
    }

    public boolean hasPlatforms() {
        return platforms != null && !platforms.isEmpty();
    }

    /**
     * Present dimensions only, keyed the way prompts and API clients see them.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        put(m, "min_price", minPrice);
        put(m, "max_price", maxPrice);
        put(m, "min_rating", minRating);
        put(m, "max_rating", maxRating);
        put(m, "min_review_count", minReviewCount);
        put(m, "max_review_count", maxReviewCount);
        put(m, "min_sales_count", minSalesCount);
        put(m, "max_sales_count", maxSalesCount);
        put(m, "min_trust_score", minTrustScore);
        put(m, "max_trust_score", maxTrustScore);
        put(m, "platforms", platforms == null ? null : platforms.stream().map(Platform::tag).toList());
        put(m, "is_mall", mall);
        put(m, "is_verified_seller", verifiedSeller);
        put(m, "required_keywords", requiredKeywords);
        put(m, "excluded_keywords", excludedKeywords);
        put(m, "required_brands", requiredBrands);
        put(m, "excluded_brands", excludedBrands);
        put(m, "seller_locations", sellerLocations);
        put(m, "trust_badge_types", trustBadgeTypes);
        return m;
    }

    private static void put(Map<String, Object> m, String key, Object value) {
        if (value != null) {
            m.put(key, value);
        }
    }
}
