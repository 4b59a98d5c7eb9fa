package com.example.salesmart.discovery;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds {@link FilterCriteria} from model JSON. Nothing from the model is
 * trusted: any malformed field rejects the whole payload with
 * {@link IllegalArgumentException}. Unknown keys are ignored.
 */
public final class FilterCriteriaReader {

    private static final double MAX_RATING = 5.0;

    private FilterCriteriaReader() {
    }

    public static FilterCriteria read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("criteria must be a JSON object");
        }
        FilterCriteria criteria = FilterCriteria.builder()
                .minPrice(decimal(node, "min_price"))
                .maxPrice(decimal(node, "max_price"))
                .minRating(rating(node, "min_rating"))
                .maxRating(rating(node, "max_rating"))
                .minReviewCount(count(node, "min_review_count"))
                .maxReviewCount(count(node, "max_review_count"))
                .minSalesCount(longCount(node, "min_sales_count"))
                .maxSalesCount(longCount(node, "max_sales_count"))
                .minTrustScore(nonNegative(node, "min_trust_score"))
                .maxTrustScore(nonNegative(node, "max_trust_score"))
                .platforms(platforms(node, "platforms"))
                .mall(bool(node, "is_mall"))
                .verifiedSeller(bool(node, "is_verified_seller"))
                .requiredKeywords(strings(node, "required_keywords"))
                .excludedKeywords(strings(node, "excluded_keywords"))
                .requiredBrands(strings(node, "required_brands"))
                .excludedBrands(strings(node, "excluded_brands"))
                .sellerLocations(strings(node, "seller_locations"))
                .trustBadgeTypes(strings(node, "trust_badge_types"))
                .build();

        checkRange("price", criteria.getMinPrice(), criteria.getMaxPrice());
        checkRange("rating", criteria.getMinRating(), criteria.getMaxRating());
        checkRange("review_count", criteria.getMinReviewCount(), criteria.getMaxReviewCount());
        checkRange("sales_count", criteria.getMinSalesCount(), criteria.getMaxSalesCount());
        checkRange("trust_score", criteria.getMinTrustScore(), criteria.getMaxTrustScore());
        return criteria;
    }

    private static JsonNode present(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode v = present(node, field);
        if (v == null) {
            return null;
        }
        BigDecimal value;
        if (v.isNumber()) {
            value = v.decimalValue();
        } else if (v.isTextual()) {
            try {
                value = new BigDecimal(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not a number: " + v.asText());
            }
        } else {
            throw new IllegalArgumentException(field + " is not a number");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
        return value;
    }

    private static Double nonNegative(JsonNode node, String field) {
        BigDecimal v = decimal(node, field);
        return v == null ? null : v.doubleValue();
    }

    private static Double rating(JsonNode node, String field) {
        Double v = nonNegative(node, field);
        if (v != null && v > MAX_RATING) {
            throw new IllegalArgumentException(field + " must be between 0 and 5");
        }
        return v;
    }

    private static Integer count(JsonNode node, String field) {
        Long v = longCount(node, field);
        if (v != null && v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(field + " is too large");
        }
        return v == null ? null : v.intValue();
    }

    private static Long longCount(JsonNode node, String field) {
        BigDecimal v = decimal(node, field);
        if (v == null) {
            return null;
        }
        try {
            return v.toBigIntegerExact().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(field + " must be a whole number");
        }
    }

    private static Boolean bool(JsonNode node, String field) {
        JsonNode v = present(node, field);
        if (v == null) {
            return null;
        }
        if (!v.isBoolean()) {
            throw new IllegalArgumentException(field + " must be true or false");
        }
        return v.booleanValue();
    }

    private static List<String> strings(JsonNode node, String field) {
        JsonNode v = present(node, field);
        if (v == null) {
            return null;
        }
        if (!v.isArray()) {
            throw new IllegalArgumentException(field + " must be a list of strings");
        }
        List<String> out = new ArrayList<>();
        for (Iterator<JsonNode> it = v.elements(); it.hasNext();) {
            JsonNode e = it.next();
            if (!e.isTextual()) {
                throw new IllegalArgumentException(field + " must be a list of strings");
            }
            String s = e.asText().trim();
            if (!s.isEmpty() && !out.contains(s)) {
                out.add(s);
            }
        }
        return out.isEmpty() ? null : List.copyOf(out);
    }

    private static Set<Platform> platforms(JsonNode node, String field) {
        List<String> tags = strings(node, field);
        if (tags == null) {
            return null;
        }
        Set<Platform> platforms = EnumSet.noneOf(Platform.class);
        for (String tag : tags) {
            platforms.add(Platform.fromTag(tag)
                    .orElseThrow(() -> new IllegalArgumentException("unknown platform: " + tag)));
        }
        return Collections.unmodifiableSet(platforms);
    }

    private static <T extends Comparable<T>> void checkRange(String name, T min, T max) {
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min_" + name + " is greater than max_" + name);
        }
    }
}
