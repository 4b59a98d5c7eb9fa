package com.example.salesmart.discovery;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.salesmart.discovery.crawler.NormalizedCandidate;

/**
 * AND over the present criteria dimensions. Pure and deterministic.
 *
 * Unknown candidate values: a min bound or a required set fails, a max bound
 * or an excluded set passes.
 */
@Component
public class ProductFilterEngine {

    private static final Logger log = LoggerFactory.getLogger(ProductFilterEngine.class);

    public List<NormalizedCandidate> filter(List<NormalizedCandidate> candidates, FilterCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return List.copyOf(candidates);
        }
        List<NormalizedCandidate> kept = candidates.stream().filter(c -> matches(c, criteria)).toList();
        if (kept.isEmpty() && !candidates.isEmpty()) {
            log.warn("[Filter] criteria too strict: {} candidates, 0 match {}", candidates.size(), criteria.toMap());
        } else {
            log.info("[Filter] {} of {} candidates match", kept.size(), candidates.size());
        }
        return kept;
    }

    public boolean matches(NormalizedCandidate c, FilterCriteria p) {
        if (!atLeast(c.rating(), p.getMinRating()) || !atMost(c.rating(), p.getMaxRating()))
            return false;
        if (!atLeast(c.reviewCount(), p.getMinReviewCount()) || !atMost(c.reviewCount(), p.getMaxReviewCount()))
            return false;
        if (!atLeast(c.salesCount(), p.getMinSalesCount()) || !atMost(c.salesCount(), p.getMaxSalesCount()))
            return false;
        if (!atLeast(c.trustScore(), p.getMinTrustScore()) || !atMost(c.trustScore(), p.getMaxTrustScore()))
            return false;
        if (!priceInRange(c.price(), p.getMinPrice(), p.getMaxPrice()))
            return false;

        if (p.getPlatforms() != null && !p.getPlatforms().contains(c.platform()))
            return false;
        if (p.getMall() != null && c.mall() != p.getMall())
            return false;
        if (p.getVerifiedSeller() != null && !Objects.equals(c.verifiedSeller(), p.getVerifiedSeller()))
            return false;

        String name = c.name().toLowerCase(Locale.ROOT);
        if (p.getRequiredKeywords() != null
                && !p.getRequiredKeywords().stream().allMatch(k -> name.contains(k.toLowerCase(Locale.ROOT))))
            return false;
        if (p.getExcludedKeywords() != null
                && p.getExcludedKeywords().stream().anyMatch(k -> name.contains(k.toLowerCase(Locale.ROOT))))
            return false;

        if (p.getRequiredBrands() != null && !containsIgnoreCase(p.getRequiredBrands(), c.brand()))
            return false;
        if (p.getExcludedBrands() != null && c.brand() != null && containsIgnoreCase(p.getExcludedBrands(), c.brand()))
            return false;
        if (p.getSellerLocations() != null && !containsIgnoreCase(p.getSellerLocations(), c.sellerLocation()))
            return false;
        if (p.getTrustBadgeTypes() != null && !containsIgnoreCase(p.getTrustBadgeTypes(), c.trustBadgeType()))
            return false;

        return true;
    }

    private static boolean priceInRange(BigDecimal price, BigDecimal min, BigDecimal max) {
        if (min != null && price.compareTo(min) < 0)
            return false;
        return max == null || price.compareTo(max) <= 0;
    }

    private static <T extends Number & Comparable<T>> boolean atLeast(T value, T min) {
        return min == null || (value != null && value.compareTo(min) >= 0);
    }

    private static <T extends Number & Comparable<T>> boolean atMost(T value, T max) {
        return max == null || value == null || value.compareTo(max) <= 0;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (candidate == null) {
            return false;
        }
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(candidate.trim()));
    }
}
