package com.example.salesmart.discovery.crawler;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import com.example.salesmart.discovery.Platform;

/**
 * Canonical candidate the filter engine and ranking selector work on.
 * {@code price} is always finite, non-negative, scale 2.
 */
public record NormalizedCandidate(
        Platform platform,
        String name,
        String productUrl,
        BigDecimal price,
        Double rating,
        Integer reviewCount,
        Long salesCount,
        boolean mall,
        Boolean verifiedSeller,
        String brand,
        String sellerLocation,
        Double trustScore,
        String trustBadgeType,
        List<String> keywords,
        List<String> imageUrls,
        String sourceSearchUrl) {

    public String key() {
        return normalizeUrl(productUrl);
    }

    public static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        String s = url.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) {
            s = s.substring(0, hash);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s.toLowerCase(Locale.ROOT);
    }
}
