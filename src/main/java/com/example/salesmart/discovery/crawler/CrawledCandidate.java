package com.example.salesmart.discovery.crawler;

import com.example.salesmart.discovery.Platform;

/**
 * Raw listing as a scraper saw it. Numeric fields stay text until
 * {@link CandidateNormalizer} reads them.
 */
public record CrawledCandidate(
        String name,
        String rawPrice,
        String rawSold,
        String rawRating,
        String rawReviewCount,
        String imageUrl,
        String link,
        Platform platform,
        String brand,
        Boolean mall,
        String sellerLocation) {

    public static CrawledCandidate basic(Platform platform, String name, String rawPrice, String rawSold,
            String rawRating, String imageUrl, String link) {
        return new CrawledCandidate(name, rawPrice, rawSold, rawRating, null, imageUrl, link, platform,
                null, null, null);
    }
}
