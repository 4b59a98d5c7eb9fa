package com.example.salesmart.discovery.crawler;

import java.util.List;

import com.example.salesmart.discovery.Platform;

/**
 * Marketplace capability used by the crawl stage. Implementations own their
 * parsing heuristics; callers only see the contract.
 */
public interface ProductScraper {

    Platform platform();

    default boolean supports(String url) {
        return Platform.fromUrl(url).filter(p -> p == platform()).isPresent();
    }

    /**
     * @return at most {@code limit} listings, empty when the page had none
     */
    List<CrawledCandidate> crawlSearchResults(String searchUrl, int limit);

    ProductDetail crawlProductDetails(String productUrl, int reviewLimit);
}
