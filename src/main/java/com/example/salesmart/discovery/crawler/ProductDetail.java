package com.example.salesmart.discovery.crawler;

import java.util.List;
import java.util.Map;

public record ProductDetail(
        String link,
        String category,
        String description,
        Map<String, Integer> detailedRating,
        int totalRating,
        List<CrawledReview> reviews) {

    public static ProductDetail linkOnly(String link) {
        return new ProductDetail(link, "", "", Map.of(), 0, List.of());
    }
}
