package com.example.salesmart.discovery.crawler;

import java.util.List;

public record CrawledReview(
        String author,
        Double rating,
        String content,
        String time,
        List<String> images,
        int helpfulCount) {
}
