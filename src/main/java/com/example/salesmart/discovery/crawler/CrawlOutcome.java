package com.example.salesmart.discovery.crawler;

import java.util.List;

/**
 * @param candidates    normalized, de-duplicated by product URL
 * @param sourcesTried  sources a scraper was invoked for
 * @param sourcesFailed sources that threw, timed out or had no scraper
 */
public record CrawlOutcome(List<NormalizedCandidate> candidates, int sourcesTried, int sourcesFailed) {
}
