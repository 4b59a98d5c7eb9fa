package com.example.salesmart.discovery.crawler;

import java.time.Duration;

/**
 * Loads a page in a real browser and returns the rendered HTML, for listings
 * that only exist after JavaScript runs.
 */
public interface PageRenderer {

    String render(String url, Duration settle);
}
