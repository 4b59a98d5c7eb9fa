package com.example.salesmart.discovery.crawler;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a scraper by URL pattern.
 */
@Component
public class ScraperRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScraperRegistry.class);

    private final List<ProductScraper> scrapers;

    public ScraperRegistry(List<ProductScraper> scrapers) {
        this.scrapers = List.copyOf(scrapers);
        log.info("[ScraperRegistry] registered platforms={}",
                this.scrapers.stream().map(s -> s.platform().tag()).toList());
    }

    public Optional<ProductScraper> resolve(String url) {
        return scrapers.stream().filter(s -> s.supports(url)).findFirst();
    }
}
