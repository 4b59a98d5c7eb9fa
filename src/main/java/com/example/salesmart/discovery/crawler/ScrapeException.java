package com.example.salesmart.discovery.crawler;

/**
 * A marketplace answered with something a scraper could not read.
 */
public class ScrapeException extends RuntimeException {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
