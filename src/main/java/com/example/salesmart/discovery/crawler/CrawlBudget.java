package com.example.salesmart.discovery.crawler;

/**
 * Global ceiling on candidates crawled in one run. One instance per run,
 * shared by all crawl workers.
 */
public class CrawlBudget {

    private final int cap;
    private int remaining;

    public CrawlBudget(int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("cap must be >= 0");
        }
        this.cap = cap;
        this.remaining = cap;
    }

    /**
     * @return units granted, {@code min(requested, remaining)}; 0 once exhausted
     */
    public synchronized int reserve(int requested) {
        if (requested <= 0) {
            return 0;
        }
        int granted = Math.min(requested, remaining);
        remaining -= granted;
        return granted;
    }

    /** Gives back the unused part of a grant. */
    public synchronized void refund(int units) {
        if (units <= 0) {
            return;
        }
        remaining = Math.min(cap, remaining + units);
    }

    public synchronized int remaining() {
        return remaining;
    }

    public synchronized int used() {
        return cap - remaining;
    }

    public int cap() {
        return cap;
    }
}
