package com.example.salesmart.discovery.crawler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.discovery.DiscoveryCancelledException;
import com.example.salesmart.discovery.DiscoveryDeadline;
import com.example.salesmart.discovery.DiscoveryStage;
import com.example.salesmart.discovery.PlatformPolicy;

/**
 * Fans search URLs out to their scrapers under one {@link CrawlBudget}.
 *
 * URLs are dispatched in waves of at most {@code crawl-threads}. Each URL is
 * granted {@code min(max(1, cap / urlCount), remaining)} before its call;
 * the unused part of a grant is refunded so later waves can use it. A failing,
 * slow or unsupported source is logged and skipped.
 */
@Component
public class CrawlerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CrawlerDispatcher.class);

    private final ScraperRegistry registry;
    private final CandidateNormalizer normalizer;
    private final AsyncTaskExecutor executor;
    private final DiscoveryProperties props;
    private final PlatformPolicy platformPolicy;

    public CrawlerDispatcher(ScraperRegistry registry, CandidateNormalizer normalizer,
            @Qualifier("crawlExecutor") AsyncTaskExecutor executor, DiscoveryProperties props,
            PlatformPolicy platformPolicy) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.executor = executor;
        this.props = props;
        this.platformPolicy = platformPolicy;
    }

    public CrawlOutcome crawl(List<String> searchUrls, CrawlBudget budget, DiscoveryDeadline deadline) {
        if (searchUrls.isEmpty()) {
            return new CrawlOutcome(List.of(), 0, 0);
        }
        int perUrlQuota = Math.max(1, budget.cap() / searchUrls.size());
        int waveSize = Math.max(1, props.getCrawlThreads());
        Map<String, NormalizedCandidate> byKey = new LinkedHashMap<>();
        int tried = 0;
        int failed = 0;

        log.info("[Crawl] start urls={} cap={} perUrlQuota={}", searchUrls.size(), budget.cap(), perUrlQuota);

        for (int start = 0; start < searchUrls.size(); start += waveSize) {
            if (budget.remaining() == 0) {
                log.info("[Crawl] budget exhausted, skipping {} url(s)", searchUrls.size() - start);
                break;
            }
            List<Dispatched> wave = new ArrayList<>();
            for (String url : searchUrls.subList(start, Math.min(searchUrls.size(), start + waveSize))) {
                deadline.check(DiscoveryStage.CRAWL);
                Optional<ProductScraper> scraper = registry.resolve(url);
                if (scraper.isEmpty()) {
                    log.warn("[Crawl] no scraper for url={}", url);
                    failed++;
                    continue;
                }
                int granted = budget.reserve(perUrlQuota);
                if (granted == 0) {
                    break;
                }
                tried++;
                ProductScraper s = scraper.get();
                Future<List<CrawledCandidate>> future;
                try {
                    future = executor.submit(() -> s.crawlSearchResults(url, granted));
                } catch (TaskRejectedException e) {
                    log.warn("[Crawl] pool saturated, skipping url={}: {}", url, e.getMessage());
                    failed++;
                    budget.refund(granted);
                    continue;
                }
                wave.add(new Dispatched(url, granted, future));
            }

            long waveDeadline = System.currentTimeMillis() + props.getCrawlTimeout().toMillis();
            for (Dispatched d : wave) {
                List<CrawledCandidate> items;
                try {
                    items = await(d, waveDeadline, deadline);
                } catch (DiscoveryCancelledException e) {
                    wave.forEach(w -> w.future().cancel(true));
                    throw e;
                }
                if (items == null) {
                    failed++;
                    budget.refund(d.granted());
                    continue;
                }
                List<CrawledCandidate> kept = items.size() > d.granted() ? items.subList(0, d.granted()) : items;
                budget.refund(d.granted() - kept.size());
                int added = 0;
                for (CrawledCandidate raw : kept) {
                    Optional<NormalizedCandidate> n = normalizer.normalize(raw, d.url());
                    if (n.isPresent() && byKey.putIfAbsent(n.get().key(), n.get()) == null) {
                        added++;
                    }
                }
                log.info("[Crawl] url={} granted={} returned={} added={}", d.url(), d.granted(), items.size(), added);
            }
        }

        log.info("[Crawl] done candidates={} tried={} failed={} budgetUsed={}/{}",
                byKey.size(), tried, failed, budget.used(), budget.cap());
        return new CrawlOutcome(List.copyOf(byKey.values()), tried, failed);
    }

    /**
     * Detail page and up to {@code discovery.review-limit} reviews for one product.
     *
     * @throws IllegalArgumentException when no scraper handles the URL or its platform is disabled
     */
    public ProductDetail crawlDetails(String productUrl) {
        ProductScraper scraper = registry.resolve(productUrl)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported product URL: " + productUrl));
        if (!platformPolicy.isEnabled(scraper.platform())) {
            throw new IllegalArgumentException("Scraping is disabled for " + scraper.platform().tag());
        }
        ProductDetail detail = scraper.crawlProductDetails(productUrl, props.getReviewLimit());
        log.info("[Crawl] details url={} reviews={}", productUrl, detail.reviews().size());
        return detail;
    }

    /**
     * @return scraped items, or null when the source failed or timed out
     */
    private List<CrawledCandidate> await(Dispatched d, long waveDeadline, DiscoveryDeadline deadline) {
        long wait = Math.max(0, waveDeadline - System.currentTimeMillis());
        wait = deadline.cap(Duration.ofMillis(wait)).toMillis();
        try {
            List<CrawledCandidate> items = d.future().get(wait, TimeUnit.MILLISECONDS);
            return items != null ? items : List.of();
        } catch (TimeoutException e) {
            d.future().cancel(true);
            if (deadline.exhausted()) {
                deadline.check(DiscoveryStage.CRAWL);
            }
            log.warn("[Crawl] timed out url={} after {}", d.url(), props.getCrawlTimeout());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Crawl] source failed url={}: {}", d.url(), cause.getMessage(), cause);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            d.future().cancel(true);
            throw new DiscoveryCancelledException("Crawl interrupted");
        }
    }

    private record Dispatched(String url, int granted, Future<List<CrawledCandidate>> future) {
    }
}
