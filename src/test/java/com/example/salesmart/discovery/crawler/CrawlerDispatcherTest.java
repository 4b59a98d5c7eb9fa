package com.example.salesmart.discovery.crawler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.example.salesmart.config.CrawlExecutorConfig;
import com.example.salesmart.config.DiscoveryProperties;
import com.example.salesmart.discovery.DiscoveryCancelledException;
import com.example.salesmart.discovery.DiscoveryDeadline;
import com.example.salesmart.discovery.Platform;
import com.example.salesmart.discovery.PlatformPolicy;
import com.example.salesmart.ops.SystemFlagService;

class CrawlerDispatcherTest {

    private DiscoveryProperties props;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        props = new DiscoveryProperties();
        props.setCrawlThreads(4);
        props.setCrawlTimeout(Duration.ofMillis(500));
        props.setReviewLimit(7);
        executor = new CrawlExecutorConfig().crawlExecutor(props);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        MDC.clear();
    }

    private CrawlerDispatcher dispatcher(ProductScraper... scrapers) {
        return dispatcher(executor, scrapers);
    }

    private CrawlerDispatcher dispatcher(ThreadPoolTaskExecutor pool, ProductScraper... scrapers) {
        PlatformPolicy policy = new PlatformPolicy(props, mock(SystemFlagService.class));
        return new CrawlerDispatcher(new ScraperRegistry(List.of(scrapers)), new CandidateNormalizer(), pool,
                props, policy);
    }

    private static List<String> tikiSearchUrls(int n) {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            urls.add("https://tiki.vn/search?q=ca+phe&page=" + i);
        }
        return urls;
    }

    /** Ignores the limit on purpose: the dispatcher must truncate. */
    private static List<CrawledCandidate> listings(String url, int count) {
        List<CrawledCandidate> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(CrawledCandidate.basic(Platform.TIKI, "Item " + i + " of " + url, "100.000 ₫", "1k", "4.5",
                    null, url.replace("search?q=", "p-") + "-" + i + ".html"));
        }
        return items;
    }

    @Test
    void crawl_neverExceedsGlobalCap() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> listings(url, 10));
        CrawlBudget budget = new CrawlBudget(20);

        CrawlOutcome outcome = dispatcher(tiki).crawl(tikiSearchUrls(5), budget, DiscoveryDeadline.unbounded());

        assertEquals(20, outcome.candidates().size());
        assertEquals(5, outcome.sourcesTried());
        assertEquals(0, outcome.sourcesFailed());
        assertEquals(20, budget.used());
        assertTrue(tiki.limits.values().stream().allMatch(l -> l == 4));
    }

    @Test
    void crawl_moreUrlsThanCapStillBoundedByCap() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> listings(url, limit));
        CrawlBudget budget = new CrawlBudget(20);

        CrawlOutcome outcome = dispatcher(tiki).crawl(tikiSearchUrls(30), budget, DiscoveryDeadline.unbounded());

        assertEquals(20, outcome.candidates().size());
        assertEquals(20, outcome.sourcesTried());
    }

    @Test
    void crawl_failingAndUnsupportedSourcesAreSkipped() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> {
            if (url.endsWith("page=1")) {
                throw new ScrapeException("blocked by captcha");
            }
            return listings(url, limit);
        });
        List<String> urls = new ArrayList<>(tikiSearchUrls(3));
        urls.add("https://www.amazon.com/s?k=coffee");
        CrawlBudget budget = new CrawlBudget(20);

        CrawlOutcome outcome = dispatcher(tiki).crawl(urls, budget, DiscoveryDeadline.unbounded());

        assertEquals(2, outcome.sourcesFailed());
        assertEquals(3, outcome.sourcesTried());
        assertEquals(10, outcome.candidates().size());
        assertEquals(10, budget.used());
    }

    @Test
    void crawl_slowSourceTimesOutAndIsRefunded() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> {
            if (url.endsWith("page=0")) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return listings(url, limit);
        });
        CrawlBudget budget = new CrawlBudget(20);

        long start = System.currentTimeMillis();
        CrawlOutcome outcome = dispatcher(tiki).crawl(tikiSearchUrls(2), budget, DiscoveryDeadline.unbounded());

        assertTrue(System.currentTimeMillis() - start < 4_000);
        assertEquals(1, outcome.sourcesFailed());
        assertEquals(10, outcome.candidates().size());
        assertEquals(10, budget.used());
    }

    @Test
    void crawl_duplicateLinksAreMerged() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI,
                (url, limit) -> listings("https://tiki.vn/search?q=same", limit));

        CrawlOutcome outcome = dispatcher(tiki).crawl(tikiSearchUrls(2), new CrawlBudget(20),
                DiscoveryDeadline.unbounded());

        assertEquals(10, outcome.candidates().size());
    }

    @Test
    void crawl_cancelledRunStops() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> listings(url, limit));
        DiscoveryDeadline deadline = DiscoveryDeadline.unbounded();
        deadline.cancel();

        assertThrows(DiscoveryCancelledException.class,
                () -> dispatcher(tiki).crawl(tikiSearchUrls(2), new CrawlBudget(20), deadline));
        assertTrue(tiki.limits.isEmpty());
    }

    @Test
    void crawl_workersSeeRunId() {
        Map<String, String> seen = new ConcurrentHashMap<>();
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> {
            seen.put(url, String.valueOf(MDC.get("runId")));
            return listings(url, limit);
        });
        MDC.put("runId", "run-42");

        dispatcher(tiki).crawl(tikiSearchUrls(3), new CrawlBudget(20), DiscoveryDeadline.unbounded());

        assertEquals(3, seen.size());
        assertTrue(seen.values().stream().allMatch("run-42"::equals));
    }

    @Test
    void crawlDetails_usesConfiguredReviewLimit() {
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> List.of());

        ProductDetail detail = dispatcher(tiki).crawlDetails("https://tiki.vn/ca-phe-p1.html");

        assertEquals("https://tiki.vn/ca-phe-p1.html", detail.link());
        assertEquals(7, tiki.reviewLimit);
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher(tiki).crawlDetails("https://shopee.vn/x-i.1.2"));
    }

    @Test
    void crawlDetails_rejectsDisabledPlatform() {
        FakeScraper shopee = new FakeScraper(Platform.SHOPEE, (url, limit) -> List.of());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> dispatcher(shopee).crawlDetails("https://shopee.vn/ca-phe-i.1.2"));

        assertEquals("Scraping is disabled for shopee", ex.getMessage());
        assertEquals(-1, shopee.reviewLimit);
    }

    @Test
    void crawl_saturatedPoolSkipsSourceAndRefundsGrant() {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.initialize();
        FakeScraper tiki = new FakeScraper(Platform.TIKI, (url, limit) -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return listings(url, limit);
        });
        CrawlBudget budget = new CrawlBudget(20);

        try {
            CrawlOutcome outcome = dispatcher(single, tiki).crawl(tikiSearchUrls(4), budget,
                    DiscoveryDeadline.unbounded());

            assertEquals(5, outcome.candidates().size());
            assertEquals(3, outcome.sourcesFailed());
            assertEquals(5, budget.used());
            assertEquals(1, tiki.limits.size());
        } finally {
            single.shutdown();
        }
    }

    private static class FakeScraper implements ProductScraper {

        private final Platform platform;
        private final BiFunction<String, Integer, List<CrawledCandidate>> search;
        final Map<String, Integer> limits = new ConcurrentHashMap<>();
        volatile int reviewLimit = -1;

        FakeScraper(Platform platform, BiFunction<String, Integer, List<CrawledCandidate>> search) {
            this.platform = platform;
            this.search = search;
        }

        @Override
        public Platform platform() {
            return platform;
        }

        @Override
        public List<CrawledCandidate> crawlSearchResults(String searchUrl, int limit) {
            limits.put(searchUrl, limit);
            return search.apply(searchUrl, limit);
        }

        @Override
        public ProductDetail crawlProductDetails(String productUrl, int reviewLimit) {
            this.reviewLimit = reviewLimit;
            return ProductDetail.linkOnly(productUrl);
        }
    }
}
