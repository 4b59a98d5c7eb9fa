package com.example.salesmart.discovery.crawler;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.example.salesmart.discovery.Platform;

class CandidateNormalizerTest {

    private final CandidateNormalizer normalizer = new CandidateNormalizer();

    @Test
    void normalize_readsRawFields() {
        CrawledCandidate raw = new CrawledCandidate("  Cà phê hòa tan G7 hộp 18 gói ", "89.000 ₫", "Đã bán 2,5k",
                "4.9", "1.024", "https://img.tiki.vn/a.jpg", "https://tiki.vn/ca-phe-g7-p123.html",
                Platform.TIKI, "Trung Nguyên", true, "Hồ Chí Minh");

        NormalizedCandidate c = normalizer.normalize(raw, "https://tiki.vn/search?q=ca+phe").orElseThrow();

        assertEquals("Cà phê hòa tan G7 hộp 18 gói", c.name());
        assertEquals(new BigDecimal("89000.00"), c.price());
        assertEquals(2500L, c.salesCount());
        assertEquals(4.9, c.rating());
        assertEquals(1024, c.reviewCount());
        assertTrue(c.mall());
        assertEquals("Trung Nguyên", c.brand());
        assertEquals(List.of("https://img.tiki.vn/a.jpg"), c.imageUrls());
        assertEquals("https://tiki.vn/search?q=ca+phe", c.sourceSearchUrl());
    }

    @Test
    void normalize_fallsBackToSourceUrlAndPlatform() {
        CrawledCandidate raw = CrawledCandidate.basic(null, "Trà xanh", null, null, null, null, null);

        NormalizedCandidate c = normalizer.normalize(raw, "https://www.lazada.vn/catalog/?q=tra").orElseThrow();

        assertEquals(Platform.LAZADA, c.platform());
        assertEquals("https://www.lazada.vn/catalog/?q=tra", c.productUrl());
        assertEquals(ScrapedValueParser.UNKNOWN_PRICE, c.price());
        assertNull(c.rating());
        assertFalse(c.mall());
    }

    @Test
    void normalize_dropsNamelessOrUnknownPlatform() {
        Optional<NormalizedCandidate> nameless = normalizer.normalize(
                CrawledCandidate.basic(Platform.TIKI, " ", "1", null, null, null, "https://tiki.vn/x"), "s");
        Optional<NormalizedCandidate> foreign = normalizer.normalize(
                CrawledCandidate.basic(null, "Thing", "1", null, null, null, null), "https://example.com/s");

        assertTrue(nameless.isEmpty());
        assertTrue(foreign.isEmpty());
    }

    @Test
    void extractKeywords_dropsStopWordsAndShortTokens() {
        assertEquals(List.of("phê", "hòa", "tan", "sữa", "đường"),
                CandidateNormalizer.extractKeywords("Cà phê hòa tan với sữa và đường"));
        assertEquals(CandidateNormalizer.MAX_KEYWORDS,
                CandidateNormalizer.extractKeywords("aaa bbb ccc ddd eee fff ggg hhh iii jjj kkk lll").size());
    }

    @Test
    void key_ignoresFragmentTrailingSlashAndCase() {
        assertEquals("https://tiki.vn/abc-p1.html",
                NormalizedCandidate.normalizeUrl(" https://Tiki.vn/abc-p1.html/#reviews "));
    }
}
