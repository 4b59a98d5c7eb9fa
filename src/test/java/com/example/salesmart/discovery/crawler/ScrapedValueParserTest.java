package com.example.salesmart.discovery.crawler;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class ScrapedValueParserTest {

    @Test
    void parsePrice_vietnameseFormats() {
        assertEquals(new BigDecimal("149000.00"), ScrapedValueParser.parsePrice("149.000 ₫"));
        assertEquals(new BigDecimal("1234567.00"), ScrapedValueParser.parsePrice("1.234.567đ"));
        assertEquals(new BigDecimal("199000.00"), ScrapedValueParser.parsePrice("₫199,000"));
        assertEquals(new BigDecimal("100000.00"), ScrapedValueParser.parsePrice("100.000 ₫ - 200.000 ₫"));
        assertEquals(new BigDecimal("250000.00"), ScrapedValueParser.parsePrice("250000 VND"));
    }

    @Test
    void parsePrice_rangeKeepsLowerBound() {
        assertEquals(new BigDecimal("100000.00"), ScrapedValueParser.parsePrice("₫100.000-₫200.000"));
        assertEquals(new BigDecimal("100000.00"), ScrapedValueParser.parsePrice("100.000 ₫ – 200.000 ₫"));
        assertEquals(new BigDecimal("89000.00"), ScrapedValueParser.parsePrice("89.000đ—120.000đ"));
    }

    @Test
    void parsePrice_decimals() {
        assertEquals(new BigDecimal("12.50"), ScrapedValueParser.parsePrice("12.5"));
        assertEquals(new BigDecimal("1299.50"), ScrapedValueParser.parsePrice("1.299,50"));
        assertEquals(new BigDecimal("1299.50"), ScrapedValueParser.parsePrice("1,299.50"));
    }

    @Test
    void parsePrice_unreadableIsZero() {
        assertEquals(ScrapedValueParser.UNKNOWN_PRICE, ScrapedValueParser.parsePrice(null));
        assertEquals(ScrapedValueParser.UNKNOWN_PRICE, ScrapedValueParser.parsePrice("Liên hệ"));
        assertEquals(ScrapedValueParser.UNKNOWN_PRICE, ScrapedValueParser.parsePrice("-5000"));
        assertEquals(2, ScrapedValueParser.parsePrice("").scale());
    }

    @Test
    void parseCount_suffixes() {
        assertEquals(1200L, ScrapedValueParser.parseCount("Đã bán 1,2k"));
        assertEquals(3400L, ScrapedValueParser.parseCount("3.4k"));
        assertEquals(2_000_000L, ScrapedValueParser.parseCount("2tr"));
        assertEquals(1234L, ScrapedValueParser.parseCount("1.234"));
        assertEquals(999L, ScrapedValueParser.parseCount("999+"));
        assertNull(ScrapedValueParser.parseCount("chưa có"));
        assertEquals(5_000_000L, ScrapedValueParser.parseCount("5 triệu"));
        assertNull(ScrapedValueParser.parseIntCount(null));
    }

    @Test
    void parseCount_wordAfterNumberIsNotSuffix() {
        assertEquals(3L, ScrapedValueParser.parseCount("Đã bán 3 mẫu"));
        assertEquals(12L, ScrapedValueParser.parseCount("12 mua"));
        assertEquals(7L, ScrapedValueParser.parseCount("7 trong kho"));
        assertEquals(1_500_000L, ScrapedValueParser.parseCount("1,5m lượt"));
    }

    @Test
    void parseRating_clampsToFive() {
        assertEquals(4.8, ScrapedValueParser.parseRating("4.8/5"));
        assertEquals(4.5, ScrapedValueParser.parseRating("4,5"));
        assertEquals(5.0, ScrapedValueParser.parseRating("7"));
        assertNull(ScrapedValueParser.parseRating("n/a"));
    }
}
