package com.example.salesmart.discovery;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.salesmart.llm.ModelJson;

class SearchLinkExtractorTest {

    private final SearchLinkExtractor extractor = new SearchLinkExtractor();

    @Test
    void keepsAllowedAbsoluteLinksOnceInOrder() {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put("tiki", "https://tiki.vn/search?q=ca+phe");
        urls.put("shopee", "https://shopee.vn/search?keyword=ca+phe");
        urls.put("lazada", "/catalog/?q=ca+phe");
        List<RecommendedProduct> products = List.of(
                new RecommendedProduct("G7", "https://www.lazada.vn/catalog/?q=g7", urls),
                new RecommendedProduct("G7 again", "https://tiki.vn/search?q=ca+phe", Map.of()),
                new RecommendedProduct("Amazon", "https://www.amazon.com/s?k=coffee", Map.of()));

        List<String> links = extractor.extract(products, EnumSet.of(Platform.LAZADA, Platform.TIKI), "cà phê");

        assertEquals(List.of("https://www.lazada.vn/catalog/?q=g7", "https://tiki.vn/search?q=ca+phe"), links);
    }

    @Test
    void fallsBackToKeywordSearchPerAllowedPlatform() {
        List<RecommendedProduct> products = List.of(new RecommendedProduct("x", null, Map.of("shopee",
                "https://shopee.vn/search?keyword=x")));

        List<String> links = extractor.extract(products, EnumSet.of(Platform.LAZADA, Platform.TIKI), "cà phê");

        assertEquals(List.of(
                "https://www.lazada.vn/catalog/?q=c%C3%A0%20ph%C3%AA",
                "https://tiki.vn/search?q=c%C3%A0%20ph%C3%AA"), links);
    }

    @Test
    void readProductsFromSearchAnswer() throws Exception {
        List<RecommendedProduct> products = ProductSearchAgent.readProducts(ModelJson.mapper().readTree("""
                        {"products":[
                          {"name":"G7","urls":{"tiki":"https://tiki.vn/search?q=g7","lazada":""}},
                          {},
                          {"name":"Nescafé","url":"https://tiki.vn/search?q=nescafe"},
                          {"name":"Vinacafe"}
                        ]}
                        """), 2);

        assertEquals(2, products.size());
        assertEquals(Map.of("tiki", "https://tiki.vn/search?q=g7"), products.get(0).urls());
        assertEquals("https://tiki.vn/search?q=nescafe", products.get(1).url());
    }
}
