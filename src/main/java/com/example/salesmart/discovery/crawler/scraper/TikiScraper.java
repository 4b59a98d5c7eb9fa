package com.example.salesmart.discovery.crawler.scraper;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.example.salesmart.discovery.Platform;
import com.example.salesmart.discovery.crawler.CrawledCandidate;
import com.example.salesmart.discovery.crawler.CrawledReview;
import com.example.salesmart.discovery.crawler.ProductDetail;
import com.example.salesmart.discovery.crawler.ScrapeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tiki public API: {@code /api/v2/products} search, product detail and
 * paged {@code /api/v2/reviews}.
 */
@Component
public class TikiScraper extends JsonApiScraper {

    private static final Logger log = LoggerFactory.getLogger(TikiScraper.class);

    static final String BASE = "https://tiki.vn";
    private static final Pattern PRODUCT_ID = Pattern.compile("-p(\\d+)\\.html");
    private static final int REVIEW_PAGE_SIZE = 20;

    public TikiScraper(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper);
    }

    @Override
    public Platform platform() {
        return Platform.TIKI;
    }

    @Override
    protected String referer() {
        return BASE + "/";
    }

    @Override
    public List<CrawledCandidate> crawlSearchResults(String searchUrl, int limit) {
        String query = queryParam(searchUrl, "q");
        if (query == null || limit <= 0) {
            log.warn("[Tiki] no query in url={}", searchUrl);
            return List.of();
        }
        URI api = UriComponentsBuilder.fromHttpUrl(BASE + "/api/v2/products")
                .queryParam("limit", limit)
                .queryParam("q", query)
                .encode(StandardCharsets.UTF_8)
                .build()
                .toUri();
        return parseSearch(fetchJson(api), limit);
    }

    @Override
    public ProductDetail crawlProductDetails(String productUrl, int reviewLimit) {
        String productId = extractProductId(productUrl);
        if (productId == null) {
            log.warn("[Tiki] cannot find product id in url={}", productUrl);
            return ProductDetail.linkOnly(productUrl);
        }

        JsonNode product = fetchJson(URI.create(BASE + "/api/v2/products/" + productId));
        String category = text(product.path("categories"), "name");
        String descriptionHtml = text(product, "description");
        String description = descriptionHtml == null ? "" : Jsoup.parse(descriptionHtml).text();

        List<CrawledReview> reviews = new ArrayList<>();
        Map<String, Integer> stars = Map.of();
        int page = 1;
        int lastPage = 1;
        while (reviews.size() < reviewLimit && page <= lastPage) {
            URI uri = UriComponentsBuilder.fromHttpUrl(BASE + "/api/v2/reviews")
                    .queryParam("product_id", productId)
                    .queryParam("page", page)
                    .queryParam("limit", REVIEW_PAGE_SIZE)
                    .queryParam("sort", "score|desc,id|desc,stars|all")
                    .encode(StandardCharsets.UTF_8)
                    .build()
                    .toUri();
            JsonNode body;
            try {
                body = fetchJson(uri);
            } catch (RestClientException | ScrapeException e) {
                log.warn("[Tiki] review page {} failed for product={}: {}", page, productId, e.getMessage());
                break;
            }
            List<CrawledReview> batch = parseReviews(body);
            if (batch.isEmpty()) {
                break;
            }
            if (page == 1) {
                stars = parseStars(body.path("stars"));
            }
            for (CrawledReview r : batch) {
                if (reviews.size() >= reviewLimit) {
                    break;
                }
                reviews.add(r);
            }
            lastPage = body.path("paging").path("last_page").asInt(page);
            page++;
        }

        int total = product.path("review_count").asInt(reviews.size());
        return new ProductDetail(productUrl, category == null ? "" : category, description, stars, total,
                List.copyOf(reviews));
    }

    static String extractProductId(String url) {
        Matcher m = PRODUCT_ID.matcher(url == null ? "" : url);
        return m.find() ? m.group(1) : null;
    }

    static List<CrawledCandidate> parseSearch(JsonNode root, int limit) {
        List<CrawledCandidate> out = new ArrayList<>();
        for (JsonNode p : root.path("data")) {
            if (out.size() >= limit) {
                break;
            }
            JsonNode sold = p.path("quantity_sold");
            String rawSold = sold.isObject() ? text(sold, "value", "text") : text(p, "quantity_sold");
            String path = text(p, "url_path", "url_key");
            out.add(new CrawledCandidate(
                    text(p, "name"),
                    text(p, "price"),
                    rawSold,
                    text(p, "rating_average"),
                    text(p, "review_count"),
                    text(p, "thumbnail_url"),
                    absolutize(path, BASE),
                    Platform.TIKI,
                    text(p, "brand_name"),
                    null,
                    null));
        }
        return out;
    }

    static List<CrawledReview> parseReviews(JsonNode body) {
        List<CrawledReview> out = new ArrayList<>();
        for (JsonNode r : body.path("data")) {
            List<String> images = new ArrayList<>();
            for (JsonNode img : r.path("images")) {
                String full = text(img, "full_path");
                if (full != null) {
                    images.add(full);
                }
            }
            String author = text(r.path("created_by"), "full_name", "name");
            out.add(new CrawledReview(
                    author != null ? author : "Anonymous",
                    r.hasNonNull("rating") ? r.get("rating").asDouble() : null,
                    r.path("content").asText(""),
                    text(r, "created_at"),
                    List.copyOf(images),
                    r.path("thank_count").asInt(0)));
        }
        return out;
    }

    static Map<String, Integer> parseStars(JsonNode stars) {
        Map<String, Integer> out = new LinkedHashMap<>();
        stars.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().path("count").asInt(0)));
        return out;
    }
}
