package com.example.salesmart.discovery.crawler.scraper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

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
 * Shopee v4 search and v2 ratings endpoints. Disabled by default through
 * discovery.disabled-platforms; the scraper stays registered so a runtime
 * flag can turn it back on.
 */
@Component
public class ShopeeScraper extends JsonApiScraper {

    private static final Logger log = LoggerFactory.getLogger(ShopeeScraper.class);

    static final String BASE = "https://shopee.vn";
    static final String IMAGE_BASE = "https://down-ws-vn.img.susercontent.com/";
    /** Prices come in units of 1/100000 VND. */
    private static final BigDecimal PRICE_DIVISOR = BigDecimal.valueOf(100_000);
    private static final Pattern IDS = Pattern.compile("i\\.(\\d+)\\.(\\d+)");
    private static final int RATINGS_PAGE_SIZE = 20;

    public ShopeeScraper(RestTemplate restTemplate, ObjectMapper objectMapper) {
        super(restTemplate, objectMapper);
    }

    @Override
    public Platform platform() {
        return Platform.SHOPEE;
    }

    @Override
    protected String referer() {
        return BASE + "/";
    }

    @Override
    public List<CrawledCandidate> crawlSearchResults(String searchUrl, int limit) {
        String keyword = queryParam(searchUrl, "keyword");
        if (keyword == null || limit <= 0) {
            log.warn("[Shopee] no keyword in url={}", searchUrl);
            return List.of();
        }
        log.info("[Shopee] search keyword={} limit={}", keyword, limit);
        URI api = UriComponentsBuilder.fromHttpUrl(BASE + "/api/v4/search/search_items")
                .queryParam("by", "relevancy")
                .queryParam("keyword", keyword)
                .queryParam("limit", limit)
                .queryParam("newest", 0)
                .queryParam("order", "desc")
                .queryParam("page_type", "search")
                .queryParam("scenario", "PAGE_GLOBAL_SEARCH")
                .queryParam("version", 2)
                .encode(StandardCharsets.UTF_8)
                .build()
                .toUri();
        return parseSearchItems(fetchJson(api), limit);
    }

    @Override
    public ProductDetail crawlProductDetails(String productUrl, int reviewLimit) {
        String[] ids = extractIds(productUrl);
        if (ids == null) {
            log.warn("[Shopee] cannot find shopid/itemid in url={}", productUrl);
            return ProductDetail.linkOnly(productUrl);
        }
        String shopId = ids[0];
        String itemId = ids[1];

        List<CrawledReview> reviews = new ArrayList<>();
        int offset = 0;
        while (reviews.size() < reviewLimit) {
            URI uri = UriComponentsBuilder.fromHttpUrl(BASE + "/api/v2/item/get_ratings")
                    .queryParam("itemid", itemId)
                    .queryParam("shopid", shopId)
                    .queryParam("filter", 0)
                    .queryParam("flag", 1)
                    .queryParam("limit", RATINGS_PAGE_SIZE)
                    .queryParam("offset", offset)
                    .queryParam("type", 0)
                    .build()
                    .toUri();
            List<CrawledReview> batch;
            try {
                batch = parseRatings(fetchJson(uri));
            } catch (RestClientException | ScrapeException e) {
                log.warn("[Shopee] ratings offset={} failed for item={}: {}", offset, itemId, e.getMessage());
                break;
            }
            if (batch.isEmpty()) {
                break;
            }
            for (CrawledReview r : batch) {
                if (reviews.size() >= reviewLimit) {
                    break;
                }
                reviews.add(r);
            }
            offset += batch.size();
        }
        return new ProductDetail(productUrl, "", "", Map.of(), reviews.size(), List.copyOf(reviews));
    }

    /**
     * @return {shopId, itemId}, or null
     */
    static String[] extractIds(String url) {
        Matcher m = IDS.matcher(url == null ? "" : url);
        return m.find() ? new String[] { m.group(1), m.group(2) } : null;
    }

    static List<CrawledCandidate> parseSearchItems(JsonNode root, int limit) {
        List<CrawledCandidate> out = new ArrayList<>();
        for (JsonNode wrapper : root.path("items")) {
            if (out.size() >= limit) {
                break;
            }
            JsonNode item = wrapper.path("item_basic");
            if (!item.isObject()) {
                continue;
            }
            String name = text(item, "name");
            String slug = name != null ? name.replaceAll("[^a-zA-Z0-9]+", "-") : "product";
            String link = BASE + "/" + slug + "-i." + text(item, "shopid") + "." + text(item, "itemid");
            String image = text(item, "image");
            String price = null;
            if (item.path("price").isNumber()) {
                price = item.get("price").decimalValue()
                        .divide(PRICE_DIVISOR, 2, RoundingMode.HALF_UP)
                        .toPlainString();
            }
            out.add(new CrawledCandidate(
                    name,
                    price,
                    text(item, "sold", "historical_sold"),
                    text(item.path("item_rating"), "rating_star"),
                    text(item, "cmt_count"),
                    image != null ? IMAGE_BASE + image : null,
                    link,
                    Platform.SHOPEE,
                    text(item, "brand"),
                    item.path("is_official_shop").asBoolean(false),
                    text(item, "shop_location")));
        }
        return out;
    }

    static List<CrawledReview> parseRatings(JsonNode body) {
        List<CrawledReview> out = new ArrayList<>();
        for (JsonNode r : body.path("data").path("ratings")) {
            String author = text(r, "author_username");
            if (author == null && r.path("anonymous").asBoolean(false)) {
                author = "******";
            }
            List<String> images = new ArrayList<>();
            for (JsonNode img : r.path("images")) {
                if (!img.asText().isBlank()) {
                    images.add(IMAGE_BASE + img.asText());
                }
            }
            out.add(new CrawledReview(
                    author != null ? author : "Anonymous",
                    r.path("rating_star").asDouble(5),
                    r.path("comment").asText(""),
                    text(r, "ctime"),
                    List.copyOf(images),
                    r.path("like_count").asInt(0)));
        }
        return out;
    }
}
