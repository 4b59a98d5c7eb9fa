package com.example.salesmart.discovery.crawler.scraper;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.example.salesmart.discovery.Platform;
import com.example.salesmart.discovery.crawler.CrawledCandidate;
import com.example.salesmart.discovery.crawler.PageRenderer;
import com.example.salesmart.discovery.crawler.ProductDetail;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Lazada: catalog JSON first, rendered HTML when the JSON endpoint answers
 * with a challenge page or nothing.
 */
@Component
public class LazadaScraper extends JsonApiScraper {

    private static final Logger log = LoggerFactory.getLogger(LazadaScraper.class);

    static final String BASE = "https://www.lazada.vn";
    private static final Duration RENDER_SETTLE = Duration.ofSeconds(5);

    private final PageRenderer renderer;

    public LazadaScraper(RestTemplate restTemplate, ObjectMapper objectMapper, PageRenderer renderer) {
        super(restTemplate, objectMapper);
        this.renderer = renderer;
    }

    @Override
    public Platform platform() {
        return Platform.LAZADA;
    }

    @Override
    protected String referer() {
        return BASE + "/";
    }

    @Override
    public List<CrawledCandidate> crawlSearchResults(String searchUrl, int limit) {
        String query = extractQuery(searchUrl);
        if (query == null || limit <= 0) {
            log.warn("[Lazada] no query in url={}", searchUrl);
            return List.of();
        }

        URI api = UriComponentsBuilder.fromHttpUrl(BASE + "/catalog/")
                .queryParam("_keyori", "ss")
                .queryParam("ajax", "true")
                .queryParam("from", "input")
                .queryParam("q", query)
                .encode(StandardCharsets.UTF_8)
                .build()
                .toUri();

        try {
            String body = fetch(api);
            if (body != null && !body.isBlank()) {
                List<CrawledCandidate> items = body.trim().startsWith("{")
                        ? parseCatalogJson(objectMapper.readTree(body), limit)
                        : parseHtml(body, limit);
                if (!items.isEmpty()) {
                    return items;
                }
            }
            log.info("[Lazada] catalog endpoint returned no items, rendering page query={}", query);
        } catch (RestClientException | JsonProcessingException e) {
            log.info("[Lazada] catalog endpoint unusable ({}), rendering page query={}", e.getMessage(), query);
        }

        URI page = UriComponentsBuilder.fromHttpUrl(BASE + "/catalog/")
                .queryParam("q", query)
                .encode(StandardCharsets.UTF_8)
                .build()
                .toUri();
        return parseHtml(renderer.render(page.toString(), RENDER_SETTLE), limit);
    }

    /**
     * The catalog API has no public review endpoint.
     */
    @Override
    public ProductDetail crawlProductDetails(String productUrl, int reviewLimit) {
        log.debug("[Lazada] product details not available, url={}", productUrl);
        return ProductDetail.linkOnly(productUrl);
    }

    static String extractQuery(String searchUrl) {
        String q = queryParam(searchUrl, "q");
        if (q != null) {
            return q;
        }
        String path;
        try {
            path = URI.create(searchUrl.trim()).getRawPath();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (path != null && path.contains("/tag/")) {
            String slug = path.substring(path.indexOf("/tag/") + 5);
            while (slug.endsWith("/")) {
                slug = slug.substring(0, slug.length() - 1);
            }
            if (!slug.isBlank()) {
                return URLDecoder.decode(slug, StandardCharsets.UTF_8).replace('-', ' ').trim();
            }
        }
        return null;
    }

    static List<CrawledCandidate> parseCatalogJson(JsonNode root, int limit) {
        JsonNode list = firstArray(root.at("/mods/listItems"), root.path("listItems"), root.path("items"),
                root.path("data"));
        List<CrawledCandidate> out = new ArrayList<>();
        if (list == null) {
            return out;
        }
        for (JsonNode p : list) {
            if (out.size() >= limit) {
                break;
            }
            String link = absolutize(text(p, "productUrl", "itemUrl", "productUrlAlias"), BASE);
            out.add(new CrawledCandidate(
                    text(p, "name"),
                    text(p, "price", "priceShow"),
                    text(p, "itemSoldCntShow", "sellVolume"),
                    text(p, "ratingScore"),
                    text(p, "review", "reviewCount"),
                    absolutize(text(p, "image", "thumb"), BASE),
                    link,
                    Platform.LAZADA,
                    text(p, "brandName"),
                    null,
                    text(p, "location")));
        }
        return out;
    }

    static List<CrawledCandidate> parseHtml(String html, int limit) {
        Document doc = Jsoup.parse(html, BASE);
        Elements items = doc.select("div[data-qa-locator=product-item]");
        if (items.isEmpty()) {
            items = doc.select("div[class*=Bm3ON]");
        }
        List<CrawledCandidate> out = new ArrayList<>();
        for (Element item : items) {
            if (out.size() >= limit) {
                break;
            }
            Element anchor = item.selectFirst("a[href]");
            Element titled = item.selectFirst("a[title]");
            String link = anchor != null ? absolutize(anchor.attr("href"), BASE) : null;
            String name = titled != null ? titled.attr("title").trim() : null;
            if (link == null || name == null || name.isEmpty()) {
                continue;
            }
            Element price = item.selectFirst("span[class*=ooOxS]");
            Element img = item.selectFirst("img[src]");
            out.add(CrawledCandidate.basic(Platform.LAZADA, name,
                    price != null ? price.text() : null,
                    null,
                    null,
                    img != null ? absolutize(img.attr("src"), BASE) : null,
                    link));
        }
        return out;
    }

    private static JsonNode firstArray(JsonNode... candidates) {
        for (JsonNode n : candidates) {
            if (n != null && n.isArray() && !n.isEmpty()) {
                return n;
            }
        }
        return null;
    }
}
