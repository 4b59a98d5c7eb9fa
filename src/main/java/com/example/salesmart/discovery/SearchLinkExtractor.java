package com.example.salesmart.discovery;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Turns recommended products into the crawl list: resolvable, allowed,
 * de-duplicated URLs in the order the model gave them.
 */
@Component
public class SearchLinkExtractor {

    private static final Logger log = LoggerFactory.getLogger(SearchLinkExtractor.class);

    public List<String> extract(List<RecommendedProduct> products, Set<Platform> allowed, String query) {
        Set<String> urls = new LinkedHashSet<>();
        for (RecommendedProduct product : products) {
            List<String> links = new ArrayList<>();
            if (product.url() != null) {
                links.add(product.url());
            }
            links.addAll(product.urls().values());
            for (String link : links) {
                Optional<Platform> platform = Platform.fromUrl(link);
                if (!link.startsWith("http")) {
                    log.debug("[Links] dropped relative link {}", link);
                } else if (platform.isEmpty()) {
                    log.debug("[Links] dropped link with unknown platform {}", link);
                } else if (!allowed.contains(platform.get())) {
                    log.debug("[Links] dropped link for excluded platform {}", link);
                } else {
                    urls.add(link);
                }
            }
        }

        if (urls.isEmpty()) {
            for (Platform p : allowed) {
                urls.add(searchUrl(p, query));
            }
            log.info("[Links] model gave no usable link, using keyword search on {}", allowed);
        }
        log.info("[Links] products={} urls={}", products.size(), urls.size());
        return List.copyOf(urls);
    }

    static String searchUrl(Platform platform, String keywords) {
        return searchUrlTemplate(platform).formatted(UriUtils.encodeQueryParam(keywords, StandardCharsets.UTF_8));
    }

    static String searchUrlTemplate(Platform platform) {
        return switch (platform) {
            case LAZADA -> "https://www.lazada.vn/catalog/?q=%s";
            case TIKI -> "https://tiki.vn/search?q=%s";
            case SHOPEE -> "https://shopee.vn/search?keyword=%s";
        };
    }
}
