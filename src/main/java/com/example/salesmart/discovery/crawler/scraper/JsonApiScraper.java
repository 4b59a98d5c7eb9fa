package com.example.salesmart.discovery.crawler.scraper;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.example.salesmart.discovery.crawler.ProductScraper;
import com.example.salesmart.discovery.crawler.ScrapeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared plumbing for scrapers that read a marketplace's public JSON endpoints.
 */
abstract class JsonApiScraper implements ProductScraper {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;

    protected JsonApiScraper(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    protected abstract String referer();

    protected String fetch(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.REFERER, referer());
        headers.set("X-Requested-With", "XMLHttpRequest");
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.ALL));
        return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class).getBody();
    }

    protected JsonNode fetchJson(URI uri) {
        String body = fetch(uri);
        if (body == null || body.isBlank()) {
            throw new ScrapeException("Empty response from " + uri.getHost());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ScrapeException("Non-JSON response from " + uri.getHost(), e);
        }
    }

    /**
     * Decoded value of a query parameter, or null.
     */
    static String queryParam(String url, String name) {
        try {
            String raw = UriComponentsBuilder.fromUriString(url).build().getQueryParams().getFirst(name);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            return URLDecoder.decode(raw, StandardCharsets.UTF_8).trim();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** First non-blank text among the given fields. Numbers are returned as text. */
    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode v = node.get(field);
            if (v != null && !v.isNull() && !v.isContainerNode()) {
                String s = v.asText();
                if (!s.isBlank()) {
                    return s.trim();
                }
            }
        }
        return null;
    }

    static String absolutize(String link, String base) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String l = link.trim();
        if (l.startsWith("//")) {
            return "https:" + l;
        }
        if (l.startsWith("/")) {
            return base + l;
        }
        if (!l.startsWith("http")) {
            return base + "/" + l;
        }
        return l;
    }
}
