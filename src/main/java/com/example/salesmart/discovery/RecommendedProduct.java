package com.example.salesmart.discovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Product the search model suggested, with the links it proposed
 * ({@code urls} keyed by platform tag, in the model's order).
 */
public record RecommendedProduct(String name, String url, Map<String, String> urls) {

    public RecommendedProduct {
        urls = urls == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(urls));
    }
}
