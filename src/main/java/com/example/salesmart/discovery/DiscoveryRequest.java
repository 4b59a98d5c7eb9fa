package com.example.salesmart.discovery;

/**
 * Either raw natural-language text or an already structured query.
 */
public record DiscoveryRequest(
        Long projectId,
        String rawText,
        String query,
        String filterText,
        Integer maxProducts) {

    public static DiscoveryRequest naturalLanguage(Long projectId, String rawText) {
        return new DiscoveryRequest(projectId, rawText, null, null, null);
    }

    public static DiscoveryRequest structured(Long projectId, String query, String filterText, Integer maxProducts) {
        return new DiscoveryRequest(projectId, null, query, filterText, maxProducts);
    }

    public boolean isNaturalLanguage() {
        return query == null && maxProducts == null;
    }
}
