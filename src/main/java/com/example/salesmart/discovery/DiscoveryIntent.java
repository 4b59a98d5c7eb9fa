package com.example.salesmart.discovery;

/**
 * Search query, optional free-text filter and result budget.
 */
public record DiscoveryIntent(String query, String filterText, int maxProducts) {

    public boolean hasFilter() {
        return filterText != null && !filterText.isBlank();
    }
}
