package com.example.salesmart.dto.discovery;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Structured entry: the caller already split query, filter text and budget.
 * The budget range is checked by the pipeline against discovery.max-products-*.
 */
public record LegacyAutoDiscoveryRequest(
        @NotNull Long projectId,
        @NotBlank String userQuery,
        String filterCriteria,
        Integer maxProducts) {
}
