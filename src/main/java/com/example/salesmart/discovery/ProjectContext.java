package com.example.salesmart.discovery;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only project snapshot handed to the model for grounding.
 */
public record ProjectContext(
        Long id,
        String name,
        String description,
        String targetProductName,
        String targetProductCategory,
        BigDecimal targetBudgetRange,
        String currency,
        String status,
        String pipelineType) {

    public boolean isComplete() {
        return targetProductName != null && !targetProductName.isBlank();
    }

    public Map<String, Object> toPromptMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("description", description == null ? "" : description);
        m.put("target_product_name", targetProductName == null ? "" : targetProductName);
        m.put("target_product_category", targetProductCategory == null ? "" : targetProductCategory);
        m.put("target_budget_range", targetBudgetRange);
        m.put("currency", currency == null ? "VND" : currency);
        m.put("status", status == null ? "" : status);
        m.put("pipeline_type", pipelineType == null ? "" : pipelineType);
        return m;
    }
}
