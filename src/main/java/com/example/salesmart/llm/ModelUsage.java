package com.example.salesmart.llm;

/**
 * Token accounting reported by the backend. Any field may be null.
 */
public record ModelUsage(
        Integer promptTokens,
        Integer completionTokens,
        Integer totalTokens) {

    public static ModelUsage empty() {
        return new ModelUsage(null, null, null);
    }
}
