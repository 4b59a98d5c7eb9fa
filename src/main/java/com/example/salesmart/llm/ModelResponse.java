package com.example.salesmart.llm;

public record ModelResponse(
        String text,
        ModelUsage usage,
        String provider,
        String model) {

    public ModelResponse {
        text = text == null ? "" : text;
        usage = usage == null ? ModelUsage.empty() : usage;
    }
}
