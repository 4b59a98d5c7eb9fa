package com.example.salesmart.llm;

/**
 * One round-trip to a language-model backend. Implementations do not retry;
 * wrap calls with {@link ResilientModelCaller}.
 */
public interface ModelClient {

    ModelResponse generate(ModelRequest request);

    String provider();
}
