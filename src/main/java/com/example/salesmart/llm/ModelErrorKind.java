package com.example.salesmart.llm;

public enum ModelErrorKind {
    NETWORK_UNREACHABLE(true),
    TIMEOUT(true),
    RATE_LIMITED(true),
    OVERLOADED(true),
    SERVER_ERROR(true),
    FATAL(false);

    private final boolean retryable;

    ModelErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
