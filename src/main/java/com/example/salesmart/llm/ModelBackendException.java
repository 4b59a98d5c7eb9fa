package com.example.salesmart.llm;

/**
 * Failure reported by (or while reaching) a model backend.
 * statusCode / providerCode are null when the backend gave no structured answer.
 */
public class ModelBackendException extends RuntimeException {

    private final String provider;
    private final Integer statusCode;
    private final String providerCode;

    public ModelBackendException(String provider, String message, Integer statusCode, String providerCode,
            Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.providerCode = providerCode;
    }

    public ModelBackendException(String provider, String message, Throwable cause) {
        this(provider, message, null, null, cause);
    }

    public String getProvider() {
        return provider;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getProviderCode() {
        return providerCode;
    }

    public boolean hasStructuredStatus() {
        return statusCode != null || (providerCode != null && !providerCode.isBlank());
    }
}
