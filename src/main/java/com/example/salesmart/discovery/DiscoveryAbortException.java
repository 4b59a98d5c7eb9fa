package com.example.salesmart.discovery;

import java.util.List;
import java.util.Map;

/**
 * Deliberate stop of a discovery run, raised by a stage's own checks.
 * Carries the payload a client needs to correct the request.
 */
public class DiscoveryAbortException extends RuntimeException {

    private final DiscoveryErrorType errorType;
    private final Map<String, Object> extractedCriteria;
    private final List<Platform> suggestedPlatforms;

    public DiscoveryAbortException(DiscoveryErrorType errorType, String message) {
        this(errorType, message, null, null);
    }

    public DiscoveryAbortException(DiscoveryErrorType errorType, String message,
            Map<String, Object> extractedCriteria, List<Platform> suggestedPlatforms) {
        super(message);
        this.errorType = errorType;
        this.extractedCriteria = extractedCriteria;
        this.suggestedPlatforms = suggestedPlatforms;
    }

    public DiscoveryErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getExtractedCriteria() {
        return extractedCriteria;
    }

    public List<Platform> getSuggestedPlatforms() {
        return suggestedPlatforms;
    }
}
