package com.example.salesmart.discovery;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by every discovery run, success or not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryResult(
        String status,
        String message,
        DiscoveryErrorType errorType,
        DiscoveryStage failedStage,
        Integer foundCount,
        Integer filteredCount,
        Integer importedCount,
        List<Long> importedIds,
        Map<String, Object> extractedCriteria,
        List<Platform> suggestedPlatforms,
        String runId) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
