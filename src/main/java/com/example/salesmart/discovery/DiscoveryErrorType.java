package com.example.salesmart.discovery;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One terminal error per abort point of a discovery run.
 */
public enum DiscoveryErrorType {

    INVALID_INPUT("invalid_input"),
    INPUT_TOO_LONG("input_too_long"),
    PROJECT_NOT_FOUND("project_not_found"),
    PROJECT_INCOMPLETE("project_incomplete"),
    UNSUPPORTED_PLATFORM("platform_not_supported"),
    PARSING_FAILED("parsing_failed"),
    INTENT_PARSING_FAILED("intent_parsing_failed"),
    CRITERIA_VALIDATION_FAILED("criteria_validation_failed"),
    NO_PRODUCTS_FOUND("no_products_found"),
    CRAWL_FAILED("crawl_failed"),
    NO_PRODUCTS_AFTER_FILTER("no_products_after_filter"),
    IMPORT_FAILED("import_failed"),
    EXECUTION_ERROR("execution_error");

    private final String code;

    DiscoveryErrorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
