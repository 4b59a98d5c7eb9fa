package com.example.salesmart.discovery;

public enum DiscoveryStage {
    VALIDATE_INPUT,
    LOAD_PROJECT,
    PARSE_INTENT,
    PARSE_CRITERIA,
    VALIDATE_CRITERIA,
    SEARCH,
    CRAWL,
    FILTER,
    RANK,
    IMPORT
}
