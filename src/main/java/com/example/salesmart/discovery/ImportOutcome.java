package com.example.salesmart.discovery;

import java.util.List;

/**
 * @param duplicates rows skipped because the product URL was already imported
 * @param failures   rows that could not be saved
 */
public record ImportOutcome(List<Long> importedIds, int duplicates, int failures) {

    public int importedCount() {
        return importedIds.size();
    }

    public int skipped() {
        return duplicates + failures;
    }
}
