package com.afttsync.domain.model;

import java.util.List;

/**
 * Records extracted from one document, plus diagnostics for anything that was dropped.
 *
 * @param lastPage highest page number the document links to, or 0 when the document is not paginated
 */
public record ExtractionResult(List<ExtractedRecord> records, List<String> diagnostics, int lastPage) {

    public ExtractionResult {
        records = records == null ? List.of() : List.copyOf(records);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public ExtractionResult(List<ExtractedRecord> records, List<String> diagnostics) {
        this(records, diagnostics, 0);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), 0);
    }

    public <T extends ExtractedRecord> List<T> recordsOf(Class<T> type) {
        return records.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
