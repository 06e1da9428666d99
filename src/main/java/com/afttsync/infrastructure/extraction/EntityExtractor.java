package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.ports.RecordExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parses fetched HTML with jsoup and hands it to the extractor registered for the document kind.
 * Records without a natural key are dropped here and reported as diagnostics.
 */
public class EntityExtractor implements RecordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    private final Map<DocumentKind, DocumentExtractor> extractors = new EnumMap<>(DocumentKind.class);

    public EntityExtractor(List<DocumentExtractor> extractors) {
        for (DocumentExtractor extractor : extractors) {
            DocumentExtractor previous = this.extractors.put(extractor.kind(), extractor);
            if (previous != null) {
                throw new IllegalArgumentException("Two extractors registered for " + extractor.kind());
            }
        }
    }

    @Override
    public ExtractionResult parse(UpstreamDocument document, DocumentKind kind) throws ExtractionException {
        DocumentExtractor extractor = extractors.get(kind);
        if (extractor == null) {
            throw new IllegalStateException("No extractor registered for " + kind);
        }

        Document html = Jsoup.parse(document.body(), document.request().url());
        ExtractionResult raw = extractor.extract(html, document);

        List<ExtractedRecord> kept = new ArrayList<>(raw.records().size());
        List<String> diagnostics = new ArrayList<>(raw.diagnostics());
        for (ExtractedRecord record : raw.records()) {
            String key = record.naturalKey();
            if (key == null || key.isBlank()) {
                diagnostics.add("Dropped " + record.kind() + " record without a natural key");
            } else {
                kept.add(record);
            }
        }
        logger.debug("Extracted {} record(s) from {} ({} diagnostic(s))", kept.size(), kind, diagnostics.size());
        return new ExtractionResult(kept, diagnostics, raw.lastPage());
    }
}
