package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.UpstreamDocument;
import org.jsoup.nodes.Document;

/**
 * Extractor for one document layout.
 */
public interface DocumentExtractor {

    DocumentKind kind();

    /**
     * @param html   the parsed document
     * @param source the fetched document, for request parameters that carry identity
     */
    ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException;
}
