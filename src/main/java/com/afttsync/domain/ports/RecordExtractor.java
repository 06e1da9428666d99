package com.afttsync.domain.ports;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.UpstreamDocument;

/**
 * Port for turning a fetched document into typed records.
 */
public interface RecordExtractor {

    ExtractionResult parse(UpstreamDocument document, DocumentKind kind) throws ExtractionException;
}
