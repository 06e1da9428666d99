package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import org.jsoup.nodes.Document;

final class CompetitionPages {

    private CompetitionPages() {
    }

    static long competitionId(UpstreamDocument source, Document html) throws ExtractionException {
        String value = source.request().parameter(AfttCatalogRequests.COMPETITION_PARAM);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ExtractionException("Competition page requested without a numeric t_id", html.text());
        }
    }
}
