package com.afttsync.domain.ports;

import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.UpstreamRequest;

/**
 * Builds the catalog requests for each document kind.
 */
public interface CatalogRequests {

    UpstreamRequest organizationList();

    UpstreamRequest organizationDirectory(String organizationCode);

    UpstreamRequest profile(String licence, CompetitionType type);

    /** Competition list page, 1-based. */
    UpstreamRequest competitionList(int page);

    UpstreamRequest competitionSeries(long competitionId);

    UpstreamRequest competitionEntries(long competitionId);
}
