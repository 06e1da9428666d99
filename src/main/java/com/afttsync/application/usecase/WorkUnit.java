package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;

/**
 * One unit of a scrape (an organization, a licence, a competition). A unit fetches all of its
 * documents first; nothing is merged when any required fetch or extraction fails.
 */
public interface WorkUnit {

    String label();

    UnitHarvest collect(ScrapeContext context) throws UpstreamException, ExtractionException;
}
