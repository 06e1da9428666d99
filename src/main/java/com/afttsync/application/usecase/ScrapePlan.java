package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.TaskKind;

import java.util.List;

/**
 * What a task kind scrapes: how units are enumerated and what each unit fetches.
 */
public interface ScrapePlan {

    TaskKind kind();

    List<WorkUnit> enumerate(ScrapeContext context) throws UpstreamException, ExtractionException;
}
