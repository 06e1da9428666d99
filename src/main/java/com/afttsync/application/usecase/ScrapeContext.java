package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.domain.ports.CatalogRequests;
import com.afttsync.domain.ports.EntityStore;
import com.afttsync.domain.ports.RecordExtractor;
import com.afttsync.domain.ports.UpstreamGateway;

/**
 * Collaborators handed to plans and units while a task runs.
 */
public class ScrapeContext {

    private final UpstreamGateway gateway;
    private final RecordExtractor extractor;
    private final CatalogRequests requests;
    private final EntityStore store;
    private final ScrapeSettings settings;
    private final RunningTask task;

    public ScrapeContext(UpstreamGateway gateway, RecordExtractor extractor, CatalogRequests requests,
                         EntityStore store, ScrapeSettings settings, RunningTask task) {
        this.gateway = gateway;
        this.extractor = extractor;
        this.requests = requests;
        this.store = store;
        this.settings = settings;
        this.task = task;
    }

    public ExtractionResult fetch(UpstreamRequest request, DocumentKind kind)
            throws UpstreamException, ExtractionException {
        UpstreamDocument document = gateway.fetch(request);
        return extractor.parse(document, kind);
    }

    public CatalogRequests requests() {
        return requests;
    }

    public EntityStore store() {
        return store;
    }

    public ScrapeSettings settings() {
        return settings;
    }

    public TaskLog log() {
        return task.log();
    }

    public boolean isCancelled() {
        return task.token().isCancelled();
    }

    /**
     * Paces between two fetches inside a unit. Returns at once when the task is cancelled, so the
     * unit finishes quickly.
     */
    public void pauseBetweenFetches() {
        if (!task.token().isCancelled()) {
            task.token().pause(settings.profilePacingDelay());
        }
    }
}
