package com.afttsync.domain.model;

/**
 * A fetched upstream document with the request that produced it.
 */
public record UpstreamDocument(UpstreamRequest request, int statusCode, String body) {

    public UpstreamDocument {
        body = body == null ? "" : body;
    }
}
