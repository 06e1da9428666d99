package com.afttsync.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One logical fetch: endpoint, ordered parameters and timeout. GET requests send the parameters
 * as a query string, POST requests as a url-encoded form.
 */
public record UpstreamRequest(Method method, String url, Map<String, String> parameters, Duration timeout) {

    public enum Method {
        GET,
        POST
    }

    public UpstreamRequest {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static UpstreamRequest get(String url, Map<String, String> parameters, Duration timeout) {
        return new UpstreamRequest(Method.GET, url, parameters, timeout);
    }

    public static UpstreamRequest postForm(String url, Map<String, String> parameters, Duration timeout) {
        return new UpstreamRequest(Method.POST, url, parameters, timeout);
    }

    public String parameter(String name) {
        return parameters.get(name);
    }

    /** Short human-readable form used in logs and error entries. */
    public String describe() {
        if (parameters.isEmpty()) {
            return method + " " + url;
        }
        return method + " " + url + " " + parameters.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("&", "[", "]"));
    }
}
