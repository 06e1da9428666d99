package com.afttsync.infrastructure.upstream;

import com.afttsync.domain.exception.HttpStatusException;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.domain.ports.UpstreamTransport;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Apache HttpClient transport for catalog pages. Sends browser-like headers; the catalog
 * answers bare clients with empty pages.
 */
public class HttpClientTransport implements UpstreamTransport {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    static final Map<String, String> BROWSER_HEADERS = Map.of(
        "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
        "Accept-Language", "fr-FR,fr;q=0.9,en;q=0.8"
    );

    private final CloseableHttpClient httpClient;

    public HttpClientTransport(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public UpstreamDocument execute(UpstreamRequest request) throws IOException {
        HttpUriRequestBase httpRequest = toHttpRequest(request);
        BROWSER_HEADERS.forEach(httpRequest::addHeader);
        if (request.timeout() != null) {
            Timeout timeout = Timeout.ofMilliseconds(request.timeout().toMillis());
            httpRequest.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build());
        }

        try (CloseableHttpResponse response = httpClient.execute(httpRequest)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            String body;
            try {
                body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            } catch (ParseException e) {
                throw new IOException("Failed to read response from " + request.url(), e);
            }

            if (statusCode < 200 || statusCode >= 300) {
                logger.debug("HTTP {} from {}: {}", statusCode, request.url(), preview(body));
                throw new HttpStatusException(statusCode, response.getReasonPhrase());
            }
            return new UpstreamDocument(request, statusCode, body);
        }
    }

    private HttpUriRequestBase toHttpRequest(UpstreamRequest request) throws IOException {
        List<NameValuePair> parameters = request.parameters().entrySet().stream()
            .map(entry -> (NameValuePair) new BasicNameValuePair(entry.getKey(), entry.getValue()))
            .toList();

        if (request.method() == UpstreamRequest.Method.POST) {
            HttpPost post = new HttpPost(request.url());
            post.setEntity(new UrlEncodedFormEntity(parameters, StandardCharsets.UTF_8));
            return post;
        }
        try {
            return new HttpGet(new URIBuilder(request.url()).addParameters(parameters).build());
        } catch (URISyntaxException e) {
            throw new IOException("Invalid upstream URL " + request.url(), e);
        }
    }

    private static String preview(String body) {
        return body.length() > MAX_LOG_BODY_LENGTH ? body.substring(0, MAX_LOG_BODY_LENGTH) + "..." : body;
    }
}
