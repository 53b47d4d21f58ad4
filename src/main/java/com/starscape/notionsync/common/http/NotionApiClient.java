package com.starscape.notionsync.common.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.notionsync.common.config.NotionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Sends requests through the {@link NotionTransport} and classifies every
 * response. Relative paths are resolved against the configured base URL;
 * absolute URLs (such as upload URLs handed out by the server) are used as-is.
 */
@Service
public class NotionApiClient {

    private static final Logger log = LoggerFactory.getLogger(NotionApiClient.class);

    private final NotionTransport transport;
    private final ResponseClassifier classifier;
    private final String baseUrl;

    @Autowired
    public NotionApiClient(NotionTransport transport, ResponseClassifier classifier, NotionProperties properties) {
        this(transport, classifier, properties.getBaseUrl());
    }
    
    public NotionApiClient(NotionTransport transport, ResponseClassifier classifier, String baseUrl) {
        this.transport = transport;
        this.classifier = classifier;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public JsonNode get(String path) {
        return send(TransportRequest.json(HttpMethod.GET, resolve(path), null));
    }

    public JsonNode post(String path, JsonNode body) {
        return send(TransportRequest.json(HttpMethod.POST, resolve(path), body));
    }

    public JsonNode patch(String path, JsonNode body) {
        return send(TransportRequest.json(HttpMethod.PATCH, resolve(path), body));
    }

    public JsonNode postMultipart(String url, FilePart filePart, Map<String, String> formFields) {
        return send(TransportRequest.multipart(resolve(url), filePart, formFields));
    }

    String resolve(String pathOrUrl) {
        if (pathOrUrl.startsWith("http://") || pathOrUrl.startsWith("https://")) {
            return pathOrUrl;
        }
        return pathOrUrl.startsWith("/") ? baseUrl + pathOrUrl : baseUrl + "/" + pathOrUrl;
    }

    private JsonNode send(TransportRequest request) {
        log.debug("Making Notion API request - method: {} - endpoint: {} - has_payload: {} - has_data: {}",
            request.method(), RestClientNotionTransport.endpointOf(request.url()),
            request.jsonBody() != null, request.isMultipart());

        TransportResponse response = transport.exchange(request);
        return classifier.classify(response, request.url());
    }
}
