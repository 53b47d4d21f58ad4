package com.starscape.notionsync.common.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One HTTP request to the Notion API. At most one of {@code jsonBody} and
 * {@code filePart} is set; {@code formFields} only accompany a file part.
 */
public record TransportRequest(
    HttpMethod method,
    String url,
    JsonNode jsonBody,
    FilePart filePart,
    Map<String, String> formFields
) {
    
    public TransportRequest {
        if (method == null) {
            throw new IllegalArgumentException("Method cannot be null");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be blank");
        }
        if (jsonBody != null && filePart != null) {
            throw new IllegalArgumentException("A request carries either a JSON body or a multipart body");
        }
        formFields = formFields == null ? Map.of() : Map.copyOf(formFields);
    }
    
    public static TransportRequest json(HttpMethod method, String url, JsonNode body) {
        return new TransportRequest(method, url, body, null, null);
    }
    
    public static TransportRequest multipart(String url, FilePart filePart, Map<String, String> formFields) {
        return new TransportRequest(HttpMethod.POST, url, null, filePart, formFields);
    }
    
    public boolean isMultipart() {
        return filePart != null;
    }
}
