package com.starscape.notionsync.features.pages.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.notionsync.common.http.NotionApiClient;
import org.springframework.stereotype.Service;

/**
 * Page and block endpoints.
 */
@Service
public class PageApi {
    
    static final String PAGES_PATH = "/pages";
    static final String BLOCKS_PATH = "/blocks";
    
    private final NotionApiClient apiClient;
    
    public PageApi(NotionApiClient apiClient) {
        this.apiClient = apiClient;
    }
    
    public JsonNode create(JsonNode payload) {
        return apiClient.post(PAGES_PATH, payload);
    }
    
    public JsonNode retrieve(String pageId) {
        return apiClient.get(PAGES_PATH + "/" + pageId);
    }
    
    public JsonNode update(String pageId, JsonNode payload) {
        return apiClient.patch(PAGES_PATH + "/" + pageId, payload);
    }
    
    public JsonNode appendChildren(String blockId, JsonNode payload) {
        return apiClient.patch(BLOCKS_PATH + "/" + blockId + "/children", payload);
    }
}
