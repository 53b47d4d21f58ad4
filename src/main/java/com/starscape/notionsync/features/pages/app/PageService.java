package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import com.starscape.notionsync.features.pages.infra.PageApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.starscape.notionsync.common.logging.LogIds.shortId;

/**
 * Page operations on top of {@link PageApi}. Long text is split into
 * paragraph blocks and sent in batches Notion accepts.
 */
@Service
public class PageService {
    
    private static final Logger log = LoggerFactory.getLogger(PageService.class);
    
    private final PageApi pageApi;
    private final PagePayloadBuilder payloadBuilder;
    private final PagePropertiesParser propertiesParser;
    
    public PageService(PageApi pageApi, PagePayloadBuilder payloadBuilder, PagePropertiesParser propertiesParser) {
        this.pageApi = pageApi;
        this.payloadBuilder = payloadBuilder;
        this.propertiesParser = propertiesParser;
    }
    
    /**
     * Creates a page in the given database.
     *
     * @param contentText page body, may be null
     * @return the new page id
     */
    public String createPage(String title, PageProperties properties, String databaseId, String contentText) {
        Iterator<ObjectNode> blocks = payloadBuilder.paragraphBlocks(contentText).iterator();
        ObjectNode payload = payloadBuilder.buildCreatePayload(title, properties, databaseId, nextBatch(blocks));
        
        JsonNode response = pageApi.create(payload);
        String pageId = response.path("id").asText(null);
        if (pageId == null || pageId.isBlank()) {
            throw new NotionPageException("Notion did not return a page id");
        }
        log.info("Page created - page_id: {}... - title: {}", shortId(pageId), title);
        
        appendBatches(pageId, blocks);
        return pageId;
    }
    
    /**
     * Appends text as paragraph blocks. Blank text sends nothing.
     */
    public void appendText(String pageId, String text) {
        int batches = appendBatches(pageId, payloadBuilder.paragraphBlocks(text).iterator());
        log.debug("Text appended - page_id: {}... - requests: {}", shortId(pageId), batches);
    }
    
    public JsonNode appendFileBlock(String pageId, CompletedUpload upload) {
        ObjectNode block = payloadBuilder.fileBlock(upload);
        JsonNode response = pageApi.appendChildren(pageId, payloadBuilder.buildAppendPayload(List.of(block)));
        log.info("File block appended - page_id: {}... - upload_id: {}... - block_type: {}",
            shortId(pageId), shortId(upload.uploadId()), upload.blockType().getBlockType());
        return response;
    }
    
    public JsonNode getPage(String pageId) {
        return pageApi.retrieve(pageId);
    }
    
    public PageProperties getPageProperties(String pageId) {
        return propertiesParser.parsePage(getPage(pageId));
    }
    
    public JsonNode updatePage(String pageId, Map<String, ?> properties) {
        JsonNode response = pageApi.update(pageId, payloadBuilder.buildUpdatePayload(properties));
        log.info("Page updated - page_id: {}... - properties: {}", shortId(pageId), properties.keySet());
        return response;
    }
    
    public JsonNode updatePage(String pageId, PageProperties properties) {
        JsonNode response = pageApi.update(pageId, payloadBuilder.buildUpdatePayload(properties));
        log.info("Page updated - page_id: {}... - typed: true", shortId(pageId));
        return response;
    }
    
    private int appendBatches(String pageId, Iterator<ObjectNode> blocks) {
        int requests = 0;
        while (blocks.hasNext()) {
            pageApi.appendChildren(pageId, payloadBuilder.buildAppendPayload(nextBatch(blocks)));
            requests++;
        }
        return requests;
    }
    
    private static List<ObjectNode> nextBatch(Iterator<ObjectNode> blocks) {
        List<ObjectNode> batch = new ArrayList<>();
        while (blocks.hasNext() && batch.size() < PagePayloadBuilder.MAX_CHILDREN_PER_REQUEST) {
            batch.add(blocks.next());
        }
        return batch;
    }
}
