package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.notionsync.common.exception.ErrorKind;
import com.starscape.notionsync.common.exception.NotionApiException;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.common.http.NotionApiClient;
import com.starscape.notionsync.common.http.ResponseClassifier;
import com.starscape.notionsync.common.http.ScriptedTransport;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.fileupload.domain.UploadMode;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import com.starscape.notionsync.features.pages.infra.PageApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.starscape.notionsync.common.http.ScriptedTransport.get;
import static com.starscape.notionsync.common.http.ScriptedTransport.patch;
import static com.starscape.notionsync.common.http.ScriptedTransport.post;
import static org.junit.jupiter.api.Assertions.*;

class PageServiceTest {
    
    private ScriptedTransport transport;
    private PageService pageService;
    
    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        ObjectMapper objectMapper = new ObjectMapper();
        NotionApiClient apiClient = new NotionApiClient(
            transport, new ResponseClassifier(objectMapper), "https://api.notion.com/v1");
        pageService = new PageService(new PageApi(apiClient), new PagePayloadBuilder(objectMapper), new PagePropertiesParser());
    }
    
    @Test
    void shouldCreatePageAndReturnId() {
        transport.respondOk(post("/pages"), "{\"object\":\"page\",\"id\":\"page-123456789\"}");
        
        String pageId = pageService.createPage("Notes", PageProperties.builder().status("Draft").build(), "db-1", "Body");
        
        assertEquals("page-123456789", pageId);
        assertEquals("Draft", transport.requests().get(0).jsonBody()
            .path("properties").path("Status").path("select").path("name").asText());
    }
    
    @Test
    void shouldAppendBlocksBeyondTheFirstHundred() {
        String text = "z".repeat(PagePayloadBuilder.MAX_TEXT_LENGTH * 150);
        transport.respondOk(post("/pages"), "{\"id\":\"page-1\"}")
                .respondOk(patch("/blocks/page-1/children"), "{}");
        
        pageService.createPage("Long", null, "db-1", text);
        
        assertEquals(100, transport.requests().get(0).jsonBody().path("children").size());
        assertEquals(50, transport.requests().get(1).jsonBody().path("children").size());
        assertTrue(transport.isExhausted());
    }
    
    @Test
    void shouldFailWhenCreateResponseHasNoId() {
        transport.respondOk(post("/pages"), "{\"object\":\"page\"}");
        
        NotionPageException e = assertThrows(NotionPageException.class,
            () -> pageService.createPage("Notes", null, "db-1", null));
        
        assertEquals(ErrorKind.PAGE_OPERATION_FAILURE, e.getKind());
    }
    
    @Test
    void shouldSendNothingForBlankText() {
        pageService.appendText("page-1", "");
        
        assertTrue(transport.requests().isEmpty());
    }
    
    @Test
    void shouldAppendFileBlock() {
        transport.respondOk(patch("/blocks/page-1/children"), "{\"results\":[]}");
        
        pageService.appendFileBlock("page-1", new CompletedUpload("up-1", "a.pdf", "application/pdf", UploadMode.SINGLE_PART));
        
        assertEquals("pdf", transport.requests().get(0).jsonBody().path("children").get(0).path("type").asText());
    }
    
    @Test
    void shouldPatchPageProperties() {
        transport.respondOk(patch("/pages/page-1"), "{\"id\":\"page-1\"}");
        
        pageService.updatePage("page-1", Map.of("Link Count", 7));
        
        assertEquals(7, transport.requests().get(0).jsonBody().path("properties").path("Link Count").path("number").asInt());
    }
    
    @Test
    void shouldReportMissingPageAsPageFailure() {
        transport.respond(get("/pages/nope"), 404,
            "{\"object\":\"error\",\"code\":\"object_not_found\",\"message\":\"Could not find page.\"}");
        
        NotionApiException e = assertThrows(NotionApiException.class, () -> pageService.getPage("nope"));
        
        assertEquals(ErrorKind.PAGE_OPERATION_FAILURE, e.getKind());
        assertEquals(404, e.getStatusCode());
        assertEquals("object_not_found", e.getErrorCode());
    }
    
    @Test
    void shouldReadTypedPropertiesBack() {
        transport.respondOk(get("/pages/page-1"),
            "{\"id\":\"page-1\",\"properties\":{\"Status\":{\"select\":{\"name\":\"Done\"}}}}");
        
        assertEquals("Done", pageService.getPageProperties("page-1").status());
    }
}
