package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.notionsync.common.exception.ErrorKind;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PagePropertiesParserTest {
    
    private final PagePropertiesParser parser = new PagePropertiesParser();
    
    @Test
    void shouldParseApiPageResponse() throws Exception {
        String page = """
            {
              "object": "page",
              "id": "page-1",
              "properties": {
                "Title": {"type": "title", "title": [{"plain_text": "Hello "}, {"plain_text": "world"}]},
                "Tags": {"type": "multi_select", "multi_select": [{"name": "a"}]},
                "Source": {"type": "select", "select": null},
                "Pinned": {"type": "checkbox", "checkbox": true},
                "Source URL": {"type": "url", "url": null},
                "Created At": {"type": "date", "date": {"start": "2024-05-01"}},
                "File Count": {"type": "number", "number": 4}
              }
            }
            """;
        
        PageProperties properties = parser.parsePage(new ObjectMapper().readTree(page));
        
        assertEquals("Hello world", properties.title());
        assertEquals(List.of("a"), properties.tags());
        assertNull(properties.source());
        assertTrue(properties.pinned());
        assertNull(properties.sourceUrl());
        assertEquals(OffsetDateTime.of(2024, 5, 1, 0, 0, 0, 0, ZoneOffset.UTC), properties.createdAt());
        assertEquals(4, properties.fileCount());
        assertNull(properties.summary());
    }
    
    @Test
    void shouldReadDateTimeWithoutOffsetAsUtc() {
        PagePayloadBuilder builder = new PagePayloadBuilder(new ObjectMapper());
        JsonNode properties = builder.buildUpdatePayload(
            Map.of("Created At", LocalDateTime.of(2024, 5, 1, 10, 0))).path("properties");
        
        assertEquals("2024-05-01T10:00:00", properties.path("Created At").path("date").path("start").asText());
        assertEquals(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC), parser.parse(properties).createdAt());
    }
    
    @Test
    void shouldApplyTimeZoneOfDateProperty() throws Exception {
        String properties = """
            {"Updated At": {"type": "date", "date": {"start": "2024-01-15T09:00:00", "time_zone": "Europe/Berlin"}}}
            """;
        
        PageProperties parsed = parser.parse(new ObjectMapper().readTree(properties));
        
        assertEquals(OffsetDateTime.of(2024, 1, 15, 9, 0, 0, 0, ZoneOffset.ofHours(1)), parsed.updatedAt());
    }
    
    @Test
    void shouldFailAsPageOperationOnUnreadableDate() throws Exception {
        String properties = "{\"Created At\": {\"date\": {\"start\": \"next tuesday\"}}}";
        
        NotionPageException e = assertThrows(NotionPageException.class,
            () -> parser.parse(new ObjectMapper().readTree(properties)));
        
        assertEquals(ErrorKind.PAGE_OPERATION_FAILURE, e.getKind());
    }
}
