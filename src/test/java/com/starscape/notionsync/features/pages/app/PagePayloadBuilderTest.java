package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.fileupload.domain.UploadMode;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PagePayloadBuilderTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PagePayloadBuilder builder = new PagePayloadBuilder(objectMapper);
    private final PagePropertiesParser parser = new PagePropertiesParser();
    
    @Test
    void shouldBuildCreatePayloadWithParentAndChildren() {
        List<ObjectNode> children = builder.paragraphBlocks("Hello").collect(Collectors.toList());
        
        ObjectNode payload = builder.buildCreatePayload("Weekly notes", null, "db-1", children);
        
        assertEquals("database_id", payload.path("parent").path("type").asText());
        assertEquals("db-1", payload.path("parent").path("database_id").asText());
        assertEquals("Weekly notes",
            payload.path("properties").path("Title").path("title").get(0).path("text").path("content").asText());
        assertEquals("paragraph", payload.path("children").get(0).path("type").asText());
        assertEquals("Hello",
            payload.path("children").get(0).path("paragraph").path("rich_text").get(0).path("text").path("content").asText());
    }
    
    @Test
    void shouldLeaveOutChildrenWhenThereIsNoContent() {
        ObjectNode payload = builder.buildCreatePayload("Empty", PageProperties.builder().build(), "db-1");
        
        assertFalse(payload.has("children"));
    }
    
    @Test
    void shouldEmitOnlyPresentProperties() {
        ObjectNode properties = builder.buildProperties(PageProperties.builder()
                .title("Title only")
                .source("")
                .tags(List.of())
                .build());
        
        assertEquals(1, properties.size());
        assertTrue(properties.has("Title"));
    }
    
    @Test
    void shouldRoundTripAllPropertyTypes() {
        PageProperties original = PageProperties.builder()
                .title("Release plan")
                .source("Slack")
                .tags(List.of("work", "q3"))
                .pinned(false)
                .sourceUrl("https://example.com/thread")
                .createdAt(OffsetDateTime.of(2024, 5, 1, 9, 30, 0, 0, ZoneOffset.UTC))
                .updatedAt(OffsetDateTime.of(2024, 5, 2, 18, 0, 0, 0, ZoneOffset.ofHours(2)))
                .fileCount(2)
                .linkCount(0)
                .status("Active")
                .summary("s".repeat(2500))
                .build();
        
        ObjectNode properties = builder.buildProperties(original);
        
        assertEquals(2, properties.path("Summary").path("rich_text").size());
        assertEquals(false, properties.path("Pinned").path("checkbox").asBoolean(true));
        assertEquals("2024-05-01T09:30:00Z", properties.path("Created At").path("date").path("start").asText());
        assertEquals(original, parser.parse(properties));
    }
    
    @Test
    void shouldMapUpdateValuesByType() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Due", LocalDate.of(2024, 6, 1));
        values.put("Pinned", true);
        values.put("File Count", 3);
        values.put("Summary", "Short");
        values.put("Tags", List.of("a", "b"));
        values.put("Status", Map.of("select", Map.of("name", "Done")));
        values.put("Ignored", null);
        
        JsonNode properties = builder.buildUpdatePayload(values).path("properties");
        
        assertEquals("2024-06-01", properties.path("Due").path("date").path("start").asText());
        assertTrue(properties.path("Pinned").path("checkbox").asBoolean());
        assertEquals(3, properties.path("File Count").path("number").asInt());
        assertEquals("Short", properties.path("Summary").path("rich_text").get(0).path("text").path("content").asText());
        assertEquals("b", properties.path("Tags").path("multi_select").get(1).path("name").asText());
        assertEquals("Done", properties.path("Status").path("select").path("name").asText());
        assertFalse(properties.has("Ignored"));
    }
    
    @Test
    void shouldReferenceUploadFromFileBlock() {
        CompletedUpload upload = new CompletedUpload("up-1", "clip.mp4", "video/mp4", UploadMode.MULTI_PART);
        
        ObjectNode block = builder.fileBlock(upload);
        
        assertEquals("video", block.path("type").asText());
        JsonNode video = block.path("video");
        assertEquals("file_upload", video.path("type").asText());
        assertEquals("up-1", video.path("file_upload").path("id").asText());
        assertEquals("clip.mp4", video.path("caption").get(0).path("text").path("content").asText());
    }
    
    @Test
    void shouldBuildOneParagraphPerChunk() {
        assertEquals(3, builder.paragraphBlocks("y".repeat(PagePayloadBuilder.MAX_TEXT_LENGTH * 2 + 10)).count());
    }
}
