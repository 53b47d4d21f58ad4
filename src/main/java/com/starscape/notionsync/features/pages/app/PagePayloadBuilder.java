package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starscape.notionsync.features.fileupload.domain.CompletedUpload;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import com.starscape.notionsync.features.pages.domain.PageSchema;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Maps typed page values to Notion's wire format. Every call builds fresh nodes.
 */
@Service
public class PagePayloadBuilder {
    
    /** Notion accepts 2000 chars per text object; stay a little below. */
    public static final int MAX_TEXT_LENGTH = 1950;
    
    /** Notion accepts at most 100 child blocks per request. */
    public static final int MAX_CHILDREN_PER_REQUEST = 100;
    
    private final ObjectMapper objectMapper;
    
    public PagePayloadBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public ObjectNode buildCreatePayload(String title, PageProperties properties, String databaseId) {
        return buildCreatePayload(title, properties, databaseId, List.of());
    }
    
    public ObjectNode buildCreatePayload(
            String title,
            PageProperties properties,
            String databaseId,
            List<? extends JsonNode> children) {
        PageProperties values = properties == null
            ? PageProperties.builder().title(title).build()
            : properties.withTitle(title);
        
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode parent = payload.putObject("parent");
        parent.put("type", "database_id");
        parent.put("database_id", databaseId);
        payload.set("properties", buildProperties(values));
        if (children != null && !children.isEmpty()) {
            payload.putArray("children").addAll(children);
        }
        return payload;
    }
    
    public ObjectNode buildAppendPayload(List<? extends JsonNode> children) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.putArray("children").addAll(children);
        return payload;
    }
    
    /**
     * Only values that are set make it into the result.
     */
    public ObjectNode buildProperties(PageProperties values) {
        ObjectNode properties = objectMapper.createObjectNode();
        
        if (values.title() != null) {
            properties.putObject(PageSchema.TITLE).set("title", textArray(values.title()));
        }
        if (hasText(values.source())) {
            properties.set(PageSchema.SOURCE, select(values.source()));
        }
        if (values.tags() != null && !values.tags().isEmpty()) {
            properties.set(PageSchema.TAGS, multiSelect(values.tags()));
        }
        if (values.pinned() != null) {
            properties.putObject(PageSchema.PINNED).put("checkbox", values.pinned());
        }
        if (hasText(values.sourceUrl())) {
            properties.putObject(PageSchema.SOURCE_URL).put("url", values.sourceUrl());
        }
        if (values.createdAt() != null) {
            properties.set(PageSchema.CREATED_AT, date(values.createdAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)));
        }
        if (values.updatedAt() != null) {
            properties.set(PageSchema.UPDATED_AT, date(values.updatedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)));
        }
        if (values.fileCount() != null) {
            properties.putObject(PageSchema.FILE_COUNT).put("number", values.fileCount());
        }
        if (values.linkCount() != null) {
            properties.putObject(PageSchema.LINK_COUNT).put("number", values.linkCount());
        }
        if (hasText(values.status())) {
            properties.set(PageSchema.STATUS, select(values.status()));
        }
        if (values.summary() != null) {
            properties.putObject(PageSchema.SUMMARY).set("rich_text", textArray(values.summary()));
        }
        return properties;
    }
    
    public ObjectNode buildUpdatePayload(PageProperties values) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("properties", buildProperties(values));
        return payload;
    }
    
    /**
     * Builds a {@code PATCH /pages/{id}} body from loosely typed values:
     * <ul>
     *   <li>date and time types: {@code date}</li>
     *   <li>Boolean: {@code checkbox}</li>
     *   <li>Number: {@code number}</li>
     *   <li>String: {@code rich_text}</li>
     *   <li>Collection: {@code multi_select}, one option per element</li>
     *   <li>anything else is taken as ready-made wire JSON</li>
     * </ul>
     * Null values are skipped.
     */
    public ObjectNode buildUpdatePayload(Map<String, ?> values) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode properties = payload.putObject("properties");
        
        values.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            String isoDate = isoDate(value);
            if (isoDate != null) {
                properties.set(name, date(isoDate));
            } else if (value instanceof Boolean flag) {
                properties.putObject(name).put("checkbox", flag);
            } else if (value instanceof Number number) {
                properties.putObject(name).set("number", objectMapper.valueToTree(number));
            } else if (value instanceof String text) {
                properties.putObject(name).set("rich_text", textArray(text));
            } else if (value instanceof Collection<?> options) {
                properties.set(name, multiSelect(options.stream().map(String::valueOf).toList()));
            } else {
                properties.set(name, objectMapper.valueToTree(value));
            }
        });
        return payload;
    }
    
    /**
     * Lazily maps text to paragraph blocks, one per chunk.
     */
    public Stream<ObjectNode> paragraphBlocks(String text) {
        return TextChunker.chunks(text, MAX_TEXT_LENGTH).map(this::paragraph);
    }
    
    /**
     * Block embedding a confirmed upload, captioned with its file name.
     */
    public ObjectNode fileBlock(CompletedUpload upload) {
        String blockType = upload.blockType().getBlockType();
        
        ObjectNode block = objectMapper.createObjectNode();
        block.put("object", "block");
        block.put("type", blockType);
        ObjectNode content = block.putObject(blockType);
        content.put("type", "file_upload");
        content.putObject("file_upload").put("id", upload.uploadId());
        if (hasText(upload.fileName())) {
            content.set("caption", textArray(upload.fileName()));
        }
        return block;
    }
    
    private ObjectNode paragraph(String content) {
        ObjectNode block = objectMapper.createObjectNode();
        block.put("object", "block");
        block.put("type", "paragraph");
        block.putObject("paragraph").set("rich_text", textArray(content));
        return block;
    }
    
    private ArrayNode textArray(String content) {
        ArrayNode array = objectMapper.createArrayNode();
        if (content.isEmpty()) {
            array.add(textObject(content));
            return array;
        }
        TextChunker.chunks(content, MAX_TEXT_LENGTH).forEach(chunk -> array.add(textObject(chunk)));
        return array;
    }
    
    private ObjectNode textObject(String content) {
        ObjectNode text = objectMapper.createObjectNode();
        text.put("type", "text");
        text.putObject("text").put("content", content);
        return text;
    }
    
    private ObjectNode select(String name) {
        ObjectNode property = objectMapper.createObjectNode();
        property.putObject("select").put("name", name);
        return property;
    }
    
    private ObjectNode multiSelect(List<String> names) {
        ObjectNode property = objectMapper.createObjectNode();
        ArrayNode options = property.putArray("multi_select");
        names.forEach(name -> options.addObject().put("name", name));
        return property;
    }
    
    private ObjectNode date(String start) {
        ObjectNode property = objectMapper.createObjectNode();
        property.putObject("date").put("start", start);
        return property;
    }
    
    private static String isoDate(Object value) {
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        if (value instanceof LocalDate date) {
            return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        return null;
    }
    
    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
