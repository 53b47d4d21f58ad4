package com.starscape.notionsync.features.pages.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.notionsync.common.exception.NotionPageException;
import com.starscape.notionsync.features.pages.domain.PageProperties;
import com.starscape.notionsync.features.pages.domain.PageSchema;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads typed page values back out of a Notion {@code properties} object.
 * Accepts both API responses ({@code plain_text}) and request payloads
 * ({@code text.content}).
 */
@Service
public class PagePropertiesParser {
    
    private static final int DATE_ONLY_LENGTH = "yyyy-MM-dd".length();
    
    /**
     * @param page a page object as returned by {@code GET /pages/{id}}
     */
    public PageProperties parsePage(JsonNode page) {
        return parse(page.path("properties"));
    }
    
    public PageProperties parse(JsonNode properties) {
        return PageProperties.builder()
                .title(text(properties.path(PageSchema.TITLE).path("title")))
                .source(selectName(properties.path(PageSchema.SOURCE)))
                .tags(multiSelect(properties.path(PageSchema.TAGS)))
                .pinned(checkbox(properties.path(PageSchema.PINNED)))
                .sourceUrl(textValue(properties.path(PageSchema.SOURCE_URL).path("url")))
                .createdAt(dateStart(properties.path(PageSchema.CREATED_AT)))
                .updatedAt(dateStart(properties.path(PageSchema.UPDATED_AT)))
                .fileCount(number(properties.path(PageSchema.FILE_COUNT)))
                .linkCount(number(properties.path(PageSchema.LINK_COUNT)))
                .status(selectName(properties.path(PageSchema.STATUS)))
                .summary(text(properties.path(PageSchema.SUMMARY).path("rich_text")))
                .build();
    }
    
    private static String text(JsonNode richText) {
        if (!richText.isArray()) {
            return null;
        }
        StringBuilder content = new StringBuilder();
        for (JsonNode item : richText) {
            JsonNode plain = item.path("plain_text");
            content.append(plain.isTextual() ? plain.asText() : item.path("text").path("content").asText(""));
        }
        return content.toString();
    }
    
    private static String selectName(JsonNode property) {
        return textValue(property.path("select").path("name"));
    }
    
    private static List<String> multiSelect(JsonNode property) {
        JsonNode options = property.path("multi_select");
        if (!options.isArray()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        options.forEach(option -> names.add(option.path("name").asText()));
        return names;
    }
    
    private static Boolean checkbox(JsonNode property) {
        JsonNode value = property.path("checkbox");
        return value.isBoolean() ? value.asBoolean() : null;
    }
    
    private static Integer number(JsonNode property) {
        JsonNode value = property.path("number");
        return value.isNumber() ? value.asInt() : null;
    }
    
    /**
     * Date-only values become midnight UTC. A datetime without an offset is
     * read in the property's {@code time_zone}, or UTC when there is none.
     */
    private static OffsetDateTime dateStart(JsonNode property) {
        JsonNode date = property.path("date");
        String start = textValue(date.path("start"));
        if (start == null) {
            return null;
        }
        try {
            if (start.length() == DATE_ONLY_LENGTH) {
                return LocalDate.parse(start).atStartOfDay().atOffset(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                start, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime dateTime) {
                return dateTime;
            }
            LocalDateTime local = (LocalDateTime) parsed;
            String timeZone = textValue(date.path("time_zone"));
            return timeZone == null
                ? local.atOffset(ZoneOffset.UTC)
                : local.atZone(ZoneId.of(timeZone)).toOffsetDateTime();
        } catch (DateTimeException e) {
            throw new NotionPageException("Unreadable date value " + start + ": " + e.getMessage());
        }
    }
    
    private static String textValue(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
