package com.starscape.notionsync.features.pages.domain;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Typed values of one page of the target database. Null means "not set";
 * unset values are left out of the request.
 *
 * @param title      title
 * @param source     select
 * @param tags       multi-select
 * @param pinned     checkbox
 * @param sourceUrl  url
 * @param createdAt  date
 * @param updatedAt  date
 * @param fileCount  number
 * @param linkCount  number
 * @param status     select
 * @param summary    rich text
 */
public record PageProperties(
    String title,
    String source,
    List<String> tags,
    Boolean pinned,
    String sourceUrl,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    Integer fileCount,
    Integer linkCount,
    String status,
    String summary
) {
    
    public PageProperties {
        tags = tags == null ? null : List.copyOf(tags);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public PageProperties withTitle(String newTitle) {
        return new PageProperties(newTitle, source, tags, pinned, sourceUrl, createdAt, updatedAt,
            fileCount, linkCount, status, summary);
    }
    
    public static class Builder {
        private String title;
        private String source;
        private List<String> tags;
        private Boolean pinned;
        private String sourceUrl;
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;
        private Integer fileCount;
        private Integer linkCount;
        private String status;
        private String summary;
        
        public Builder title(String title) {
            this.title = title;
            return this;
        }
        
        public Builder source(String source) {
            this.source = source;
            return this;
        }
        
        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }
        
        public Builder pinned(Boolean pinned) {
            this.pinned = pinned;
            return this;
        }
        
        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }
        
        public Builder createdAt(OffsetDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }
        
        public Builder updatedAt(OffsetDateTime updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }
        
        public Builder fileCount(Integer fileCount) {
            this.fileCount = fileCount;
            return this;
        }
        
        public Builder linkCount(Integer linkCount) {
            this.linkCount = linkCount;
            return this;
        }
        
        public Builder status(String status) {
            this.status = status;
            return this;
        }
        
        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }
        
        public PageProperties build() {
            return new PageProperties(title, source, tags, pinned, sourceUrl, createdAt, updatedAt,
                fileCount, linkCount, status, summary);
        }
    }
}
