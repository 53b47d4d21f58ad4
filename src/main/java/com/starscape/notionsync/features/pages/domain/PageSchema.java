package com.starscape.notionsync.features.pages.domain;

/**
 * Property names of the target database.
 */
public final class PageSchema {
    
    public static final String TITLE = "Title";
    public static final String SOURCE = "Source";
    public static final String TAGS = "Tags";
    public static final String PINNED = "Pinned";
    public static final String SOURCE_URL = "Source URL";
    public static final String CREATED_AT = "Created At";
    public static final String UPDATED_AT = "Updated At";
    public static final String FILE_COUNT = "File Count";
    public static final String LINK_COUNT = "Link Count";
    public static final String STATUS = "Status";
    public static final String SUMMARY = "Summary";
    
    private PageSchema() {
    }
}
