package com.starscape.notionsync.common.logging;

/**
 * Shortens Notion ids for log lines.
 */
public final class LogIds {
    
    private static final int SHORT_ID_LENGTH = 8;
    
    private LogIds() {
    }
    
    public static String shortId(String id) {
        if (id == null) {
            return null;
        }
        return id.length() > SHORT_ID_LENGTH ? id.substring(0, SHORT_ID_LENGTH) : id;
    }
}
