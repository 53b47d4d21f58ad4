package com.starscape.notionsync.features.fileupload.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Block type used to embed an uploaded file, chosen from its MIME type.
 */
public enum FileBlockType {
    IMAGE("image", Set.of("image/jpeg", "image/png", "image/gif", "image/webp", "image/svg+xml")),
    VIDEO("video", Set.of("video/mp4", "video/quicktime", "video/x-msvideo", "video/webm")),
    AUDIO("audio", Set.of("audio/mpeg", "audio/mp4", "audio/wav", "audio/ogg", "audio/webm")),
    PDF("pdf", Set.of("application/pdf")),
    FILE("file", Set.of());
    
    private final String blockType;
    private final Set<String> mimeTypes;
    
    FileBlockType(String blockType, Set<String> mimeTypes) {
        this.blockType = blockType;
        this.mimeTypes = mimeTypes;
    }
    
    public String getBlockType() {
        return blockType;
    }
    
    public static FileBlockType forMimeType(String mimeType) {
        if (mimeType == null) {
            return FILE;
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT).trim();
        for (FileBlockType type : values()) {
            if (type.mimeTypes.contains(normalized)) {
                return type;
            }
        }
        return FILE;
    }
}
