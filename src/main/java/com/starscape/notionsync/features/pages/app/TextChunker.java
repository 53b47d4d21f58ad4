package com.starscape.notionsync.features.pages.app;

import java.util.stream.Stream;

/**
 * Splits long text into pieces that fit Notion's per-block text limit.
 */
public final class TextChunker {
    
    private TextChunker() {
    }
    
    /**
     * Lazily yields consecutive chunks of at most {@code maxLength} chars.
     * A surrogate pair is never split. The stream can be consumed once.
     */
    public static Stream<String> chunks(String text, int maxLength) {
        if (maxLength < 2) {
            throw new IllegalArgumentException("maxLength must be at least 2");
        }
        if (text == null || text.isEmpty()) {
            return Stream.empty();
        }
        return Stream.iterate(0, start -> start < text.length(), start -> chunkEnd(text, start, maxLength))
                .map(start -> text.substring(start, chunkEnd(text, start, maxLength)));
    }
    
    private static int chunkEnd(String text, int start, int maxLength) {
        int end = Math.min(text.length(), start + maxLength);
        if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return end;
    }
}
