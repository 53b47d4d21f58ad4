package com.starscape.notionsync.features.fileupload.domain;

import java.io.IOException;

/**
 * Random-access source of the bytes being uploaded.
 */
public interface FileSource {
    
    long size() throws IOException;
    
    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     */
    byte[] read(long offset, int length) throws IOException;
}
