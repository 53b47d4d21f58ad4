package com.starscape.notionsync.features.fileupload.infra;

import com.starscape.notionsync.features.fileupload.domain.FileSource;

import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;

public class ByteArrayFileSource implements FileSource {
    
    private final byte[] content;
    
    public ByteArrayFileSource(byte[] content) {
        this.content = content;
    }
    
    @Override
    public long size() {
        return content.length;
    }
    
    @Override
    public byte[] read(long offset, int length) throws IOException {
        if (offset < 0 || offset + length > content.length) {
            throw new EOFException(String.format(
                "Range %d+%d is outside of %d bytes", offset, length, content.length));
        }
        return Arrays.copyOfRange(content, (int) offset, (int) offset + length);
    }
}
