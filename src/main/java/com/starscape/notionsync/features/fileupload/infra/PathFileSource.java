package com.starscape.notionsync.features.fileupload.infra;

import com.starscape.notionsync.features.fileupload.domain.FileSource;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads part ranges straight from a file on disk; each read opens and closes the file.
 */
public class PathFileSource implements FileSource {
    
    private final Path path;
    
    public PathFileSource(Path path) {
        this.path = path;
    }
    
    @Override
    public long size() throws IOException {
        return Files.size(path);
    }
    
    @Override
    public byte[] read(long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new EOFException(String.format(
                        "Unexpected end of %s at byte %d (wanted %d bytes from %d)", path, position, length, offset));
                }
                position += read;
            }
        }
        return buffer.array();
    }
}
