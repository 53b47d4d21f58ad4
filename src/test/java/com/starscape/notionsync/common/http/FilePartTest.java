package com.starscape.notionsync.common.http;

import com.starscape.notionsync.common.exception.ErrorKind;
import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilePartTest {
    
    @Test
    void shouldRejectBlankFileName() {
        InvalidUploadRequestException e = assertThrows(InvalidUploadRequestException.class,
            () -> new FilePart(" ", "text/plain", new byte[0]));
        
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
    
    @Test
    void shouldRejectMissingContent() {
        assertThrows(InvalidUploadRequestException.class, () -> new FilePart("a.txt", "text/plain", null));
    }
}
