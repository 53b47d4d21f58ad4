package com.starscape.notionsync.features.fileupload.app;

import com.starscape.notionsync.common.exception.ErrorKind;
import com.starscape.notionsync.common.exception.InvalidUploadRequestException;
import com.starscape.notionsync.features.fileupload.domain.UploadMode;
import com.starscape.notionsync.features.fileupload.domain.UploadPlan;
import com.starscape.notionsync.features.fileupload.domain.UploadRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UploadPlannerTest {
    
    private static final long MB = 1024L * 1024;
    
    private final UploadPlanner planner = new UploadPlanner();
    
    @Test
    void shouldSplitLargeFileIntoParts() {
        UploadPlan plan = planner.plan(UploadRequest.ofFile("video.mp4", "video/mp4", 24 * MB));
        
        assertEquals(UploadMode.MULTI_PART, plan.mode());
        assertEquals(3, plan.numberOfParts());
        assertEquals(10 * MB, plan.partSizeBytes());
    }
    
    @Test
    void shouldUseSinglePartAtThreshold() {
        UploadPlan plan = planner.plan(UploadRequest.ofFile("doc.pdf", "application/pdf", 20 * MB));
        
        assertEquals(UploadMode.SINGLE_PART, plan.mode());
        assertNull(plan.numberOfParts());
    }
    
    @Test
    void shouldUseMultiPartJustAboveThreshold() {
        UploadPlan plan = planner.plan(20 * MB + 1, null);
        
        assertEquals(UploadMode.MULTI_PART, plan.mode());
        assertEquals(3, plan.numberOfParts());
    }
    
    @Test
    void shouldUseSinglePartWhenSizeIsUnknown() {
        assertEquals(UploadMode.SINGLE_PART, planner.plan(null, null).mode());
        assertFalse(planner.shouldUseMultipart(null));
    }
    
    @Test
    void shouldPlanExternalUrlRegardlessOfSize() {
        UploadPlan plan = planner.plan(UploadRequest.ofExternalUrl("logo.png", "image/png", "HTTPS://cdn.example.com/logo.png"));
        
        assertEquals(UploadMode.EXTERNAL_URL, plan.mode());
        assertNull(plan.numberOfParts());
    }
    
    @Test
    void shouldRejectInsecureExternalUrl() {
        InvalidUploadRequestException e = assertThrows(InvalidUploadRequestException.class,
            () -> planner.plan(null, "http://cdn.example.com/logo.png"));
        
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }
    
    @Test
    void shouldRejectSizesBeyondOneArray() {
        assertThrows(IllegalArgumentException.class, () -> new UploadPlanner(3L * 1024 * MB, 10 * MB));
        assertThrows(IllegalArgumentException.class, () -> new UploadPlanner(20 * MB, Integer.MAX_VALUE + 1L));
    }
    
    @Test
    void shouldRoundPartCountUp() {
        UploadPlanner small = new UploadPlanner(10, 4);
        
        assertEquals(3, small.partCount(11));
        assertEquals(3, small.partCount(12));
        assertEquals(4, small.partCount(13));
    }
}
