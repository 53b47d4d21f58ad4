package com.starscape.notionsync.features.fileupload.domain;

/**
 * Upload modes of the file upload endpoint, with their wire values.
 */
public enum UploadMode {
    SINGLE_PART("single_part"),
    MULTI_PART("multi_part"),
    EXTERNAL_URL("external_url");
    
    private final String wireValue;
    
    UploadMode(String wireValue) {
        this.wireValue = wireValue;
    }
    
    public String getWireValue() {
        return wireValue;
    }
}
