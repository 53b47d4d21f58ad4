package com.starscape.notionsync.common.http;

/**
 * Raw outcome of a request that reached the server.
 */
public record TransportResponse(
    int statusCode,
    String statusText,
    String body
) {
    
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
