package com.starscape.notionsync.common.http;

/**
 * Issues HTTP requests and hands back status and body without interpreting them.
 * Implementations must be safe for concurrent use.
 */
public interface NotionTransport extends AutoCloseable {
    
    /**
     * @throws com.starscape.notionsync.common.exception.NotionTransportException
     *         when no response was received (connection refused, timeout, I/O error)
     *         or the transport has been closed
     */
    TransportResponse exchange(TransportRequest request);
    
    /**
     * Releases the underlying connections. Further requests fail.
     */
    @Override
    void close();
}
