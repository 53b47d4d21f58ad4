package com.starscape.notionsync.features.fileupload.app;

import java.time.Duration;

/**
 * Backoff pause between status polls.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
