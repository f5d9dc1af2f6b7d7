package com.auditeng.backend.extraction;

import java.time.Duration;

/**
 * Blocking wait between retries.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
